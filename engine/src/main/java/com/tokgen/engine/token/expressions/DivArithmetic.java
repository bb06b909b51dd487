package com.tokgen.engine.token.expressions;

import com.tokgen.engine.token.Token;

/** Integer quotient of both operands, truncated towards zero. A zero divisor fails the render. */
public final class DivArithmetic extends BinaryArithmetic {

    public DivArithmetic(Token a, Token b) {
        super(a, b);
    }

    @Override
    protected String symbol() {
        return "/";
    }

    @Override
    protected long apply(long left, long right) {
        return left / right;
    }

    @Override
    protected BinaryArithmetic create(Token a, Token b) {
        return new DivArithmetic(a, b);
    }
}
