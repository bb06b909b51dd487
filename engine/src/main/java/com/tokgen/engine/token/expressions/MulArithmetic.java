package com.tokgen.engine.token.expressions;

import com.tokgen.engine.token.Token;

/** Product of both operands. */
public final class MulArithmetic extends BinaryArithmetic {

    public MulArithmetic(Token a, Token b) {
        super(a, b);
    }

    @Override
    protected String symbol() {
        return "*";
    }

    @Override
    protected long apply(long left, long right) {
        return left * right;
    }

    @Override
    protected BinaryArithmetic create(Token a, Token b) {
        return new MulArithmetic(a, b);
    }
}
