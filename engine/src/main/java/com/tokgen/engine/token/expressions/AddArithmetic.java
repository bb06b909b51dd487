package com.tokgen.engine.token.expressions;

import com.tokgen.engine.token.Token;

/** Sum of both operands. */
public final class AddArithmetic extends BinaryArithmetic {

    public AddArithmetic(Token a, Token b) {
        super(a, b);
    }

    @Override
    protected String symbol() {
        return "+";
    }

    @Override
    protected long apply(long left, long right) {
        return left + right;
    }

    @Override
    protected BinaryArithmetic create(Token a, Token b) {
        return new AddArithmetic(a, b);
    }
}
