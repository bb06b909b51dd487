package com.tokgen.engine.token;

/** Token with an ordered list of visible children, the ones rendering and parsing walk. */
public interface ListToken extends Token {

    /** Returns the visible child at {@code i}. */
    Token get(int i);

    int len();
}
