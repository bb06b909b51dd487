package com.tokgen.engine.token;

/** Operation a token kind does not support yet. Never recovered from inside the engine. */
public final class NotYetImplementedException extends UnsupportedOperationException {

    public NotYetImplementedException(String message) {
        super(message);
    }
}
