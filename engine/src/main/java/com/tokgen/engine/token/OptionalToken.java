package com.tokgen.engine.token;

/** Token that can be switched between being absent and being present exactly once. */
public interface OptionalToken extends Token {

    /** Checks whether the token is optional in its current state. */
    boolean isOptional();

    void activate();

    void deactivate();
}
