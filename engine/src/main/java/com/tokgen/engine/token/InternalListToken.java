package com.tokgen.engine.token;

/**
 * Token with structural children that a rewriting pass may replace or remove. The internal view
 * may differ from the visible one of {@link ListToken}: a repetition exposes its template here
 * and its materialized copies there.
 */
public interface InternalListToken extends Token {

    /** Returns the structural child at {@code i}. */
    Token internalGet(int i);

    int internalLen();

    /**
     * Removes {@code token} from this token's structural children.
     *
     * @return the token that should take this token's place, which is {@code this} when
     *     {@code token} is not a structural child, or {@code null} when this token has to be
     *     removed from its own parent
     */
    Token internalLogicalRemove(Token token);

    /**
     * Replaces {@code oldToken} with {@code newToken} if it is a structural child of this token.
     * Derived state is rebuilt before the call returns.
     */
    void internalReplace(Token oldToken, Token newToken);
}
