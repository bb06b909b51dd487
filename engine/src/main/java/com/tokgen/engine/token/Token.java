package com.tokgen.engine.token;

import com.tokgen.engine.rand.Rand;

/**
 * A node of the generation tree.
 *
 * <p>Every token holds a current value that can be chosen randomly ({@link #fuzz(Rand)}),
 * chosen by index ({@link #permutation(long)}), rendered ({@link #render()}) and re-read from
 * existing input ({@link #parse(InternalParser, int)}). Tokens own their children exclusively;
 * {@link #deepCopy()} never shares a descendant with the original.
 *
 * <p>Tokens are not thread-safe. Workers that generate in parallel each hold their own copy.
 */
public interface Token {

    /** Returns a deep copy of this token and all of its children. */
    Token deepCopy();

    /** Picks one of this token's own permutations. Children are left untouched. */
    void fuzz(Rand r);

    /**
     * Fuzzes this token and then calls {@code fuzzAll} on every visible child, walking the child
     * list as it stands after this token was fuzzed.
     */
    void fuzzAll(Rand r);

    /**
     * Tries to consume input starting at {@code cur}.
     *
     * @return the cursor after the token on success; the unchanged cursor and at least one error
     *     otherwise
     */
    ParseResult parse(InternalParser parser, int cur);

    /**
     * Sets this token to its {@code i}-th local choice, 1-based.
     *
     * @throws PermutationException if {@code i} is outside {@code [1, permutations()]}; the
     *     current value is kept
     */
    void permutation(long i) throws PermutationException;

    /** Number of local choices, not counting children. */
    long permutations();

    /**
     * Number of choices of this token multiplied by the {@code permutationsAll()} of every child,
     * saturated at {@link Permutations#MAX}.
     */
    long permutationsAll();

    /** Current flat textual value. */
    String render();

    /**
     * Whether {@link #permutation(long)} walks a real value domain. Fuzz-only tokens report
     * {@code false} and hold a placeholder value when set by index.
     */
    default boolean isEnumerable() {
        return true;
    }
}
