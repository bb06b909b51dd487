package com.tokgen.engine.token;

/** Arithmetic over permutation counts. */
public final class Permutations {

    /** Count reported once a combinatorial space no longer fits into a {@code long}. */
    public static final long MAX = Long.MAX_VALUE;

    private Permutations() {}

    /** Multiplies two counts, saturating at {@link #MAX}. */
    public static long multiply(long a, long b) {
        if (a == 0 || b == 0) {
            return 0;
        }
        if (a > MAX / b) {
            return MAX;
        }
        return a * b;
    }

    /** Multiplies the local count with the total count of every child. */
    public static long all(Token token, Iterable<Token> children) {
        long total = token.permutations();
        for (Token child : children) {
            total = multiply(total, child.permutationsAll());
        }
        return total;
    }

    /**
     * Validates a 1-based permutation index.
     *
     * @throws PermutationException if {@code i} is outside {@code [1, permutations]}
     */
    public static void checkIndex(long i, long permutations) throws PermutationException {
        if (i < 1 || i > permutations) {
            throw new PermutationException(
                    PermutationException.Type.INDEX_OUT_OF_BOUND, i, permutations);
        }
    }
}
