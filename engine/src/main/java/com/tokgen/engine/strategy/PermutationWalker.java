package com.tokgen.engine.strategy;

import com.tokgen.engine.token.PermutationException;
import com.tokgen.engine.token.Permutations;
import com.tokgen.engine.token.Token;
import com.tokgen.engine.util.TokenOps;

/**
 * Sets a whole tree from a single permutation index.
 *
 * <p>The 0-based index is read in mixed radix: the lowest digit selects the token's own
 * permutation, the following digits select each visible child's total permutation in child
 * order. Every index in {@code [1, root.permutationsAll()]} therefore addresses a distinct
 * combination.
 */
public final class PermutationWalker {

    private PermutationWalker() {}

    /**
     * Applies the {@code i}-th total permutation to {@code root}, 1-based.
     *
     * @throws PermutationException if {@code i} is outside {@code [1, root.permutationsAll()]};
     *     the tree is left untouched
     */
    public static void permutation(Token root, long i) throws PermutationException {
        Permutations.checkIndex(i, root.permutationsAll());

        apply(root, i - 1);
    }

    private static void apply(Token token, long index) throws PermutationException {
        long local = token.permutations();
        token.permutation(index % local + 1);

        long rest = index / local;
        for (Token child : TokenOps.children(token)) {
            long childTotal = child.permutationsAll();
            apply(child, rest % childTotal);
            rest /= childTotal;
        }
    }
}
