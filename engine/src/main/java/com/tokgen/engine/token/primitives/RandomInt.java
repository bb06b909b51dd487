package com.tokgen.engine.token.primitives;

import com.tokgen.engine.rand.Rand;
import com.tokgen.engine.token.InternalParser;
import com.tokgen.engine.token.NotYetImplementedException;
import com.tokgen.engine.token.ParseResult;
import com.tokgen.engine.token.PermutationException;
import com.tokgen.engine.token.Permutations;
import com.tokgen.engine.token.Token;

/**
 * Integer token drawing a new value from the random source on every fuzz.
 *
 * <p>The token is fuzz-only: it declares a single permutation which resets the value to
 * {@code 0}.
 */
public final class RandomInt implements Token {
    private int value;

    public RandomInt() {
        this(0);
    }

    private RandomInt(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    @Override
    public Token deepCopy() {
        return new RandomInt(value);
    }

    @Override
    public void fuzz(Rand r) {
        value = r.nextInt();
    }

    @Override
    public void fuzzAll(Rand r) {
        fuzz(r);
    }

    @Override
    public ParseResult parse(InternalParser parser, int cur) {
        throw new NotYetImplementedException("parsing of RandomInt");
    }

    @Override
    public void permutation(long i) throws PermutationException {
        Permutations.checkIndex(i, permutations());

        value = 0;
    }

    @Override
    public long permutations() {
        return 1;
    }

    @Override
    public long permutationsAll() {
        return permutations();
    }

    @Override
    public boolean isEnumerable() {
        return false;
    }

    @Override
    public String render() {
        return Integer.toString(value);
    }

    @Override
    public String toString() {
        return "RandomInt(" + value + ")";
    }
}
