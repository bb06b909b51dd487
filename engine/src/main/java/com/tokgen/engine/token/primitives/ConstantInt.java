package com.tokgen.engine.token.primitives;

import com.tokgen.engine.rand.Rand;
import com.tokgen.engine.token.InternalParser;
import com.tokgen.engine.token.ParseResult;
import com.tokgen.engine.token.ParserError;
import com.tokgen.engine.token.PermutationException;
import com.tokgen.engine.token.Permutations;
import com.tokgen.engine.token.Token;

/** Integer token holding one fixed value. */
public final class ConstantInt implements Token {
    private int value;

    public ConstantInt(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public void setValue(int value) {
        this.value = value;
    }

    @Override
    public Token deepCopy() {
        return new ConstantInt(value);
    }

    @Override
    public void fuzz(Rand r) {
        // single value, nothing to choose
    }

    @Override
    public void fuzzAll(Rand r) {
        fuzz(r);
    }

    @Override
    public ParseResult parse(InternalParser parser, int cur) {
        String expected = Integer.toString(value);
        int next = cur + expected.length();

        if (next > parser.dataLen()) {
            return ParseResult.failure(cur, ParserError.unexpectedEof(cur, quote(expected)));
        }
        String got = parser.slice(cur, next);
        if (!expected.equals(got)) {
            return ParseResult.failure(cur, ParserError.unexpectedData(cur, quote(expected), got));
        }
        return ParseResult.success(next);
    }

    @Override
    public void permutation(long i) throws PermutationException {
        Permutations.checkIndex(i, permutations());
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
    public String render() {
        return Integer.toString(value);
    }

    @Override
    public String toString() {
        return "ConstantInt(" + value + ")";
    }

    private static String quote(String text) {
        return "\"" + text + "\"";
    }
}
