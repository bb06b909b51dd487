package com.tokgen.engine.token.primitives;

import com.tokgen.engine.rand.Rand;
import com.tokgen.engine.token.InternalParser;
import com.tokgen.engine.token.ParseResult;
import com.tokgen.engine.token.ParserError;
import com.tokgen.engine.token.PermutationException;
import com.tokgen.engine.token.Permutations;
import com.tokgen.engine.token.Token;

/**
 * Integer token holding a value out of an inclusive range. Only every {@code step}-th value
 * starting at {@code from} is valid: {@code 1..10} with step {@code 2} holds 1, 3, 5, 7 and 9.
 */
public final class RangeInt implements Token {
    private final int from;
    private final int to;
    private final int step;

    private int value;

    public RangeInt(int from, int to) {
        this(from, to, 1);
    }

    public RangeInt(int from, int to, int step) {
        if (from > to) {
            throw new IllegalArgumentException("from " + from + " is bigger than to " + to);
        }
        if (step < 1) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
        this.from = from;
        this.to = to;
        this.step = step;
        this.value = from;
    }

    private RangeInt(RangeInt source) {
        this.from = source.from;
        this.to = source.to;
        this.step = source.step;
        this.value = source.value;
    }

    public int from() {
        return from;
    }

    public int to() {
        return to;
    }

    public int step() {
        return step;
    }

    public int value() {
        return value;
    }

    @Override
    public Token deepCopy() {
        return new RangeInt(this);
    }

    @Override
    public void fuzz(Rand r) {
        select(r.nextLong(permutations()));
    }

    @Override
    public void fuzzAll(Rand r) {
        fuzz(r);
    }

    /**
     * Reads the longest run of digits that does not exceed {@code to}, then checks that the value
     * lies in the range and on a step.
     */
    @Override
    public ParseResult parse(InternalParser parser, int cur) {
        if (cur >= parser.dataLen()) {
            return ParseResult.failure(cur, ParserError.unexpectedEof(cur, describe()));
        }

        int i = cur;
        long candidate = 0;
        while (i < parser.dataLen()) {
            char c = parser.charAt(i);
            if (c < '0' || c > '9') {
                break;
            }
            long next = candidate * 10 + (c - '0');
            if (next > to) {
                break;
            }
            candidate = next;
            i++;
        }

        if (i == cur || candidate < from || (candidate - from) % step != 0) {
            String got = i == cur ? parser.slice(cur, cur + 1) : parser.slice(cur, i);
            return ParseResult.failure(cur, ParserError.unexpectedData(cur, describe(), got));
        }

        value = (int) candidate;
        return ParseResult.success(i);
    }

    @Override
    public void permutation(long i) throws PermutationException {
        Permutations.checkIndex(i, permutations());

        select(i - 1);
    }

    @Override
    public long permutations() {
        return ((long) to - from) / step + 1;
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
        return "RangeInt(" + from + ".." + to + "/" + step + "=" + value + ")";
    }

    private void select(long index) {
        value = (int) (from + index * step);
    }

    private String describe() {
        return "integer in range " + from + "-" + to + " with step " + step;
    }
}
