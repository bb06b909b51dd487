package com.tokgen.engine.token.expressions;

import com.tokgen.engine.rand.Rand;
import com.tokgen.engine.token.InternalListToken;
import com.tokgen.engine.token.InternalParser;
import com.tokgen.engine.token.ListException;
import com.tokgen.engine.token.ListToken;
import com.tokgen.engine.token.NotYetImplementedException;
import com.tokgen.engine.token.ParseResult;
import com.tokgen.engine.token.PermutationException;
import com.tokgen.engine.token.Permutations;
import com.tokgen.engine.token.Token;
import java.util.List;
import java.util.Objects;

/**
 * Binary operator over two integer-valued operands. The operands are rendered and combined on
 * every {@link #render()}; the operator itself has no choice of its own.
 *
 * <p>Operands are exposed at index 0 and 1 in both the visible and the internal view.
 */
public abstract class BinaryArithmetic implements ListToken, InternalListToken {
    private Token a;
    private Token b;

    protected BinaryArithmetic(Token a, Token b) {
        this.a = Objects.requireNonNull(a, "a");
        this.b = Objects.requireNonNull(b, "b");
    }

    public Token left() {
        return a;
    }

    public Token right() {
        return b;
    }

    /** Operator symbol used in diagnostics. */
    protected abstract String symbol();

    protected abstract long apply(long left, long right);

    /** Creates a token of the same operator over the given operands. */
    protected abstract BinaryArithmetic create(Token a, Token b);

    @Override
    public Token deepCopy() {
        return create(a.deepCopy(), b.deepCopy());
    }

    @Override
    public void fuzz(Rand r) {
        // the operator has no choice of its own
    }

    @Override
    public void fuzzAll(Rand r) {
        fuzz(r);

        a.fuzzAll(r);
        b.fuzzAll(r);
    }

    @Override
    public ParseResult parse(InternalParser parser, int cur) {
        throw new NotYetImplementedException("parsing of " + getClass().getSimpleName());
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
        return Permutations.all(this, List.of(a, b));
    }

    @Override
    public String render() {
        long left = operand(a);
        long right = operand(b);
        try {
            return Long.toString(apply(left, right));
        } catch (ArithmeticException e) {
            throw new IllegalStateException(
                    "cannot evaluate " + left + " " + symbol() + " " + right, e);
        }
    }

    @Override
    public Token get(int i) {
        return switch (i) {
            case 0 -> a;
            case 1 -> b;
            default -> throw new ListException(ListException.Type.OUT_OF_BOUND, i, len());
        };
    }

    @Override
    public int len() {
        return 2;
    }

    @Override
    public Token internalGet(int i) {
        return get(i);
    }

    @Override
    public int internalLen() {
        return len();
    }

    @Override
    public Token internalLogicalRemove(Token token) {
        if (token == a || token == b) {
            return null;
        }
        return this;
    }

    @Override
    public void internalReplace(Token oldToken, Token newToken) {
        Objects.requireNonNull(newToken, "newToken");
        if (oldToken == a) {
            a = newToken;
        }
        if (oldToken == b) {
            b = newToken;
        }
    }

    @Override
    public String toString() {
        return "(" + a + " " + symbol() + " " + b + ")";
    }

    private long operand(Token token) {
        String text = token.render();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "operand of " + symbol() + " rendered non-integer text \"" + text + "\"", e);
        }
    }
}
