package com.tokgen.engine.token;

/** Signals that a permutation index does not address a choice of the token. */
public final class PermutationException extends Exception {

    public enum Type {
        INDEX_OUT_OF_BOUND
    }

    private final Type type;
    private final long index;
    private final long permutations;

    public PermutationException(Type type, long index, long permutations) {
        super("permutation " + index + " is out of bound [1, " + permutations + "]");
        this.type = type;
        this.index = index;
        this.permutations = permutations;
    }

    public Type type() {
        return type;
    }

    public long index() {
        return index;
    }

    public long permutations() {
        return permutations;
    }
}
