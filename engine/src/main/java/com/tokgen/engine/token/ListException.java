package com.tokgen.engine.token;

/** Thrown when a list token is accessed outside of its children. */
public final class ListException extends IndexOutOfBoundsException {

    public enum Type {
        OUT_OF_BOUND
    }

    private final Type type;

    public ListException(Type type, int index, int len) {
        super("index " + index + " is out of bound [0, " + len + ")");
        this.type = type;
    }

    public Type type() {
        return type;
    }
}
