package com.tokgen.engine.token;

import java.util.Objects;

/** Input buffer shared by all tokens taking part in one parse. */
public final class InternalParser {
    private final String data;

    public InternalParser(String data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    public String data() {
        return data;
    }

    public int dataLen() {
        return data.length();
    }

    public char charAt(int index) {
        return data.charAt(index);
    }

    /** Returns the input between {@code from} and {@code to}, clamped to the buffer. */
    public String slice(int from, int to) {
        int start = Math.max(0, Math.min(from, data.length()));
        int end = Math.max(start, Math.min(to, data.length()));
        return data.substring(start, end);
    }
}
