package com.tokgen.engine.token;

import java.util.Objects;

/**
 * Structured parse failure.
 *
 * @param type kind of failure
 * @param message human readable description
 * @param position cursor at which the failing token started
 * @param expected shape the token expected
 * @param actual input that was found instead, empty at the end of input
 */
public record ParserError(Type type, String message, int position, String expected, String actual) {

    public enum Type {
        UNEXPECTED_EOF,
        UNEXPECTED_DATA
    }

    public ParserError {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(actual, "actual");
    }

    public static ParserError unexpectedEof(int position, String expected) {
        return new ParserError(
                Type.UNEXPECTED_EOF, "expected " + expected + " but got early EOF", position, expected, "");
    }

    public static ParserError unexpectedData(int position, String expected, String actual) {
        return new ParserError(
                Type.UNEXPECTED_DATA,
                "expected " + expected + " but got \"" + actual + "\"",
                position,
                expected,
                actual);
    }

    @Override
    public String toString() {
        return type + " at " + position + ": " + message;
    }
}
