package com.tokgen.engine.token;

import java.util.List;

/**
 * Outcome of {@link Token#parse(InternalParser, int)}. On success {@code errors} is empty and
 * {@code cursor} points behind the consumed input; on failure {@code cursor} is the cursor the
 * parse started at.
 */
public record ParseResult(int cursor, List<ParserError> errors) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public static ParseResult success(int cursor) {
        return new ParseResult(cursor, List.of());
    }

    public static ParseResult failure(int cursor, ParserError... errors) {
        if (errors.length == 0) {
            throw new IllegalArgumentException("failure needs at least one error");
        }
        return new ParseResult(cursor, List.of(errors));
    }

    public static ParseResult failure(int cursor, List<ParserError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("failure needs at least one error");
        }
        return new ParseResult(cursor, errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
