package com.tokgen.engine.parse;

import com.tokgen.engine.token.InternalParser;
import com.tokgen.engine.token.ParseResult;
import com.tokgen.engine.token.ParserError;
import com.tokgen.engine.token.Token;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry point that matches a complete input against a token tree. */
public final class TokenParser {

    private static final Logger log = LoggerFactory.getLogger(TokenParser.class);

    private TokenParser() {}

    /**
     * Parses {@code input} from the start. The parse only succeeds if the tree consumes the whole
     * input; trailing data is reported as unexpected data.
     */
    public static ParseResult parse(Token root, String input) {
        Objects.requireNonNull(root, "root");
        InternalParser parser = new InternalParser(input);

        ParseResult result = root.parse(parser, 0);
        if (!result.isSuccess()) {
            log.debug("Parse failed: {}", result.errors());
            return result;
        }
        if (result.cursor() < parser.dataLen()) {
            ParserError error =
                    ParserError.unexpectedData(
                            result.cursor(), "EOF", parser.slice(result.cursor(), parser.dataLen()));
            log.debug("Parse left trailing data: {}", error);
            return ParseResult.failure(0, error);
        }
        return result;
    }
}
