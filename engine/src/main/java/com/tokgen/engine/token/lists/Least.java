package com.tokgen.engine.token.lists;

import com.tokgen.engine.rand.Rand;
import com.tokgen.engine.token.InternalListToken;
import com.tokgen.engine.token.InternalParser;
import com.tokgen.engine.token.ListException;
import com.tokgen.engine.token.ListToken;
import com.tokgen.engine.token.NotYetImplementedException;
import com.tokgen.engine.token.OptionalToken;
import com.tokgen.engine.token.ParseResult;
import com.tokgen.engine.token.ParserError;
import com.tokgen.engine.token.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repeats a template token at least {@code n} times.
 *
 * <p>The template is only a pattern: it is never rendered, and every element of the list is an
 * independent deep copy of it. The visible view holds the elements, the internal view holds just
 * the template, so rewriting passes act on the template and the elements follow.
 *
 * <p>Fuzzing picks a length uniformly in {@code [n, n + maxRepeat]}.
 */
public final class Least implements ListToken, InternalListToken, OptionalToken {
    /** Default number of elements a fuzzed list may hold beyond its minimum. */
    public static final int DEFAULT_MAX_REPEAT = 64;

    private static final Logger log = LoggerFactory.getLogger(Least.class);

    private final int n;
    private final int maxRepeat;
    private Token template;
    private List<Token> value;

    public Least(Token template, int n) {
        this(template, n, DEFAULT_MAX_REPEAT);
    }

    public Least(Token template, int n, int maxRepeat) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative: " + n);
        }
        if (maxRepeat < 0 || maxRepeat > Integer.MAX_VALUE - 1 - n) {
            throw new IllegalArgumentException("maxRepeat out of range: " + maxRepeat);
        }
        this.n = n;
        this.maxRepeat = maxRepeat;
        this.template = Objects.requireNonNull(template, "template");
        this.value = copies(n);
    }

    private Least(Token template, int n, int maxRepeat, List<Token> value) {
        this.n = n;
        this.maxRepeat = maxRepeat;
        this.template = template;
        this.value = value;
    }

    public int n() {
        return n;
    }

    public int maxRepeat() {
        return maxRepeat;
    }

    public Token template() {
        return template;
    }

    @Override
    public Token deepCopy() {
        List<Token> elements = new ArrayList<>(value.size());
        for (Token token : value) {
            elements.add(token.deepCopy());
        }
        return new Least(template.deepCopy(), n, maxRepeat, elements);
    }

    @Override
    public void fuzz(Rand r) {
        value = copies(n + r.nextInt(maxRepeat + 1));
    }

    @Override
    public void fuzzAll(Rand r) {
        fuzz(r);

        for (int i = 0; i < value.size(); i++) {
            value.get(i).fuzzAll(r);
        }
    }

    /**
     * Parses fresh copies of the template one after another until a copy fails. Copies that
     * consume nothing only count towards the minimum.
     */
    @Override
    public ParseResult parse(InternalParser parser, int cur) {
        List<Token> matched = new ArrayList<>();
        int position = cur;
        List<ParserError> lastErrors = List.of();

        while (true) {
            Token element = template.deepCopy();
            ParseResult result = element.parse(parser, position);
            if (!result.isSuccess()) {
                lastErrors = result.errors();
                break;
            }
            if (result.cursor() == position && matched.size() >= n) {
                break;
            }
            matched.add(element);
            position = result.cursor();
        }

        if (matched.size() < n) {
            log.debug("Matched {} of at least {} elements at {}", matched.size(), n, cur);
            return ParseResult.failure(cur, lastErrors);
        }
        value = matched;
        return ParseResult.success(position);
    }

    @Override
    public void permutation(long i) {
        throw new NotYetImplementedException("permutation of Least");
    }

    @Override
    public long permutations() {
        throw new NotYetImplementedException("permutations of Least");
    }

    @Override
    public long permutationsAll() {
        throw new NotYetImplementedException("permutationsAll of Least");
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Token token : value) {
            sb.append(token.render());
        }
        return sb.toString();
    }

    @Override
    public Token get(int i) {
        if (i < 0 || i >= value.size()) {
            throw new ListException(ListException.Type.OUT_OF_BOUND, i, value.size());
        }
        return value.get(i);
    }

    @Override
    public int len() {
        return value.size();
    }

    @Override
    public Token internalGet(int i) {
        if (i != 0) {
            throw new ListException(ListException.Type.OUT_OF_BOUND, i, internalLen());
        }
        return template;
    }

    @Override
    public int internalLen() {
        return 1;
    }

    @Override
    public Token internalLogicalRemove(Token token) {
        if (token == template) {
            return null;
        }
        return this;
    }

    @Override
    public void internalReplace(Token oldToken, Token newToken) {
        if (oldToken != template) {
            return;
        }
        template = Objects.requireNonNull(newToken, "newToken");
        value = copies(value.size());
        log.debug("Template replaced, regenerated {} elements", value.size());
    }

    @Override
    public boolean isOptional() {
        return n == 0;
    }

    @Override
    public void activate() {
        if (n > 0) {
            return;
        }
        value = copies(1);
    }

    @Override
    public void deactivate() {
        if (n > 0) {
            return;
        }
        value = new ArrayList<>();
    }

    @Override
    public String toString() {
        return "Least(" + n + ", " + template + ")";
    }

    private List<Token> copies(int count) {
        List<Token> elements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            elements.add(template.deepCopy());
        }
        return elements;
    }
}
