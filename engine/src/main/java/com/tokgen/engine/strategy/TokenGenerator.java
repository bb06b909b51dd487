package com.tokgen.engine.strategy;

import com.tokgen.engine.rand.Rand;
import com.tokgen.engine.rand.RandomRand;
import com.tokgen.engine.token.PermutationException;
import com.tokgen.engine.token.Token;
import com.tokgen.engine.util.TokenOps;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces rendered test inputs from a token tree, either by fuzzing or by walking the total
 * permutation space. Generation always works on a deep copy, the caller's tree is never changed.
 */
public final class TokenGenerator {

    private static final Logger log = LoggerFactory.getLogger(TokenGenerator.class);

    public enum Mode {
        RANDOM,
        ALL_PERMUTATIONS
    }

    public static final class Config {
        public Mode mode = Mode.RANDOM;
        public int count = 1;
        public long maxPermutations = 10_000;
        public Rand random = new RandomRand();
    }

    private final Config config;

    public TokenGenerator(Config config) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + config.count);
        }
        if (config.maxPermutations < 0) {
            throw new IllegalArgumentException(
                    "maxPermutations must not be negative: " + config.maxPermutations);
        }
        Objects.requireNonNull(config.random, "random");
    }

    public List<String> generate(Token root) {
        List<String> out = new ArrayList<>();
        generate(root, out::add);
        return out;
    }

    public void generate(Token root, Consumer<String> sink) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(sink, "sink");
        switch (config.mode) {
            case RANDOM -> fuzz(root, sink);
            case ALL_PERMUTATIONS -> enumerate(root, sink);
        }
    }

    private void fuzz(Token root, Consumer<String> sink) {
        for (int i = 0; i < config.count; i++) {
            Token copy = root.deepCopy();
            copy.fuzzAll(config.random);
            sink.accept(copy.render());
        }
        log.info("Generated {} random inputs", config.count);
    }

    private void enumerate(Token root, Consumer<String> sink) {
        Token copy = root.deepCopy();
        if (TokenOps.preOrder(copy).stream().anyMatch(token -> !token.isEnumerable())) {
            log.warn("Tree holds fuzz-only tokens, they keep placeholder values while enumerating");
        }
        long total = copy.permutationsAll();
        long limit = Math.min(total, config.maxPermutations);
        if (limit < total) {
            log.debug("Limiting {} permutations to {}", total, limit);
        }
        for (long i = 1; i <= limit; i++) {
            try {
                PermutationWalker.permutation(copy, i);
            } catch (PermutationException e) {
                throw new IllegalStateException("permutation " + i + " of " + total, e);
            }
            sink.accept(copy.render());
        }
        log.info("Generated {} of {} permutations", limit, total);
    }
}
