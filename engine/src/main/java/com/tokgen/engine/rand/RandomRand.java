package com.tokgen.engine.rand;

import java.util.Objects;
import java.util.Random;

/** {@link Rand} backed by a {@link java.util.Random}. */
public final class RandomRand implements Rand {
    private final Random random;

    public RandomRand() {
        this(new Random());
    }

    public RandomRand(long seed) {
        this(new Random(seed));
    }

    public RandomRand(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public int nextInt() {
        return random.nextInt(Integer.MAX_VALUE);
    }

    @Override
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return random.nextInt(bound);
    }

    @Override
    public long nextLong(long bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return random.nextLong(bound);
    }
}
