package com.tokgen.engine.rand;

/**
 * Random source consumed by every token when it is fuzzed.
 *
 * <p>Implementations decide about seeding and thread-safety; tokens only ever draw from the
 * source on the caller's thread.
 */
public interface Rand {

    /** Returns a uniformly distributed non-negative {@code int}. */
    int nextInt();

    /** Returns a uniformly distributed {@code int} in {@code [0, bound)}. */
    int nextInt(int bound);

    /** Returns a uniformly distributed {@code long} in {@code [0, bound)}. */
    long nextLong(long bound);
}
