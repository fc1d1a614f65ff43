package com.lshann.common;

import java.util.SplittableRandom;

/**
 * Derivation of per-table hasher seeds from one index-level seed.
 *
 * <p>Seed {@code 0} draws from a randomly seeded generator. Any other value yields the
 * same sequence of sub-seeds every time, in table order.</p>
 */
public final class Seeds {

    private Seeds() {
    }

    public static SplittableRandom createRng(long seed) {
        return seed == 0L ? new SplittableRandom() : new SplittableRandom(seed);
    }

    /** Draws {@code count} sub-seeds from one stream; element {@code i} belongs to table {@code i}. */
    public static long[] derive(long seed, int count) {
        SplittableRandom rng = createRng(seed);
        long[] out = new long[count];
        for (int i = 0; i < count; i++) {
            out[i] = rng.nextLong();
        }
        return out;
    }
}
