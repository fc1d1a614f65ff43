package com.lshann.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class SeedsTest {

    @Test
    @DisplayName("A non-zero seed reproduces the same sub-seeds in the same order")
    void deterministicDerivation() {
        assertArrayEquals(Seeds.derive(1L, 10), Seeds.derive(1L, 10));
        assertFalse(Arrays.equals(Seeds.derive(1L, 10), Seeds.derive(2L, 10)));
    }

    @Test
    @DisplayName("Fewer tables draw a prefix of the same stream")
    void prefixStable() {
        long[] longer = Seeds.derive(99L, 8);
        long[] shorter = Seeds.derive(99L, 3);
        assertArrayEquals(shorter, Arrays.copyOf(longer, 3));
    }

    @Test
    void gaussianSamplesLookStandardNormal() {
        java.util.SplittableRandom r = new java.util.SplittableRandom(5L);
        double sum = 0, sq = 0;
        int n = 20_000;
        for (int i = 0; i < n; i++) {
            double g = VectorMath.nextGaussian(r);
            sum += g;
            sq += g * g;
        }
        double mean = sum / n;
        assertEquals(0.0, mean, 0.05);
        assertEquals(1.0, sq / n - mean * mean, 0.05);
    }
}
