package com.lshann.index.hash;

import com.lshann.common.LshException;

/**
 * Shared construction-time validation.
 */
final class HashFamilies {

    private HashFamilies() {
    }

    static void requireStructure(int dim, int nProjections) {
        if (dim <= 0) {
            throw LshException.invalidParameter("dim must be > 0, got " + dim);
        }
        if (nProjections <= 0) {
            throw LshException.invalidParameter("n_projections must be > 0, got " + nProjections);
        }
    }

    static void requirePositive(String name, float value) {
        if (!(value > 0f) || Float.isInfinite(value)) {
            throw LshException.invalidParameter(name + " must be a positive finite number, got " + value);
        }
    }
}
