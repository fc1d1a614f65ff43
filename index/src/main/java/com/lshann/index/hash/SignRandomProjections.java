package com.lshann.index.hash;

import com.lshann.common.DimensionMismatchException;
import com.lshann.common.Signature;
import com.lshann.common.VectorMath;

import java.util.SplittableRandom;

/**
 * Sign random projections (SimHash) for cosine / angular similarity.
 *
 * Each component is {@code 1} when {@code a . v > 0} and {@code 0} otherwise, where
 * {@code a} is a Gaussian random hyperplane normal. Two vectors agree on a component
 * with probability {@code 1 - theta / pi}.
 *
 * Thread-safety: immutable after construction.
 */
public final class SignRandomProjections implements HashFamily {

    private final int dimension;
    private final int numProjections;
    private final long seed;
    private final float[][] hyperplanes; // [numProjections][dimension]

    public SignRandomProjections(int nProjections, int dim, long seed) {
        HashFamilies.requireStructure(dim, nProjections);
        this.dimension = dim;
        this.numProjections = nProjections;
        this.seed = seed;
        this.hyperplanes = VectorMath.gaussianMatrix(new SplittableRandom(seed), nProjections, dim);
    }

    @Override
    public Signature hashForStorage(float[] vector) {
        return hash(vector);
    }

    @Override
    public Signature hashForQuery(float[] vector) {
        return hash(vector);
    }

    private Signature hash(float[] vector) {
        DimensionMismatchException.check(vector, dimension);
        int[] bits = new int[numProjections];
        for (int i = 0; i < numProjections; i++) {
            bits[i] = VectorMath.dot(hyperplanes[i], vector) > 0.0 ? 1 : 0;
        }
        return Signature.of(bits);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public int projections() {
        return numProjections;
    }

    @Override
    public String getConfiguration() {
        return String.format("SignRandomProjections{dim=%d, projections=%d, seed=%d}",
                dimension, numProjections, seed);
    }

    @Override
    public String toString() {
        return getConfiguration();
    }
}
