package com.lshann.index.hash;

import com.lshann.common.DimensionMismatchException;
import com.lshann.common.LshException;
import com.lshann.common.Signature;
import com.lshann.common.VectorMath;

import java.util.SplittableRandom;

/**
 * Euclidean (p-stable) LSH.
 *
 * Each projection computes {@code h(v) = floor((a . v + b) / r)} with {@code a} drawn
 * from a standard normal distribution and {@code b} uniform in {@code [0, r)}.
 * See Datar et al., "Locality-sensitive hashing scheme based on p-stable
 * distributions", section 3.2.
 *
 * Thread-safety: immutable after construction.
 */
public final class L2Hasher implements HashFamily {

    private final int dimension;
    private final int numProjections;
    private final float r;
    private final long seed;

    private final float[][] a; // [numProjections][dimension]
    private final float[] b;   // [numProjections]

    /**
     * @param dim          vector dimension
     * @param r            bucket width, must be positive
     * @param nProjections signature length
     * @param seed         hasher seed; the same seed always yields the same projections
     * @throws LshException with kind INVALID_PARAMETER on bad arguments
     */
    public L2Hasher(int dim, float r, int nProjections, long seed) {
        HashFamilies.requireStructure(dim, nProjections);
        HashFamilies.requirePositive("r", r);

        this.dimension = dim;
        this.numProjections = nProjections;
        this.r = r;
        this.seed = seed;

        SplittableRandom rnd = new SplittableRandom(seed);
        this.a = VectorMath.gaussianMatrix(rnd, nProjections, dim);
        this.b = new float[nProjections];
        for (int i = 0; i < nProjections; i++) {
            b[i] = (float) (rnd.nextDouble() * r);
        }
    }

    @Override
    public Signature hashForStorage(float[] vector) {
        DimensionMismatchException.check(vector, dimension);
        return project(vector);
    }

    @Override
    public Signature hashForQuery(float[] vector) {
        DimensionMismatchException.check(vector, dimension);
        return project(vector);
    }

    /**
     * Hashes an already validated vector of length {@link #dimension()}.
     *
     * @throws LshException INVALID_PARAMETER if a bucket number is not finite or does not
     *                      fit in an {@code int}; such values would all collapse into one bucket
     */
    Signature project(float[] vector) {
        int[] out = new int[numProjections];
        for (int i = 0; i < numProjections; i++) {
            double h = Math.floor((VectorMath.dot(a[i], vector) + b[i]) / r);
            if (Double.isNaN(h) || h < Integer.MIN_VALUE || h > Integer.MAX_VALUE) {
                throw LshException.invalidParameter(String.format(
                        "L2 bucket %s of projection %d is outside the int range; check the vector or raise r",
                        h, i));
            }
            out[i] = (int) h;
        }
        return Signature.of(out);
    }

    public float getR() {
        return r;
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
        return String.format("L2Hasher{dim=%d, projections=%d, r=%.4f, seed=%d}",
                dimension, numProjections, r, seed);
    }

    @Override
    public String toString() {
        return getConfiguration();
    }
}
