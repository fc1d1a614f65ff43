package com.lshann.index.hash;

import com.lshann.common.DimensionMismatchException;
import com.lshann.common.LshException;
import com.lshann.common.Signature;
import com.lshann.common.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asymmetric LSH for maximum inner product search (Shrivastava and Li, ALSH).
 *
 * <pre>
 *   P(x) = [ U*x/M, |U*x/M|^2, |U*x/M|^4, ..., |U*x/M|^(2^m) ]   (stored vectors)
 *   Q(q) = [ q/|q|, 1/2, 1/2, ..., 1/2 ]                          (query vectors)
 * </pre>
 *
 * Both embeddings have {@code dim + m} components and are hashed by one
 * {@link L2Hasher}. {@code M} is the largest stored norm. It is either given up front or
 * fitted once from the first vectors passed to {@link #fit(Iterable)}; after that it is
 * frozen, so signatures of earlier vectors stay valid. A stored vector longer than
 * {@code M} would push {@code |P(x)|} past {@code U}, so it is rejected.
 *
 * Thread-safety: not thread-safe until {@code M} is fixed; callers serialize stores.
 */
public final class MaximumInnerProduct implements HashFamily {
    private static final Logger logger = LoggerFactory.getLogger(MaximumInnerProduct.class);
    private static final double NORM_TOLERANCE = 1e-6;

    private final int dimension;
    private final float u;
    private final int m;
    private final L2Hasher hasher;
    private double maxNorm;

    /**
     * @param dim          vector dimension
     * @param r            bucket width of the inner L2 hasher
     * @param u            norm-rescaling bound, in (0, 1)
     * @param m            number of appended transform terms, at least 1
     * @param nProjections signature length
     * @param seed         hasher seed
     */
    public MaximumInnerProduct(int dim, float r, float u, int m, int nProjections, long seed) {
        this(dim, r, u, m, nProjections, seed, 0.0f);
    }

    /**
     * @param maxNorm largest expected stored norm; {@code 0} defers it to {@link #fit(Iterable)}
     */
    public MaximumInnerProduct(int dim, float r, float u, int m, int nProjections, long seed, float maxNorm) {
        HashFamilies.requireStructure(dim, nProjections);
        HashFamilies.requirePositive("r", r);
        if (!(u > 0f && u < 1f)) {
            throw LshException.invalidParameter("U must lie in (0, 1), got " + u);
        }
        if (m < 1) {
            throw LshException.invalidParameter("m must be >= 1, got " + m);
        }
        if (maxNorm < 0f || Float.isNaN(maxNorm) || Float.isInfinite(maxNorm)) {
            throw LshException.invalidParameter("maxNorm must be a finite value >= 0, got " + maxNorm);
        }
        this.dimension = dim;
        this.u = u;
        this.m = m;
        this.maxNorm = maxNorm;
        this.hasher = new L2Hasher(dim + m, r, nProjections, seed);
    }

    /**
     * Fixes {@code M} from the largest norm in {@code vectors} if it is not set yet.
     * Later calls are no-ops.
     *
     * @return true if this call fixed {@code M}
     */
    @Override
    public boolean fit(Iterable<float[]> vectors) {
        double largest = 0.0;
        for (float[] v : vectors) {
            DimensionMismatchException.check(v, dimension);
            largest = Math.max(largest, VectorMath.norm(v));
        }
        if (isFitted() || largest == 0.0) {
            return false;
        }
        maxNorm = largest;
        logger.debug("MIPS hasher fitted: M={}", largest);
        return true;
    }

    public boolean isFitted() {
        return maxNorm > 0.0;
    }

    public double getMaxNorm() {
        return maxNorm;
    }

    @Override
    public Signature hashForStorage(float[] vector) {
        DimensionMismatchException.check(vector, dimension);
        return hasher.project(transformStorage(vector));
    }

    @Override
    public Signature hashForQuery(float[] vector) {
        DimensionMismatchException.check(vector, dimension);
        return hasher.project(transformQuery(vector));
    }

    float[] transformStorage(float[] x) {
        double mNorm = maxNorm;
        float[] out = new float[dimension + m];
        double norm = VectorMath.norm(x);
        if (mNorm <= 0.0) {
            if (norm == 0.0) {
                return out;
            }
            throw LshException.invalidParameter("MIPS hasher has no max norm; fit it before storing");
        }
        if (norm > mNorm * (1.0 + NORM_TOLERANCE)) {
            throw LshException.invalidParameter(String.format(
                    "Vector norm %.6f exceeds the MIPS max norm M=%.6f; bind with a larger maxNorm",
                    norm, mNorm));
        }
        double scale = u / mNorm;
        for (int i = 0; i < dimension; i++) {
            out[i] = (float) (x[i] * scale);
        }
        double sq = VectorMath.dot(out, out); // only the first dim entries are non-zero
        double term = sq;
        for (int i = 0; i < m; i++) {
            out[dimension + i] = (float) term;
            term = term * term;
        }
        return out;
    }

    float[] transformQuery(float[] q) {
        float[] out = new float[dimension + m];
        double norm = VectorMath.norm(q);
        for (int i = 0; i < dimension; i++) {
            out[i] = norm == 0.0 ? 0f : (float) (q[i] / norm);
        }
        for (int i = 0; i < m; i++) {
            out[dimension + i] = 0.5f;
        }
        return out;
    }

    public float getU() {
        return u;
    }

    public int getM() {
        return m;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public int projections() {
        return hasher.projections();
    }

    @Override
    public String getConfiguration() {
        return String.format("MaximumInnerProduct{dim=%d, U=%.4f, m=%d, M=%.4f, inner=%s}",
                dimension, u, m, maxNorm, hasher.getConfiguration());
    }

    @Override
    public String toString() {
        return getConfiguration();
    }
}
