package com.lshann.index.hash;

import com.lshann.common.Signature;

/**
 * Contract for one Locality-Sensitive Hashing function instance (one per table).
 *
 * Two entry points exist because asymmetric families hash stored vectors and query
 * vectors under different embeddings. Symmetric families return the same signature
 * from both.
 *
 * Implementations are deterministic: for fixed construction parameters and seed,
 * repeated calls on the same input return equal signatures.
 */
public interface HashFamily {

    /**
     * Hash used when inserting a vector.
     *
     * @param vector input of length {@link #dimension()}
     * @return signature with {@link #projections()} components
     * @throws com.lshann.common.DimensionMismatchException if the length is wrong
     */
    Signature hashForStorage(float[] vector);

    /**
     * Hash used when probing for neighbours of {@code vector}, and when locating the
     * bucket to delete it from.
     *
     * @param vector input of length {@link #dimension()}
     * @return signature with {@link #projections()} components
     * @throws com.lshann.common.DimensionMismatchException if the length is wrong
     */
    Signature hashForQuery(float[] vector);

    /** Length of the vectors this hasher accepts. */
    int dimension();

    /** Signature length. */
    int projections();

    /**
     * Lets a family that depends on data statistics observe vectors before they are
     * stored. Families without such state ignore it.
     *
     * @return true if internal state changed
     */
    default boolean fit(Iterable<float[]> vectors) {
        return false;
    }

    /** Human-readable configuration, for logging. */
    String getConfiguration();
}
