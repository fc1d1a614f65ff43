package com.lshann.index.storage;

import com.lshann.common.BucketNotFoundException;
import com.lshann.common.DataPoint;
import com.lshann.common.Signature;

import java.util.Set;

/**
 * Bucket storage for {@code numTables()} logical tables plus one shared point store.
 *
 * Buckets hold global point indices only, never vectors. Every implementation must
 * honour the same semantics so the index stays backend-agnostic:
 * <ul>
 *   <li>{@link #put} is idempotent per (signature, index, table).</li>
 *   <li>{@link #queryBucket} throws {@link BucketNotFoundException} when the table has no
 *       bucket (or only an emptied one) for the signature.</li>
 *   <li>{@link #delete} is a no-op when the point is not in the bucket.</li>
 * </ul>
 * Unexpected failures surface as {@link com.lshann.common.LshException} with kind
 * {@code BACKEND_FAULT}.
 */
public interface StorageBackend extends AutoCloseable {

    /**
     * Appends a point to the global store.
     *
     * @return the point's global index, assigned densely from 0 in call order
     */
    int appendPoint(DataPoint point);

    /** Adds {@code pointIndex} to the bucket for {@code signature} in table {@code tableId}. */
    void put(Signature signature, int pointIndex, int tableId);

    /**
     * Current membership of a bucket.
     *
     * @throws BucketNotFoundException if no bucket exists for {@code signature} in the table
     */
    Set<Integer> queryBucket(Signature signature, int tableId) throws BucketNotFoundException;

    /** Removes every index in the bucket whose stored point value-equals {@code point}. */
    void delete(Signature signature, float[] point, int tableId);

    /** Capacity hint issued before a batch of {@code additional} inserts. */
    void increaseStorage(int additional);

    /**
     * Resolves a global index to its vector.
     *
     * @throws com.lshann.common.LshException BACKEND_FAULT for an index never assigned
     */
    DataPoint indexToPoint(int pointIndex);

    /** Number of points ever appended, deleted ones included. */
    int pointCount();

    int numTables();

    /**
     * Records the structural layout of the index that owns this storage, or checks it
     * against the one recorded earlier. Storage that does not outlive the process may
     * ignore it.
     *
     * @throws com.lshann.common.LshException INVALID_PARAMETER on a mismatch
     */
    default void verifyLayout(String layout) {
    }

    /** True if the stored index outlives the process and can be reopened. */
    default boolean isDurable() {
        return false;
    }

    /** Human-readable occupancy summary. No contract on structure. */
    String describe();

    @Override
    default void close() {
    }
}
