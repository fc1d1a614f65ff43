package com.lshann.index.storage;

import com.lshann.common.BucketNotFoundException;
import com.lshann.common.DataPoint;
import com.lshann.common.ErrorKind;
import com.lshann.common.LshException;
import com.lshann.common.Signature;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every backend must share so the index stays backend-agnostic.
 */
abstract class StorageBackendContractTest {

    static final int TABLES = 3;
    static final Signature SIG_A = Signature.of(1, 0, -3);
    static final Signature SIG_B = Signature.of(1, 0, 4);

    StorageBackend storage;

    abstract StorageBackend create() throws Exception;

    @BeforeEach
    void open() throws Exception {
        storage = create();
    }

    @AfterEach
    void closeStorage() {
        storage.close();
    }

    @Test
    @DisplayName("Points get dense indices in append order and resolve back")
    void appendAndResolve() {
        assertEquals(0, storage.appendPoint(DataPoint.of(1f, 2f)));
        assertEquals(1, storage.appendPoint(DataPoint.of(3f, 4f)));
        assertEquals(2, storage.pointCount());
        assertEquals(DataPoint.of(3f, 4f), storage.indexToPoint(1));
        assertEquals(TABLES, storage.numTables());
    }

    @Test
    void unknownIndexIsABackendFault() {
        storage.appendPoint(DataPoint.of(1f, 2f));
        LshException e = assertThrows(LshException.class, () -> storage.indexToPoint(5));
        assertEquals(ErrorKind.BACKEND_FAULT, e.getKind());
        assertThrows(LshException.class, () -> storage.indexToPoint(-1));
    }

    @Test
    @DisplayName("Missing bucket is reported as BucketNotFoundException")
    void missingBucket() {
        assertThrows(BucketNotFoundException.class, () -> storage.queryBucket(SIG_A, 0));
    }

    @Test
    @DisplayName("put is idempotent and buckets are per table and per signature")
    void putIsIdempotent() throws Exception {
        int idx = storage.appendPoint(DataPoint.of(1f, 2f));
        storage.put(SIG_A, idx, 0);
        storage.put(SIG_A, idx, 0);

        assertEquals(Set.of(idx), storage.queryBucket(SIG_A, 0));
        assertThrows(BucketNotFoundException.class, () -> storage.queryBucket(SIG_A, 1));
        assertThrows(BucketNotFoundException.class, () -> storage.queryBucket(SIG_B, 0));
    }

    @Test
    void bucketsCollectSeveralPoints() throws Exception {
        int a = storage.appendPoint(DataPoint.of(1f, 2f));
        int b = storage.appendPoint(DataPoint.of(5f, 6f));
        storage.put(SIG_B, a, 2);
        storage.put(SIG_B, b, 2);
        assertEquals(Set.of(a, b), storage.queryBucket(SIG_B, 2));
    }

    @Test
    @DisplayName("delete removes value-equal members only, and an emptied bucket disappears")
    void deleteByValue() throws Exception {
        int a = storage.appendPoint(DataPoint.of(1f, 2f));
        int b = storage.appendPoint(DataPoint.of(5f, 6f));
        storage.put(SIG_A, a, 1);
        storage.put(SIG_A, b, 1);

        storage.delete(SIG_A, new float[]{1f, 2f}, 1);
        assertEquals(Set.of(b), storage.queryBucket(SIG_A, 1));

        storage.delete(SIG_A, new float[]{5f, 6f}, 1);
        assertThrows(BucketNotFoundException.class, () -> storage.queryBucket(SIG_A, 1));
        assertEquals(2, storage.pointCount(), "point store is never shrunk");
    }

    @Test
    void deleteOfAbsentPointIsANoOp() throws Exception {
        int a = storage.appendPoint(DataPoint.of(1f, 2f));
        storage.put(SIG_A, a, 0);

        assertDoesNotThrow(() -> storage.delete(SIG_A, new float[]{9f, 9f}, 0));
        assertDoesNotThrow(() -> storage.delete(SIG_B, new float[]{1f, 2f}, 0));
        assertEquals(Set.of(a), storage.queryBucket(SIG_A, 0));
    }

    @Test
    void duplicatesAreRemovedTogether() throws Exception {
        int a = storage.appendPoint(DataPoint.of(1f, 2f));
        int b = storage.appendPoint(DataPoint.of(1f, 2f));
        storage.put(SIG_A, a, 0);
        storage.put(SIG_A, b, 0);
        assertEquals(Set.of(a, b), storage.queryBucket(SIG_A, 0));

        storage.delete(SIG_A, new float[]{1f, 2f}, 0);
        assertThrows(BucketNotFoundException.class, () -> storage.queryBucket(SIG_A, 0));
    }

    @Test
    void invalidTableIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> storage.put(SIG_A, 0, TABLES));
        assertThrows(IllegalArgumentException.class, () -> storage.queryBucket(SIG_A, -1));
    }

    @Test
    void describeSummarisesEveryTable() {
        int a = storage.appendPoint(DataPoint.of(1f, 2f));
        storage.put(SIG_A, a, 0);
        storage.increaseStorage(100);

        String d = storage.describe();
        assertTrue(d.contains("points=1"), d);
        assertTrue(d.contains("table 0: buckets=1"), d);
        assertTrue(d.contains("table 2: empty"), d);
    }
}
