package com.lshann.index.core;

import com.lshann.common.BucketNotFoundException;
import com.lshann.common.DataPoint;
import com.lshann.common.ErrorKind;
import com.lshann.common.LshException;
import com.lshann.common.Signature;
import com.lshann.index.hash.SignRandomProjections;
import com.lshann.index.storage.StorageBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("LshIndex error propagation against a mocked backend")
class LshIndexFaultTest {

    private static final float[] V = {1f, 2f, 3f};

    private StorageBackend storage;
    private LshIndex<SignRandomProjections> lsh;

    @BeforeEach
    void setup() {
        storage = mock(StorageBackend.class);
        when(storage.numTables()).thenReturn(2);
        lsh = LshIndex.builder(4, 2, 3).seed(1).storage(storage).srp();
    }

    @Test
    void layoutIsReportedAtBinding() {
        verify(storage).verifyLayout("srp;dim=3;projections=4;tables=2;seed=1");
    }

    @Test
    @DisplayName("Store appends once and puts into every table")
    void storeFansOut() {
        when(storage.appendPoint(any())).thenReturn(0);
        lsh.storeVec(V);

        verify(storage, times(1)).appendPoint(DataPoint.of(V));
        verify(storage).put(any(Signature.class), eq(0), eq(0));
        verify(storage).put(any(Signature.class), eq(0), eq(1));
    }

    @Test
    void batchStoreHintsCapacityOnce() {
        when(storage.appendPoint(any())).thenReturn(0, 1, 2);
        lsh.storeVecs(List.of(V, V, V));

        verify(storage, times(1)).increaseStorage(3);
        verify(storage, times(3)).appendPoint(any());
        verify(storage, times(6)).put(any(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("Unexpected put failure surfaces as BACKEND_FAULT")
    void putFailureIsBackendFault() {
        when(storage.appendPoint(any())).thenReturn(0);
        doThrow(new IllegalStateException("disk full")).when(storage).put(any(), anyInt(), anyInt());

        LshException e = assertThrows(LshException.class, () -> lsh.storeVec(V));
        assertEquals(ErrorKind.BACKEND_FAULT, e.getKind());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void backendFaultsPassThroughUnchanged() {
        LshException fault = LshException.backendFault("io", null);
        when(storage.appendPoint(any())).thenThrow(fault);
        assertSame(fault, assertThrows(LshException.class, () -> lsh.storeVec(V)));
    }

    @Test
    @DisplayName("BucketNotFound contributes nothing to the union")
    void bucketNotFoundIsAbsorbed() throws Exception {
        when(storage.queryBucket(any(), eq(0))).thenThrow(new BucketNotFoundException(Signature.of(0), 0));
        doReturn(Set.of(4, 2)).when(storage).queryBucket(any(), eq(1));
        when(storage.indexToPoint(2)).thenReturn(DataPoint.of(0f, 0f, 2f));
        when(storage.indexToPoint(4)).thenReturn(DataPoint.of(0f, 0f, 4f));

        assertEquals(List.of(2, 4), lsh.queryBucketIdx(V));
        assertEquals(List.of(DataPoint.of(0f, 0f, 2f), DataPoint.of(0f, 0f, 4f)), lsh.queryBucket(V));
    }

    @Test
    void otherQueryFailuresPropagate() throws Exception {
        when(storage.queryBucket(any(), anyInt())).thenThrow(new IllegalStateException("corrupt"));
        LshException e = assertThrows(LshException.class, () -> lsh.queryBucketIdx(V));
        assertEquals(ErrorKind.BACKEND_FAULT, e.getKind());
    }

    @Test
    @DisplayName("Delete probes every table with the query-side hash")
    void deleteUsesQueryHash() {
        lsh.deleteVec(V);
        Signature q0 = lsh.getHashers().get(0).hashForQuery(V);
        Signature q1 = lsh.getHashers().get(1).hashForQuery(V);
        verify(storage).delete(eq(q0), eq(V), eq(0));
        verify(storage).delete(eq(q1), eq(V), eq(1));
    }

    @Test
    void deleteFailureIsBackendFault() {
        doThrow(new IllegalStateException("locked")).when(storage).delete(any(), any(), anyInt());
        LshException e = assertThrows(LshException.class, () -> lsh.deleteVec(V));
        assertEquals(ErrorKind.BACKEND_FAULT, e.getKind());
    }

    @Test
    void closeClosesStorage() {
        lsh.close();
        verify(storage).close();
    }
}
