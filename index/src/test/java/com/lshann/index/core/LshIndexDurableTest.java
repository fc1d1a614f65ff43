package com.lshann.index.core;

import com.lshann.common.DataPoint;
import com.lshann.common.ErrorKind;
import com.lshann.common.LshException;
import com.lshann.index.hash.MaximumInnerProduct;
import com.lshann.index.hash.SignRandomProjections;
import com.lshann.index.storage.RocksDbTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LshIndex over RocksDB storage")
class LshIndexDurableTest {

    private static final float[] V1 = {2f, 3f, 4f};
    private static final float[] V2 = {-1f, -1f, 1f};

    @TempDir
    Path tempDir;

    @Test
    void behavesLikeTheInMemoryIndex() throws Exception {
        try (LshIndex<SignRandomProjections> lsh = LshIndex.builder(5, 10, 3)
                .seed(1)
                .storage(RocksDbTable.open(tempDir.resolve("db"), 10, false))
                .srp()) {
            lsh.storeVecs(List.of(V1, V2));
            assertTrue(lsh.queryBucket(V2).contains(DataPoint.of(V2)));

            int before = lsh.queryBucket(V1).size();
            lsh.deleteVec(V1);
            assertTrue(lsh.queryBucket(V1).size() < before);
        }
    }

    @Test
    @DisplayName("A reopened index with the same seed finds earlier vectors")
    void reopenWithSameSeed() throws Exception {
        Path db = tempDir.resolve("db");
        try (LshIndex<SignRandomProjections> lsh = LshIndex.builder(5, 4, 3)
                .seed(21)
                .storage(RocksDbTable.open(db, 4, true))
                .srp()) {
            lsh.storeVec(V1);
            lsh.storeVec(V2);
        }

        try (LshIndex<SignRandomProjections> lsh = LshIndex.builder(5, 4, 3)
                .seed(21)
                .storage(RocksDbTable.open(db, 4, false))
                .srp()) {
            assertTrue(lsh.queryBucketIdx(V2).contains(1));
            assertTrue(lsh.queryBucket(V1).contains(DataPoint.of(V1)));
            assertEquals(2, lsh.storeVec(new float[]{1f, 0f, 0f}));
        }
    }

    @Test
    void reopenWithDifferentSeedIsRejected() throws Exception {
        Path db = tempDir.resolve("db");
        try (LshIndex<SignRandomProjections> lsh = LshIndex.builder(5, 4, 3)
                .seed(21)
                .storage(RocksDbTable.open(db, 4, false))
                .srp()) {
            lsh.storeVec(V1);
        }

        try (RocksDbTable storage = RocksDbTable.open(db, 4, false)) {
            LshException e = assertThrows(LshException.class,
                    () -> LshIndex.builder(5, 4, 3).seed(22).storage(storage).srp());
            assertEquals(ErrorKind.INVALID_PARAMETER, e.getKind());
        }
    }

    @Test
    void mipsNeedsFixedNormOnDurableStorage() throws Exception {
        try (RocksDbTable storage = RocksDbTable.open(tempDir.resolve("mips"), 4, false)) {
            LshException e = assertThrows(LshException.class,
                    () -> LshIndex.builder(4, 4, 2).seed(3).storage(storage).mips(2.5f, 0.83f, 3));
            assertEquals(ErrorKind.INVALID_PARAMETER, e.getKind());
        }
    }

    @Test
    @DisplayName("A reopened MIPS index keeps its max norm and finds earlier vectors")
    void mipsReopenWithFixedNorm() throws Exception {
        Path db = tempDir.resolve("mips");
        try (LshIndex<MaximumInnerProduct> lsh = LshIndex.builder(4, 20, 2)
                .seed(1)
                .storage(RocksDbTable.open(db, 20, true))
                .mips(2.5f, 0.83f, 3, 50f)) {
            lsh.storeVec(new float[]{0.3f, 0.4f});
            lsh.storeVec(new float[]{30f, 40f});
        }

        try (RocksDbTable storage = RocksDbTable.open(db, 20, false)) {
            LshException e = assertThrows(LshException.class,
                    () -> LshIndex.builder(4, 20, 2).seed(1).storage(storage).mips(2.5f, 0.83f, 3, 40f));
            assertEquals(ErrorKind.INVALID_PARAMETER, e.getKind());
        }

        try (LshIndex<MaximumInnerProduct> lsh = LshIndex.builder(4, 20, 2)
                .seed(1)
                .storage(RocksDbTable.open(db, 20, false))
                .mips(2.5f, 0.83f, 3, 50f)) {
            assertEquals(50.0, lsh.getHashers().get(0).getMaxNorm(), 1e-6);
            assertTrue(lsh.queryBucketIdx(new float[]{3f, 4f}).contains(1));
            assertEquals(ErrorKind.INVALID_PARAMETER,
                    assertThrows(LshException.class, () -> lsh.storeVec(new float[]{60f, 80f})).getKind());
            assertEquals(2, lsh.getStorage().pointCount());
        }
    }
}
