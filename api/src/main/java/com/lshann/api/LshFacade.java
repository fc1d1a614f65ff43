package com.lshann.api;

import com.lshann.common.DataPoint;
import com.lshann.common.LshException;
import com.lshann.index.core.LshIndex;
import com.lshann.index.storage.RocksDbTable;
import com.lshann.index.storage.StorageBackend;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Binding-facing surface shared by the per-family classes.
 *
 * Forwards calls into an {@link LshIndex} and marshals vectors in and out as plain
 * {@code float[]}. Every failure leaves as an {@link LshException} whose
 * {@link com.lshann.common.ErrorKind} a host binding can map onto its own errors.
 * A facade created with the no-argument constructor is unbound and rejects every
 * operation with {@code UNBOUND}.
 */
public class LshFacade implements AutoCloseable {

    private final LshIndex<?> index;

    public LshFacade() {
        this.index = null;
    }

    protected LshFacade(LshIndex<?> index) {
        this.index = index;
    }

    public int storeVec(float[] v) {
        return bound().storeVec(v);
    }

    public void storeVecs(List<float[]> vs) {
        bound().storeVecs(vs);
    }

    public List<float[]> queryBucket(float[] v) {
        List<DataPoint> points = bound().queryBucket(v);
        List<float[]> out = new ArrayList<>(points.size());
        for (DataPoint p : points) {
            out.add(p.toArray());
        }
        return out;
    }

    public List<Integer> queryBucketIdx(float[] v) {
        return bound().queryBucketIdx(v);
    }

    public void deleteVec(float[] v) {
        bound().deleteVec(v);
    }

    public String describe() {
        return bound().describe();
    }

    public boolean isBound() {
        return index != null;
    }

    /** Underlying index, for callers that need the typed API. */
    public LshIndex<?> getIndex() {
        return bound();
    }

    @Override
    public void close() {
        if (index != null) {
            index.close();
        }
    }

    private LshIndex<?> bound() {
        if (index == null) {
            throw LshException.unbound("No hash family selected for this index");
        }
        return index;
    }

    /**
     * Binds {@code builder} over RocksDB storage under {@code dir}. The storage is closed
     * again if family selection rejects its parameters.
     */
    static LshIndex<?> bindDurable(LshIndex.Builder builder, Path dir, int nHashTables,
                                   Function<LshIndex.Builder, LshIndex<?>> family) {
        StorageBackend storage;
        try {
            storage = RocksDbTable.open(dir, nHashTables, false);
        } catch (IOException e) {
            throw LshException.backendFault("Could not open storage at " + dir, e);
        }
        try {
            return family.apply(builder.storage(storage));
        } catch (RuntimeException e) {
            storage.close();
            throw e;
        }
    }
}
