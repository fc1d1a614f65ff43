package com.lshann.index.core;

import com.lshann.common.BucketNotFoundException;
import com.lshann.common.DataPoint;
import com.lshann.common.DimensionMismatchException;
import com.lshann.common.LshException;
import com.lshann.common.Seeds;
import com.lshann.common.Signature;
import com.lshann.index.hash.HashFamily;
import com.lshann.index.hash.L2Hasher;
import com.lshann.index.hash.MaximumInnerProduct;
import com.lshann.index.hash.SignRandomProjections;
import com.lshann.index.storage.MemoryTable;
import com.lshann.index.storage.StorageBackend;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.LongFunction;

/**
 * Multi-table Locality-Sensitive Hashing index.
 *
 * Core properties:
 *  • L = n_hash_tables independent (hasher, table) pairs sharing one dimension
 *  • one global point store; buckets hold point indices only
 *  • query = union of the query's bucket over all tables
 *
 * An index is created through {@link #builder(int, int, int)}; the builder is the unbound
 * state, and selecting a hash family ({@code l2}, {@code srp}, {@code mips}) is what
 * produces an index, so no operation can run before a family is chosen.
 *
 * Per-table hasher seeds are drawn in table order from one generator seeded with the
 * index seed (see {@link Seeds#derive(long, int)}). A non-zero seed therefore reproduces
 * the whole index; seed 0 samples fresh randomness.
 *
 * Not thread-safe: callers serialize mutating calls against each other and against reads.
 *
 * @param <H> hash family
 */
public final class LshIndex<H extends HashFamily> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LshIndex.class);

    private final int nProjections;
    private final int nHashTables;
    private final int dim;
    private final long seed;
    private final List<H> hashers;
    private final StorageBackend storage;
    private final IndexMetrics metrics;

    private LshIndex(Builder builder, List<H> hashers, StorageBackend storage) {
        this.nProjections = builder.nProjections;
        this.nHashTables = builder.nHashTables;
        this.dim = builder.dim;
        this.seed = builder.seed;
        this.hashers = Collections.unmodifiableList(hashers);
        this.storage = storage;
        this.metrics = new IndexMetrics(builder.meterRegistry != null
                ? builder.meterRegistry : new SimpleMeterRegistry());
    }

    public static Builder builder(int nProjections, int nHashTables, int dim) {
        return new Builder(nProjections, nHashTables, dim);
    }

    // ====================================================================
    // STORE
    // ====================================================================

    /**
     * Stores one vector: appends it to the point store once and adds its index to the
     * matching bucket of every table.
     *
     * @return global index assigned to the vector
     * @throws DimensionMismatchException if {@code v.length != dim}
     * @throws LshException BACKEND_FAULT if the storage fails
     */
    public int storeVec(float[] v) {
        DimensionMismatchException.check(v, dim);
        Timer.Sample sample = metrics.start();
        fitHashers(Collections.singletonList(v));
        int idx = insert(v, signaturesFor(v));
        metrics.stopStore(sample);
        return idx;
    }

    /**
     * Stores vectors in order after one {@link StorageBackend#increaseStorage(int)} hint.
     * Indices are assigned in input order. Every vector is validated and hashed before any
     * is stored, so a rejected vector leaves the index unchanged.
     */
    public void storeVecs(List<float[]> vs) {
        Objects.requireNonNull(vs, "vs");
        for (float[] v : vs) {
            DimensionMismatchException.check(v, dim);
        }
        Timer.Sample sample = metrics.start();
        fitHashers(vs);
        List<List<Signature>> signatures = new ArrayList<>(vs.size());
        for (float[] v : vs) {
            signatures.add(signaturesFor(v));
        }
        storage.increaseStorage(vs.size());
        for (int i = 0; i < vs.size(); i++) {
            insert(vs.get(i), signatures.get(i));
        }
        metrics.stopStoreBatch(sample);
    }

    private List<Signature> signaturesFor(float[] v) {
        List<Signature> signatures = new ArrayList<>(nHashTables);
        for (H hasher : hashers) {
            signatures.add(hasher.hashForStorage(v));
        }
        return signatures;
    }

    private int insert(float[] v, List<Signature> signatures) {
        try {
            int idx = storage.appendPoint(DataPoint.of(v));
            for (int t = 0; t < nHashTables; t++) {
                storage.put(signatures.get(t), idx, t);
            }
            return idx;
        } catch (LshException e) {
            throw e;
        } catch (RuntimeException e) {
            throw LshException.backendFault("Could not store vector", e);
        }
    }

    private void fitHashers(List<float[]> vs) {
        for (H hasher : hashers) {
            if (hasher.fit(vs)) {
                logger.debug("Hasher fitted on {} vector(s): {}", vs.size(), hasher.getConfiguration());
            }
        }
    }

    // ====================================================================
    // QUERY
    // ====================================================================

    /**
     * Union of the query's buckets over all tables, resolved to vectors.
     * Ordered by global index. An empty index yields an empty list.
     */
    public List<DataPoint> queryBucket(float[] v) {
        Set<Integer> union = bucketUnion(v);
        List<DataPoint> out = new ArrayList<>(union.size());
        for (int idx : union) {
            out.add(storage.indexToPoint(idx));
        }
        return out;
    }

    /**
     * Same as {@link #queryBucket(float[])} but returns global indices, ascending.
     */
    public List<Integer> queryBucketIdx(float[] v) {
        return new ArrayList<>(bucketUnion(v));
    }

    private Set<Integer> bucketUnion(float[] v) {
        DimensionMismatchException.check(v, dim);
        Timer.Sample sample = metrics.start();
        Set<Integer> union = new TreeSet<>();
        for (int t = 0; t < nHashTables; t++) {
            Signature sig = hashers.get(t).hashForQuery(v);
            try {
                union.addAll(storage.queryBucket(sig, t));
            } catch (BucketNotFoundException e) {
                // no collision in this table
            } catch (LshException e) {
                throw e;
            } catch (RuntimeException e) {
                throw LshException.backendFault("Unexpected query failure in table " + t, e);
            }
        }
        metrics.stopQuery(sample, union.size());
        return union;
    }

    // ====================================================================
    // DELETE
    // ====================================================================

    /**
     * Removes {@code v} from the bucket a query for {@code v} would probe in each table.
     * The point store keeps the vector's slot; space is not reclaimed.
     */
    public void deleteVec(float[] v) {
        DimensionMismatchException.check(v, dim);
        Timer.Sample sample = metrics.start();
        for (int t = 0; t < nHashTables; t++) {
            Signature sig = hashers.get(t).hashForQuery(v);
            try {
                storage.delete(sig, v, t);
            } catch (LshException e) {
                throw e;
            } catch (RuntimeException e) {
                throw LshException.backendFault("Could not delete vector from table " + t, e);
            }
        }
        metrics.stopDelete(sample);
    }

    // ====================================================================
    // DIAGNOSTICS
    // ====================================================================

    /** Storage occupancy summary; also logged at INFO. */
    public String describe() {
        String summary = storage.describe();
        logger.info("{}", summary);
        return summary;
    }

    public List<H> getHashers() {
        return hashers;
    }

    public StorageBackend getStorage() {
        return storage;
    }

    public IndexMetrics getMetrics() {
        return metrics;
    }

    public int getDimension() {
        return dim;
    }

    public int getNumHashTables() {
        return nHashTables;
    }

    public int getNumProjections() {
        return nProjections;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public void close() {
        storage.close();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "LshIndex{dim=%d, L=%d, K=%d, points=%d, hasher=%s}",
                dim, nHashTables, nProjections, storage.pointCount(),
                hashers.isEmpty() ? "-" : hashers.get(0).getClass().getSimpleName());
    }

    // ====================================================================
    // BUILDER (unbound state)
    // ====================================================================

    /**
     * Structural parameters plus seed; becomes an {@link LshIndex} once a hash family is
     * selected.
     */
    public static final class Builder {
        private final int nProjections;
        private final int nHashTables;
        private final int dim;
        private long seed = 0L;
        private StorageBackend storage;
        private boolean storageClaimed;
        private MeterRegistry meterRegistry;

        private Builder(int nProjections, int nHashTables, int dim) {
            this.nProjections = nProjections;
            this.nHashTables = nHashTables;
            this.dim = dim;
        }

        /** Index seed; 0 means random. Controls the sub-seeds drawn at family selection. */
        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Storage to bind to. Without one, every family selection gets a fresh
         * {@link MemoryTable}. The storage is owned by the resulting index and closed with it,
         * so it binds once; a further family selection needs a new {@code storage(...)} call.
         */
        public Builder storage(StorageBackend storage) {
            this.storage = storage;
            this.storageClaimed = false;
            return this;
        }

        public Builder meterRegistry(MeterRegistry registry) {
            this.meterRegistry = registry;
            return this;
        }

        /**
         * Euclidean family.
         *
         * @param r bucket width
         */
        public LshIndex<L2Hasher> l2(float r) {
            return bind(String.format(Locale.ROOT, "l2(r=%s)", r),
                    s -> new L2Hasher(dim, r, nProjections, s));
        }

        /** Sign-random-projection (cosine) family. */
        public LshIndex<SignRandomProjections> srp() {
            return bind("srp", s -> new SignRandomProjections(nProjections, dim, s));
        }

        /**
         * Asymmetric maximum-inner-product family; {@code M} is fitted from the first
         * stored vectors. Later vectors longer than {@code M} are rejected, so store the
         * dataset with one {@link LshIndex#storeVecs(List)} call or pass a max norm.
         */
        public LshIndex<MaximumInnerProduct> mips(float r, float u, int m) {
            return mips(r, u, m, 0.0f);
        }

        /**
         * Asymmetric maximum-inner-product family with a fixed max norm {@code M}
         * ({@code 0} to fit it from the first stored vectors). Durable storage needs a
         * fixed {@code M}: a fitted one is not persisted.
         */
        public LshIndex<MaximumInnerProduct> mips(float r, float u, int m, float maxNorm) {
            if (maxNorm == 0.0f && storage != null && storage.isDurable()) {
                throw LshException.invalidParameter(
                        "MIPS over durable storage needs maxNorm > 0; a fitted M is not persisted");
            }
            return bind(String.format(Locale.ROOT, "mips(r=%s,U=%s,m=%d,M=%s)", r, u, m, maxNorm),
                    s -> new MaximumInnerProduct(dim, r, u, m, nProjections, s, maxNorm));
        }

        private <T extends HashFamily> LshIndex<T> bind(String family, LongFunction<T> factory) {
            if (nHashTables <= 0) {
                throw LshException.invalidParameter("n_hash_tables must be > 0, got " + nHashTables);
            }
            if (storage == null && storageClaimed) {
                throw LshException.invalidParameter(
                        "Storage is already owned by a bound index; pass a new one to storage(...)");
            }
            long[] subSeeds = Seeds.derive(seed, nHashTables);
            List<T> hashers = new ArrayList<>(nHashTables);
            for (long s : subSeeds) {
                hashers.add(factory.apply(s));
            }

            StorageBackend backend = storage != null ? storage : new MemoryTable(nHashTables);
            if (backend.numTables() != nHashTables) {
                throw LshException.invalidParameter("Storage has " + backend.numTables()
                        + " tables, index needs " + nHashTables);
            }
            if (seed == 0L && backend.isDurable()) {
                logger.warn("Durable storage bound with seed 0; hashers cannot be reproduced on reopen");
            }
            backend.verifyLayout(String.format(Locale.ROOT, "%s;dim=%d;projections=%d;tables=%d;seed=%d",
                    family, dim, nProjections, nHashTables, seed));

            LshIndex<T> index = new LshIndex<>(this, hashers, backend);
            if (storage != null) {
                storage = null;
                storageClaimed = true;
            }
            logger.info("Bound LSH index family={} dim={} L={} K={} seed={} storage={}",
                    family, dim, nHashTables, nProjections, seed, backend.getClass().getSimpleName());
            return index;
        }
    }
}
