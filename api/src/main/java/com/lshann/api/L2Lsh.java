package com.lshann.api;

import com.lshann.index.core.LshIndex;

import java.nio.file.Path;

/**
 * Euclidean LSH: {@code n_projections, n_hash_tables, dim, r, seed}.
 */
public class L2Lsh extends LshFacade {

    public L2Lsh(int nProjections, int nHashTables, int dim, float r, long seed) {
        super(LshIndex.builder(nProjections, nHashTables, dim)
                .seed(seed)
                .l2(r));
    }

    /** Same, persisted in a RocksDB database under {@code storageDir}. */
    public L2Lsh(int nProjections, int nHashTables, int dim, float r, long seed, Path storageDir) {
        super(bindDurable(LshIndex.builder(nProjections, nHashTables, dim).seed(seed),
                storageDir, nHashTables, b -> b.l2(r)));
    }

    L2Lsh(LshIndex<?> index) {
        super(index);
    }
}
