package com.lshann.api;

import com.lshann.index.core.LshIndex;

import java.nio.file.Path;

/**
 * Cosine LSH via sign random projections: {@code n_projections, n_hash_tables, dim, seed}.
 */
public class SrpLsh extends LshFacade {

    public SrpLsh(int nProjections, int nHashTables, int dim, long seed) {
        super(LshIndex.builder(nProjections, nHashTables, dim)
                .seed(seed)
                .srp());
    }

    public SrpLsh(int nProjections, int nHashTables, int dim, long seed, Path storageDir) {
        super(bindDurable(LshIndex.builder(nProjections, nHashTables, dim).seed(seed),
                storageDir, nHashTables, b -> b.srp()));
    }

    SrpLsh(LshIndex<?> index) {
        super(index);
    }
}
