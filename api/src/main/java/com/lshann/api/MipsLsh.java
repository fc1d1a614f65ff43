package com.lshann.api;

import com.lshann.index.core.LshIndex;

import java.nio.file.Path;

/**
 * Maximum-inner-product LSH: {@code n_projections, n_hash_tables, dim, r, U, m, seed}.
 * {@code U} must lie in (0, 1). Without a max norm, {@code M} is fitted from the first
 * store and longer vectors stored later are rejected.
 */
public class MipsLsh extends LshFacade {

    public MipsLsh(int nProjections, int nHashTables, int dim, float r, float u, int m, long seed) {
        super(LshIndex.builder(nProjections, nHashTables, dim)
                .seed(seed)
                .mips(r, u, m));
    }

    /**
     * Durable variant. {@code maxNorm} is the largest norm that will be stored and must be
     * positive, so reopened databases hash new vectors with the same scaling.
     */
    public MipsLsh(int nProjections, int nHashTables, int dim, float r, float u, int m, long seed,
                   float maxNorm, Path storageDir) {
        super(bindDurable(LshIndex.builder(nProjections, nHashTables, dim).seed(seed),
                storageDir, nHashTables, b -> b.mips(r, u, m, maxNorm)));
    }

    MipsLsh(LshIndex<?> index) {
        super(index);
    }
}
