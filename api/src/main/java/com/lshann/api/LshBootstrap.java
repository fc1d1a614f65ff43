package com.lshann.api;

import com.lshann.config.LshConfig;
import com.lshann.index.core.LshIndex;
import com.lshann.index.storage.MemoryTable;
import com.lshann.index.storage.RocksDbTable;
import com.lshann.index.storage.StorageBackend;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Builds a bound facade from an {@link LshConfig}.
 */
public final class LshBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(LshBootstrap.class);

    private LshBootstrap() {
    }

    public static LshFacade init(LshConfig cfg) throws IOException {
        return init(cfg, new SimpleMeterRegistry());
    }

    /**
     * @param registry receives the index meters when {@code metricsEnabled} is set
     * @throws IOException if durable storage cannot be opened
     * @throws com.lshann.common.LshException INVALID_PARAMETER for bad hash parameters
     */
    public static LshFacade init(LshConfig cfg, MeterRegistry registry) throws IOException {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(registry, "registry");

        StorageBackend storage;
        LshConfig.StorageConfig sc = cfg.getStorage();
        switch (sc.getType()) {
            case ROCKSDB:
                storage = RocksDbTable.open(Paths.get(sc.getPath()), cfg.getNHashTables(), sc.isSyncWrites());
                break;
            case MEMORY:
            default:
                storage = new MemoryTable(cfg.getNHashTables());
                break;
        }

        LshIndex.Builder builder = LshIndex.builder(cfg.getNProjections(), cfg.getNHashTables(), cfg.getDim())
                .seed(cfg.getSeed())
                .storage(storage)
                .meterRegistry(cfg.isMetricsEnabled() ? registry : new SimpleMeterRegistry());

        LshFacade facade;
        try {
            switch (cfg.getFamily()) {
                case L2:
                    facade = new L2Lsh(builder.l2(cfg.getL2().getR()));
                    break;
                case MIPS:
                    LshConfig.MipsConfig mc = cfg.getMips();
                    facade = new MipsLsh(builder.mips(mc.getR(), mc.getU(), mc.getM(), mc.getMaxNorm()));
                    break;
                case SRP:
                default:
                    facade = new SrpLsh(builder.srp());
                    break;
            }
        } catch (RuntimeException e) {
            storage.close();
            throw e;
        }
        logger.info("Bootstrapped {} index over {} storage", cfg.getFamily(), sc.getType());
        return facade;
    }
}
