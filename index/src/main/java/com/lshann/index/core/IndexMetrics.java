package com.lshann.index.core;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;

/**
 * Micrometer meters for one index.
 */
public final class IndexMetrics {

    static final String OPERATION_TIMER   = "lsh.operation.duration";
    static final String CANDIDATE_SUMMARY = "lsh.query.candidates";

    private final MeterRegistry registry;
    private final Timer storeTimer;
    private final Timer storeBatchTimer;
    private final Timer queryTimer;
    private final Timer deleteTimer;
    private final DistributionSummary candidates;

    public IndexMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.storeTimer = timer("store");
        this.storeBatchTimer = timer("store_batch");
        this.queryTimer = timer("query");
        this.deleteTimer = timer("delete");
        this.candidates = DistributionSummary.builder(CANDIDATE_SUMMARY)
                .description("Bucket-union size per query")
                .register(registry);
    }

    private Timer timer(String op) {
        return Timer.builder(OPERATION_TIMER)
                .tag("op", op)
                .register(registry);
    }

    Timer.Sample start() {
        return Timer.start(registry);
    }

    void stopStore(Timer.Sample sample) {
        sample.stop(storeTimer);
    }

    void stopStoreBatch(Timer.Sample sample) {
        sample.stop(storeBatchTimer);
    }

    void stopQuery(Timer.Sample sample, int candidateCount) {
        sample.stop(queryTimer);
        candidates.record(candidateCount);
    }

    void stopDelete(Timer.Sample sample) {
        sample.stop(deleteTimer);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
