package com.extsync.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for dev session builds and batches.
 */
@Service
public class ExtsyncMetrics {

    private final MeterRegistry registry;

    public ExtsyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one artifact build.
     *
     * @param backend "incremental" or "bundle"
     * @param ok      whether the build produced an OK result
     * @param ms      wall-clock duration
     */
    public void recordBuild(String backend, boolean ok, long ms) {
        Timer.builder("extsync.build.duration")
                .tag("backend", backend)
                .tag("result", ok ? "ok" : "error")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordBatch(int eventCount, long ms) {
        Timer.builder("extsync.batch.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("extsync.batch.events")
                .description("Artifact events per processed batch")
                .register(registry)
                .record(eventCount);
    }

    public void recordBatchFailure() {
        Counter.builder("extsync.batch.failures")
                .description("Batches whose handler failed outside per-artifact builds")
                .register(registry)
                .increment();
    }

    public void recordSkippedBatch() {
        Counter.builder("extsync.batch.skipped")
                .description("Batches with no artifact events")
                .register(registry)
                .increment();
    }
}
