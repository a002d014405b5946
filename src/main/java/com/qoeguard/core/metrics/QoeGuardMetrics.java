package com.qoeguard.core.metrics;

import com.qoeguard.core.model.GateDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for comparison runs.
 */
@Service
public class QoeGuardMetrics {

    private final MeterRegistry registry;

    public QoeGuardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(GateDecision decision) {
        Counter.builder("qoeguard.decisions.total")
                .description("Gating decisions by outcome")
                .tag("decision", decision.name())
                .register(registry)
                .increment();
    }

    public void recordOverride(String ruleName) {
        Counter.builder("qoeguard.overrides.total")
                .description("Decisions forced by an override rule")
                .tag("rule", ruleName)
                .register(registry)
                .increment();
    }

    public void recordComparisonDuration(long nanos) {
        Timer.builder("qoeguard.comparison.duration")
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    public void recordChangeCount(int changes) {
        DistributionSummary.builder("qoeguard.changes.count")
                .description("Scored changes per comparison")
                .register(registry)
                .record(changes);
    }

    /**
     * Records a completed batch.
     *
     * @param comparisons number of comparisons in the batch
     * @param parallelism worker pool size used
     */
    public void recordBatch(int comparisons, int parallelism) {
        Counter.builder("qoeguard.batches.total")
                .tag("parallelism", String.valueOf(parallelism))
                .register(registry)
                .increment();

        DistributionSummary.builder("qoeguard.batch.size")
                .register(registry)
                .record(comparisons);
    }
}
