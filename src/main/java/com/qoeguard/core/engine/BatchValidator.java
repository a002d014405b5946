package com.qoeguard.core.engine;

import com.qoeguard.core.config.QoeGuardProperties;
import com.qoeguard.core.logging.MdcContext;
import com.qoeguard.core.metrics.QoeGuardMetrics;
import com.qoeguard.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Validates many endpoints in one run using a bounded worker pool.
 * <p>
 * One comparison per task; the engine is stateless, so workers share it without locking.
 * Results are returned in submission order regardless of completion order.
 */
@Service
public class BatchValidator {

    private static final Logger log = LoggerFactory.getLogger(BatchValidator.class);

    private final ValidationService validationService;
    private final int defaultParallelism;
    private final QoeGuardMetrics metrics;

    @Autowired
    public BatchValidator(ValidationService validationService, QoeGuardProperties properties,
                          @Autowired(required = false) QoeGuardMetrics metrics) {
        this(validationService, properties.getBatch().getMaxParallel(), metrics);
    }

    BatchValidator(ValidationService validationService, int defaultParallelism, QoeGuardMetrics metrics) {
        if (defaultParallelism < 1) {
            throw new IllegalArgumentException("Batch parallelism must be at least 1, got " + defaultParallelism);
        }
        this.validationService = validationService;
        this.defaultParallelism = defaultParallelism;
        this.metrics = metrics;
    }

    public int defaultParallelism() {
        return defaultParallelism;
    }

    public BatchReport run(List<ComparisonRequest> requests) {
        return run(requests, validationService.engine(), defaultParallelism);
    }

    public BatchReport run(List<ComparisonRequest> requests, ValidationEngine engine, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Batch parallelism must be at least 1, got " + parallelism);
        }
        String runId = UUID.randomUUID().toString().substring(0, 8);
        long start = System.currentTimeMillis();
        if (requests.isEmpty()) {
            return new BatchReport(runId, List.of(), 0);
        }

        int poolSize = Math.min(parallelism, requests.size());
        log.info("Batch {}: validating {} comparisons with {} workers", runId, requests.size(), poolSize);

        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "qoeguard-batch-" + runId + "-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<ValidationResult>> futures = new ArrayList<>(requests.size());
            for (ComparisonRequest request : requests) {
                futures.add(executor.submit(() -> {
                    MdcContext.setComparison(runId, request.name());
                    try {
                        return validationService.validate(request, engine);
                    } finally {
                        MdcContext.clear();
                    }
                }));
            }

            List<ValidationResult> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), requests.get(i).name()));
            }

            long duration = System.currentTimeMillis() - start;
            BatchReport report = new BatchReport(runId, results, duration);
            log.info("Batch {} complete in {}ms: worst outcome {}", runId, duration, report.worstOutcome());
            if (metrics != null) {
                metrics.recordBatch(requests.size(), poolSize);
            }
            return report;
        } finally {
            executor.shutdownNow();
        }
    }

    private static ValidationResult await(Future<ValidationResult> future, String name) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while validating " + name, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Comparison " + name + " failed: " + e.getCause().getMessage(),
                    e.getCause());
        }
    }
}
