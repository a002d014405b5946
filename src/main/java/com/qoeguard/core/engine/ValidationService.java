package com.qoeguard.core.engine;

import com.qoeguard.core.json.JsonValue;
import com.qoeguard.core.logging.MdcContext;
import com.qoeguard.core.metrics.QoeGuardMetrics;
import com.qoeguard.core.model.Decision;
import com.qoeguard.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs comparisons through a {@link ValidationEngine} with logging, MDC and metrics around them.
 * <p>
 * The engine itself is pure; everything observable about a run happens here.
 */
@Service
public class ValidationService {

    private static final Logger log = LoggerFactory.getLogger(ValidationService.class);

    private final ValidationEngine engine;
    private final QoeGuardMetrics metrics;

    @Autowired
    public ValidationService(ValidationEngine engine,
                             @Autowired(required = false) QoeGuardMetrics metrics) {
        this.engine = engine;
        this.metrics = metrics;
    }

    ValidationService(ValidationEngine engine) {
        this(engine, null);
    }

    /** Engine built from application configuration. */
    public ValidationEngine engine() {
        return engine;
    }

    public ValidationResult validate(String name, JsonValue baseline, JsonValue candidate) {
        return validate(new ComparisonRequest(name, baseline, candidate), engine);
    }

    public ValidationResult validate(ComparisonRequest request, ValidationEngine withEngine) {
        boolean ownsMdc = MDC.get("comparison") == null;
        if (ownsMdc) {
            MdcContext.setComparison(request.name());
        }
        try {
            long start = System.nanoTime();
            ValidationResult result = withEngine.compare(request.name(), request.baseline(), request.candidate());
            long elapsed = System.nanoTime() - start;

            Decision decision = result.decision();
            if (decision.overridden()) {
                log.warn("Comparison {}: override rule {} forced {} (risk {})",
                        request.name(), decision.overrideRule(), decision.outcome(),
                        String.format("%.4f", decision.riskScore()));
            }
            log.info("Comparison {}: {} risk={} changes={} suppressed={}",
                    request.name(), decision.outcome(), String.format("%.4f", decision.riskScore()),
                    result.changes().size(), result.suppressed().size());

            if (metrics != null) {
                metrics.recordDecision(decision.outcome());
                metrics.recordComparisonDuration(elapsed);
                metrics.recordChangeCount(result.changes().size());
                if (decision.overridden()) {
                    metrics.recordOverride(decision.overrideRule());
                }
            }
            return result;
        } finally {
            if (ownsMdc) {
                MdcContext.clear();
            }
        }
    }
}
