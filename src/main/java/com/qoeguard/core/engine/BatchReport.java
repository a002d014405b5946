package com.qoeguard.core.engine;

import com.qoeguard.core.model.GateDecision;
import com.qoeguard.core.model.ValidationResult;

import java.util.List;

/**
 * Results of a batch run, in submission order.
 */
public record BatchReport(String runId, List<ValidationResult> results, long durationMs) {

    public BatchReport {
        results = List.copyOf(results);
    }

    /** Most severe outcome across the batch; PASS for an empty batch. */
    public GateDecision worstOutcome() {
        GateDecision worst = GateDecision.PASS;
        for (ValidationResult result : results) {
            worst = GateDecision.worst(worst, result.outcome());
        }
        return worst;
    }

    public long count(GateDecision outcome) {
        return results.stream().filter(r -> r.outcome() == outcome).count();
    }
}
