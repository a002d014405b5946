package com.qoeguard.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Full output of one baseline/candidate comparison.
 *
 * @param name       comparison name (endpoint or scenario), used in reports and logs
 * @param changes    changes that were scored, in diff order
 * @param suppressed changes dropped because they fall under an allowed drift path
 * @param riskScore  scorer output, including per-feature contributions
 * @param decision   gating decision with ranked evidence
 */
public record ValidationResult(
        String name,
        List<Change> changes,
        List<Change> suppressed,
        RiskScore riskScore,
        Decision decision
) {
    public ValidationResult {
        Objects.requireNonNull(name, "name");
        changes = List.copyOf(changes);
        suppressed = List.copyOf(suppressed);
        Objects.requireNonNull(riskScore, "riskScore");
        Objects.requireNonNull(decision, "decision");
    }

    public GateDecision outcome() {
        return decision.outcome();
    }

    public FeatureVector features() {
        return decision.features();
    }
}
