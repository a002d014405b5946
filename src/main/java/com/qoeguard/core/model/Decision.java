package com.qoeguard.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Gating result for one baseline/candidate comparison.
 *
 * @param outcome       PASS, WARN or FAIL
 * @param riskScore     bounded risk that fed the thresholds
 * @param features      the feature vector the decision was made on
 * @param contributions signed per-feature contributions from the scorer
 * @param topSignals    evidence ranked by absolute contribution, truncated to the policy's top-N
 * @param overrideRule  name of the override rule that forced the outcome, or {@code null}
 */
public record Decision(
        GateDecision outcome,
        double riskScore,
        FeatureVector features,
        Map<Feature, Double> contributions,
        List<Signal> topSignals,
        String overrideRule
) {
    public Decision {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(features, "features");
        Map<Feature, Double> ordered = new EnumMap<>(Feature.class);
        ordered.putAll(contributions);
        contributions = Collections.unmodifiableMap(ordered);
        topSignals = List.copyOf(topSignals);
    }

    public Optional<String> override() {
        return Optional.ofNullable(overrideRule);
    }

    public boolean overridden() {
        return overrideRule != null;
    }
}
