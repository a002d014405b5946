package com.qoeguard.core.engine;

import com.qoeguard.core.diff.DiffEngine;
import com.qoeguard.core.features.CriticalityConfig;
import com.qoeguard.core.features.Extraction;
import com.qoeguard.core.features.FeatureExtractor;
import com.qoeguard.core.features.PathPattern;
import com.qoeguard.core.json.JsonValue;
import com.qoeguard.core.model.Change;
import com.qoeguard.core.model.Decision;
import com.qoeguard.core.model.RiskScore;
import com.qoeguard.core.model.ValidationResult;
import com.qoeguard.core.policy.PolicyConfig;
import com.qoeguard.core.policy.PolicyEngine;
import com.qoeguard.core.scoring.RiskScorer;
import com.qoeguard.core.scoring.WeightConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The comparison pipeline: diff, extract, score, decide.
 * <p>
 * Holds only immutable configuration, so one instance can serve any number of threads.
 * Variants with different configuration are derived with the {@code with*} methods.
 */
public final class ValidationEngine {

    private final DiffEngine diffEngine;
    private final FeatureExtractor extractor;
    private final RiskScorer scorer;
    private final PolicyEngine policyEngine;
    private final CriticalityConfig criticality;
    private final WeightConfig weights;
    private final PolicyConfig policy;

    public ValidationEngine(DiffEngine diffEngine, FeatureExtractor extractor, RiskScorer scorer,
                            PolicyEngine policyEngine, CriticalityConfig criticality,
                            WeightConfig weights, PolicyConfig policy) {
        this.diffEngine = Objects.requireNonNull(diffEngine, "diffEngine");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.policyEngine = Objects.requireNonNull(policyEngine, "policyEngine");
        this.criticality = Objects.requireNonNull(criticality, "criticality");
        this.weights = Objects.requireNonNull(weights, "weights");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public ValidationEngine(RiskScorer scorer, CriticalityConfig criticality,
                            WeightConfig weights, PolicyConfig policy) {
        this(new DiffEngine(), new FeatureExtractor(), scorer, new PolicyEngine(), criticality, weights, policy);
    }

    public ValidationResult compare(String name, JsonValue baseline, JsonValue candidate) {
        List<Change> all = diffEngine.diff(baseline, candidate);
        List<Change> scored = new ArrayList<>(all.size());
        List<Change> suppressed = new ArrayList<>();
        for (Change change : all) {
            if (isAllowedDrift(change)) {
                suppressed.add(change);
            } else {
                scored.add(change);
            }
        }
        Extraction extraction = extractor.extract(scored, criticality);
        RiskScore score = scorer.score(extraction.features(), weights);
        Decision decision = policyEngine.decide(score, extraction, policy);
        return new ValidationResult(name, scored, suppressed, score, decision);
    }

    public ValidationResult compare(JsonValue baseline, JsonValue candidate) {
        return compare("comparison", baseline, candidate);
    }

    private boolean isAllowedDrift(Change change) {
        for (PathPattern allowed : policy.allowedDriftPaths()) {
            if (allowed.matchesPrefixOf(change.path())) {
                return true;
            }
        }
        return false;
    }

    public ValidationEngine withPolicy(PolicyConfig newPolicy) {
        return new ValidationEngine(diffEngine, extractor, scorer, policyEngine, criticality, weights, newPolicy);
    }

    public ValidationEngine withScorer(RiskScorer newScorer) {
        return new ValidationEngine(diffEngine, extractor, newScorer, policyEngine, criticality, weights, policy);
    }

    public RiskScorer scorer() {
        return scorer;
    }

    public CriticalityConfig criticality() {
        return criticality;
    }

    public WeightConfig weights() {
        return weights;
    }

    public PolicyConfig policy() {
        return policy;
    }
}
