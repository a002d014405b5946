package com.qoeguard.core.policy;

import com.qoeguard.core.features.CriticalChange;
import com.qoeguard.core.features.Extraction;
import com.qoeguard.core.model.Decision;
import com.qoeguard.core.model.Feature;
import com.qoeguard.core.model.FeatureVector;
import com.qoeguard.core.model.GateDecision;
import com.qoeguard.core.model.RiskScore;
import com.qoeguard.core.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a risk score and feature vector into a PASS/WARN/FAIL decision with ranked evidence.
 * <p>
 * Override rules are checked first, in configured order, and the first match decides.
 * Otherwise the score is placed into the policy's threshold bands. Total over valid inputs;
 * configuration errors are rejected when the {@link PolicyConfig} is built.
 */
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    /** Larger magnitude first; ties keep insertion order (features before changes). */
    private static final Comparator<Signal> BY_MAGNITUDE =
            Comparator.comparingDouble((Signal s) -> Math.abs(s.contribution())).reversed();

    public Decision decide(RiskScore score, Extraction extraction, PolicyConfig policy) {
        FeatureVector features = extraction.features();

        GateDecision outcome = null;
        String firedRule = null;
        for (OverrideRule rule : policy.overrides()) {
            if (rule.matches(features)) {
                outcome = rule.outcome();
                firedRule = rule.name();
                log.debug("Override rule {} matched ({}) => {}", rule.name(), rule.expression(), outcome);
                break;
            }
        }
        if (outcome == null) {
            outcome = band(score.risk(), policy);
        }

        List<Signal> evidence = rankEvidence(score, extraction, policy.topN());
        return new Decision(outcome, score.risk(), features, score.contributions(), evidence, firedRule);
    }

    /** Threshold bands, inclusive at each lower bound. */
    static GateDecision band(double risk, PolicyConfig policy) {
        if (risk >= policy.failThreshold()) {
            return GateDecision.FAIL;
        }
        if (risk >= policy.warnThreshold()) {
            return GateDecision.WARN;
        }
        return GateDecision.PASS;
    }

    /**
     * Merge feature contributions and critical-path changes, rank by absolute contribution,
     * and keep the top {@code limit}.
     * <p>
     * A critical change is credited with its rule's criticality times its per-unit share of the
     * {@code critical_changes} contribution plus its per-unit share of the count feature its
     * kind increments.
     */
    static List<Signal> rankEvidence(RiskScore score, Extraction extraction, int limit) {
        FeatureVector features = extraction.features();
        List<Signal> signals = new ArrayList<>();
        for (Feature feature : Feature.values()) {
            double contribution = score.contribution(feature);
            if (contribution != 0.0) {
                signals.add(new Signal.FeatureSignal(feature, features.get(feature), contribution));
            }
        }
        double criticalShare = unitShare(score, features, Feature.CRITICAL_CHANGES);
        for (CriticalChange critical : extraction.criticalEvidence()) {
            Feature counted = Feature.countedBy(critical.change());
            double contribution = critical.criticality()
                    * (criticalShare + unitShare(score, features, counted));
            signals.add(new Signal.ChangeSignal(critical.change(), critical.criticality(),
                    critical.rule().pattern().source(), contribution));
        }
        signals.sort(BY_MAGNITUDE);
        return signals.size() > limit ? List.copyOf(signals.subList(0, limit)) : List.copyOf(signals);
    }

    private static double unitShare(RiskScore score, FeatureVector features, Feature feature) {
        double count = features.get(feature);
        return count > 0 ? score.contribution(feature) / count : 0.0;
    }
}
