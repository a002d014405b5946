package com.qoeguard.dispatch.cli;

import com.qoeguard.core.engine.ValidationEngine;
import com.qoeguard.core.policy.PolicyConfig;
import com.qoeguard.core.policy.PolicyPresets;
import com.qoeguard.core.scoring.RiskScorers;
import picocli.CommandLine.Option;

/**
 * Command-line overrides applied on top of the configured engine.
 * Shared by the validate, batch and policy commands.
 */
public class EngineOptions {

    @Option(names = "--preset", description = "Policy preset: default, strict, permissive")
    String preset;

    @Option(names = "--scorer", description = "Risk scorer: logistic, tree")
    String scorer;

    @Option(names = "--warn-threshold", description = "Risk at or above which the outcome is WARN")
    Double warnThreshold;

    @Option(names = "--fail-threshold", description = "Risk at or above which the outcome is FAIL")
    Double failThreshold;

    @Option(names = "--top-n", description = "Number of evidence signals to report")
    Integer topN;

    /**
     * Derive the engine for this invocation. A preset replaces thresholds and override rules
     * but keeps the configured top-N and allowed drift paths; explicit options win over both.
     *
     * @throws com.qoeguard.core.config.ConfigurationException if an option value is invalid
     */
    public ValidationEngine apply(ValidationEngine base) {
        ValidationEngine engine = base;
        PolicyConfig policy = base.policy();
        if (preset != null) {
            policy = PolicyPresets.forName(preset)
                    .withTopN(policy.topN())
                    .withAllowedDriftPaths(policy.allowedDriftPaths());
        }
        if (warnThreshold != null || failThreshold != null) {
            policy = policy.withThresholds(
                    warnThreshold != null ? warnThreshold : policy.warnThreshold(),
                    failThreshold != null ? failThreshold : policy.failThreshold());
        }
        if (topN != null) {
            policy = policy.withTopN(topN);
        }
        if (scorer != null) {
            engine = engine.withScorer(RiskScorers.forName(scorer));
        }
        return engine.withPolicy(policy);
    }
}
