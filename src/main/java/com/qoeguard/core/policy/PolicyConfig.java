package com.qoeguard.core.policy;

import com.qoeguard.core.config.ConfigurationException;
import com.qoeguard.core.features.PathPattern;

import java.util.List;

/**
 * Immutable gating policy.
 * <p>
 * Bands are inclusive at their lower bound: {@code [0, warn)} passes,
 * {@code [warn, fail)} warns, {@code [fail, 1]} fails.
 *
 * @param name              policy name shown in reports
 * @param warnThreshold     lowest risk that yields WARN
 * @param failThreshold     lowest risk that yields FAIL
 * @param overrides         rules evaluated in order before thresholds; first match wins
 * @param topN              number of evidence signals to keep
 * @param allowedDriftPaths changes under these prefixes are ignored before feature extraction
 */
public record PolicyConfig(
        String name,
        double warnThreshold,
        double failThreshold,
        List<OverrideRule> overrides,
        int topN,
        List<PathPattern> allowedDriftPaths
) {

    public static final int DEFAULT_TOP_N = 5;

    public PolicyConfig {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Policy name must not be blank");
        }
        checkThreshold("warn", warnThreshold);
        checkThreshold("fail", failThreshold);
        if (warnThreshold >= failThreshold) {
            throw new ConfigurationException("Warn threshold " + warnThreshold
                    + " must be below fail threshold " + failThreshold);
        }
        if (topN < 1) {
            throw new ConfigurationException("Top-N evidence count must be at least 1, got " + topN);
        }
        overrides = List.copyOf(overrides);
        allowedDriftPaths = List.copyOf(allowedDriftPaths);
    }

    public static PolicyConfig defaults() {
        return PolicyPresets.DEFAULT;
    }

    public PolicyConfig withThresholds(double warn, double fail) {
        return new PolicyConfig(name, warn, fail, overrides, topN, allowedDriftPaths);
    }

    public PolicyConfig withTopN(int n) {
        return new PolicyConfig(name, warnThreshold, failThreshold, overrides, n, allowedDriftPaths);
    }

    public PolicyConfig withOverrides(List<OverrideRule> rules) {
        return new PolicyConfig(name, warnThreshold, failThreshold, rules, topN, allowedDriftPaths);
    }

    public PolicyConfig withAllowedDriftPaths(List<PathPattern> paths) {
        return new PolicyConfig(name, warnThreshold, failThreshold, overrides, topN, paths);
    }

    private static void checkThreshold(String label, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new ConfigurationException("The " + label + " threshold must be within [0, 1], got " + value);
        }
    }
}
