package com.qoeguard.core.features;

import com.qoeguard.core.config.ConfigurationException;

import java.util.Objects;

/**
 * A path prefix and how much changes beneath it matter to playback experience.
 *
 * @param pattern segment-wise path prefix
 * @param weight  criticality in {@code [0, 1]}; a weight of zero marks a path as explicitly non-critical
 */
public record CriticalityRule(PathPattern pattern, double weight) {

    public CriticalityRule {
        Objects.requireNonNull(pattern, "pattern");
        if (!(weight >= 0.0 && weight <= 1.0)) {
            throw new ConfigurationException(
                    "Criticality weight for " + pattern + " must be within [0, 1], got " + weight);
        }
    }

    public static CriticalityRule of(String pattern, double weight) {
        return new CriticalityRule(PathPattern.parse(pattern), weight);
    }

    public boolean isCritical() {
        return weight > 0.0;
    }
}
