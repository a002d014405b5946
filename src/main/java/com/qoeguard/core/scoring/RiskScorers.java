package com.qoeguard.core.scoring;

import com.qoeguard.core.config.ConfigurationException;

import java.util.Locale;

/**
 * Lookup of the built-in {@link RiskScorer} strategies by name.
 */
public final class RiskScorers {

    private RiskScorers() {
        // utility class
    }

    public static RiskScorer forName(String name) {
        String key = name == null ? LogisticRiskScorer.NAME : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case LogisticRiskScorer.NAME, "" -> new LogisticRiskScorer();
            case ThresholdTreeScorer.NAME -> new ThresholdTreeScorer();
            default -> throw new ConfigurationException("Unknown scorer '" + name
                    + "'. Valid scorers: " + LogisticRiskScorer.NAME + ", " + ThresholdTreeScorer.NAME);
        };
    }
}
