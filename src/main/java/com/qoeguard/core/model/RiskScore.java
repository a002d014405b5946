package com.qoeguard.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Output of a risk scorer: a bounded score and the signed share each feature contributed.
 *
 * @param risk          risk in {@code [0, 1]}
 * @param contributions signed contribution per feature, covering every {@link Feature}
 * @param scorer        name of the strategy that produced the score
 */
public record RiskScore(double risk, Map<Feature, Double> contributions, String scorer) {

    public RiskScore {
        if (!(risk >= 0.0 && risk <= 1.0)) {
            throw new IllegalArgumentException("Risk must be within [0, 1]: " + risk);
        }
        Objects.requireNonNull(scorer, "scorer");
        Map<Feature, Double> copy = new EnumMap<>(Feature.class);
        for (Feature feature : Feature.values()) {
            copy.put(feature, contributions.getOrDefault(feature, 0.0));
        }
        contributions = Collections.unmodifiableMap(copy);
    }

    public double contribution(Feature feature) {
        return contributions.get(feature);
    }
}
