package com.qoeguard.core.scoring;

import com.qoeguard.core.config.ConfigurationException;
import com.qoeguard.core.model.Feature;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable linear weights, bias and optional per-feature scaling for risk scoring.
 * <p>
 * Every feature carries a weight. Negative weights are rejected unless
 * {@code allowNegative} is set, since monotonic gating relies on non-negative weights.
 */
public final class WeightConfig {

    private static final WeightConfig DEFAULTS = builder()
            .weight(Feature.CRITICAL_CHANGES, 0.18)
            .weight(Feature.TYPE_CHANGES, 0.14)
            .weight(Feature.REMOVED_FIELDS, 0.10)
            .weight(Feature.ADDED_FIELDS, 0.05)
            .weight(Feature.ARRAY_LEN_CHANGES, 0.07)
            .weight(Feature.NUMERIC_DELTA_MAX, 0.16)
            .weight(Feature.NUMERIC_DELTA_SUM, 0.06)
            .weight(Feature.VALUE_CHANGES, 0.04)
            .scale(Feature.NUMERIC_DELTA_MAX, new FeatureScale(5.0, 10.0))
            .scale(Feature.NUMERIC_DELTA_SUM, new FeatureScale(10.0, 10.0))
            .scale(Feature.VALUE_CHANGES, new FeatureScale(10.0, 10.0))
            .bias(-1.2)
            .build();

    private final Map<Feature, Double> weights;
    private final Map<Feature, FeatureScale> scales;
    private final double bias;
    private final boolean allowNegative;

    private WeightConfig(Builder builder) {
        Map<Feature, Double> w = new EnumMap<>(Feature.class);
        Map<Feature, FeatureScale> s = new EnumMap<>(Feature.class);
        for (Feature feature : Feature.values()) {
            Double weight = builder.weights.get(feature);
            if (weight == null) {
                throw new ConfigurationException("Missing weight for feature " + feature.key());
            }
            if (!Double.isFinite(weight)) {
                throw new ConfigurationException("Weight for " + feature.key() + " must be finite, got " + weight);
            }
            if (weight < 0 && !builder.allowNegative) {
                throw new ConfigurationException("Negative weight " + weight + " for " + feature.key()
                        + " (set allow-negative to permit)");
            }
            w.put(feature, weight);
            s.put(feature, builder.scales.getOrDefault(feature, FeatureScale.IDENTITY));
        }
        if (!Double.isFinite(builder.bias)) {
            throw new ConfigurationException("Bias must be finite, got " + builder.bias);
        }
        this.weights = Collections.unmodifiableMap(w);
        this.scales = Collections.unmodifiableMap(s);
        this.bias = builder.bias;
        this.allowNegative = builder.allowNegative;
    }

    /** Interpretable QoE-aware defaults with a low-risk bias. */
    public static WeightConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with this configuration's values. */
    public Builder toBuilder() {
        Builder builder = new Builder().bias(bias).allowNegative(allowNegative);
        builder.weights.putAll(weights);
        scales.forEach((feature, scale) -> {
            if (!scale.isIdentity()) {
                builder.scale(feature, scale);
            }
        });
        return builder;
    }

    public double weight(Feature feature) {
        return weights.get(feature);
    }

    public FeatureScale scale(Feature feature) {
        return scales.get(feature);
    }

    /** Feature value after scaling, before weighting. */
    public double scaled(Feature feature, double rawValue) {
        return scales.get(feature).apply(rawValue);
    }

    public Map<Feature, Double> weights() {
        return weights;
    }

    public double bias() {
        return bias;
    }

    public boolean allowNegative() {
        return allowNegative;
    }

    @Override
    public String toString() {
        return "WeightConfig{bias=" + bias + ", weights=" + weights + "}";
    }

    public static final class Builder {
        private final Map<Feature, Double> weights = new EnumMap<>(Feature.class);
        private final Map<Feature, FeatureScale> scales = new EnumMap<>(Feature.class);
        private double bias;
        private boolean allowNegative;

        private Builder() {
        }

        public Builder weight(Feature feature, double weight) {
            weights.put(feature, weight);
            return this;
        }

        public Builder scale(Feature feature, FeatureScale scale) {
            scales.put(feature, scale);
            return this;
        }

        public Builder bias(double bias) {
            this.bias = bias;
            return this;
        }

        public Builder allowNegative(boolean allowNegative) {
            this.allowNegative = allowNegative;
            return this;
        }

        public WeightConfig build() {
            return new WeightConfig(this);
        }
    }
}
