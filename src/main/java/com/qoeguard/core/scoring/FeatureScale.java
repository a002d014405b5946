package com.qoeguard.core.scoring;

import com.qoeguard.core.config.ConfigurationException;

/**
 * Monotone transform {@code min(value / divisor, cap)} applied to a raw feature before weighting.
 */
public record FeatureScale(double divisor, double cap) {

    public static final FeatureScale IDENTITY = new FeatureScale(1.0, Double.POSITIVE_INFINITY);

    public FeatureScale {
        if (!(divisor > 0.0) || Double.isInfinite(divisor)) {
            throw new ConfigurationException("Feature scale divisor must be a positive finite number, got " + divisor);
        }
        if (!(cap > 0.0)) {
            throw new ConfigurationException("Feature scale cap must be positive, got " + cap);
        }
    }

    public double apply(double value) {
        return Math.min(value / divisor, cap);
    }

    public boolean isIdentity() {
        return divisor == 1.0 && cap == Double.POSITIVE_INFINITY;
    }
}
