package com.qoeguard.core.policy;

import com.qoeguard.core.config.ConfigurationException;
import com.qoeguard.core.model.Feature;
import com.qoeguard.core.model.FeatureVector;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single comparison against one feature, e.g. {@code critical_changes >= 3}.
 */
public record FeatureCondition(Feature feature, Comparison comparison, double threshold) {

    /** "critical_changes >= 3", whitespace optional. */
    private static final Pattern CONDITION =
            Pattern.compile("\\s*([A-Za-z_][A-Za-z0-9_-]*)\\s*(>=|<=|==|>|<)\\s*(-?\\d+(?:\\.\\d+)?)\\s*");

    public enum Comparison {
        GTE(">="), GT(">"), LTE("<="), LT("<"), EQ("==");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        boolean test(double value, double threshold) {
            return switch (this) {
                case GTE -> value >= threshold;
                case GT -> value > threshold;
                case LTE -> value <= threshold;
                case LT -> value < threshold;
                case EQ -> value == threshold;
            };
        }

        static Comparison fromSymbol(String symbol) {
            for (Comparison c : values()) {
                if (c.symbol.equals(symbol)) {
                    return c;
                }
            }
            throw new ConfigurationException("Unknown comparison '" + symbol + "'");
        }
    }

    public FeatureCondition {
        Objects.requireNonNull(feature, "feature");
        Objects.requireNonNull(comparison, "comparison");
        if (!Double.isFinite(threshold)) {
            throw new ConfigurationException("Condition threshold must be finite, got " + threshold);
        }
    }

    public static FeatureCondition atLeast(Feature feature, double threshold) {
        return new FeatureCondition(feature, Comparison.GTE, threshold);
    }

    /**
     * Parse a condition such as {@code type_changes>=1}.
     *
     * @throws ConfigurationException if the expression or feature name is not recognised
     */
    public static FeatureCondition parse(String expression) {
        Matcher m = CONDITION.matcher(expression == null ? "" : expression);
        if (!m.matches()) {
            throw new ConfigurationException("Invalid override condition '" + expression
                    + "', expected e.g. 'critical_changes>=3'");
        }
        Feature feature;
        try {
            feature = Feature.fromKey(m.group(1));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid override condition '" + expression + "': " + e.getMessage(), e);
        }
        return new FeatureCondition(feature, Comparison.fromSymbol(m.group(2)), Double.parseDouble(m.group(3)));
    }

    public boolean test(FeatureVector features) {
        return comparison.test(features.get(feature), threshold);
    }

    @Override
    public String toString() {
        String t = threshold == Math.rint(threshold) ? String.valueOf((long) threshold) : String.valueOf(threshold);
        return feature.key() + comparison.symbol() + t;
    }
}
