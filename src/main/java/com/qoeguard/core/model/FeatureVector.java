package com.qoeguard.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-shape numeric summary of a change list. All fields are non-negative.
 */
public record FeatureVector(
        int addedFields,
        int removedFields,
        int typeChanges,
        int valueChanges,
        double numericDeltaSum,
        double numericDeltaMax,
        int arrayLenChanges,
        int criticalChanges
) {

    public static final FeatureVector ZERO = new FeatureVector(0, 0, 0, 0, 0.0, 0.0, 0, 0);

    public FeatureVector {
        if (addedFields < 0 || removedFields < 0 || typeChanges < 0 || valueChanges < 0
                || arrayLenChanges < 0 || criticalChanges < 0) {
            throw new IllegalArgumentException("Feature counts must be non-negative");
        }
        if (!(numericDeltaSum >= 0) || !(numericDeltaMax >= 0)
                || Double.isInfinite(numericDeltaSum) || Double.isInfinite(numericDeltaMax)) {
            throw new IllegalArgumentException("Numeric deltas must be finite and non-negative");
        }
    }

    public double get(Feature feature) {
        return feature.valueIn(this);
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    /** Copy with one feature replaced; counts are truncated to integers. */
    public FeatureVector with(Feature feature, double value) {
        Map<Feature, Double> values = asMap();
        values.put(feature, value);
        return new FeatureVector(
                values.get(Feature.ADDED_FIELDS).intValue(),
                values.get(Feature.REMOVED_FIELDS).intValue(),
                values.get(Feature.TYPE_CHANGES).intValue(),
                values.get(Feature.VALUE_CHANGES).intValue(),
                values.get(Feature.NUMERIC_DELTA_SUM),
                values.get(Feature.NUMERIC_DELTA_MAX),
                values.get(Feature.ARRAY_LEN_CHANGES).intValue(),
                values.get(Feature.CRITICAL_CHANGES).intValue());
    }

    /** Mutable enum-ordered view of every feature value. */
    public Map<Feature, Double> asMap() {
        Map<Feature, Double> values = new EnumMap<>(Feature.class);
        for (Feature feature : Feature.values()) {
            values.put(feature, feature.valueIn(this));
        }
        return values;
    }

    /** Feature values keyed by their snake_case report names, in report order. */
    public Map<String, Number> toReportMap() {
        Map<String, Number> out = new LinkedHashMap<>();
        out.put(Feature.ADDED_FIELDS.key(), addedFields);
        out.put(Feature.REMOVED_FIELDS.key(), removedFields);
        out.put(Feature.TYPE_CHANGES.key(), typeChanges);
        out.put(Feature.VALUE_CHANGES.key(), valueChanges);
        out.put(Feature.NUMERIC_DELTA_SUM.key(), numericDeltaSum);
        out.put(Feature.NUMERIC_DELTA_MAX.key(), numericDeltaMax);
        out.put(Feature.ARRAY_LEN_CHANGES.key(), arrayLenChanges);
        out.put(Feature.CRITICAL_CHANGES.key(), criticalChanges);
        return Collections.unmodifiableMap(out);
    }
}
