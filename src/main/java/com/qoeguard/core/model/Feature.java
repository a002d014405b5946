package com.qoeguard.core.model;

import java.util.Locale;

/**
 * The eight signals of a {@link FeatureVector}, in report order.
 */
public enum Feature {
    ADDED_FIELDS("added_fields"),
    REMOVED_FIELDS("removed_fields"),
    TYPE_CHANGES("type_changes"),
    VALUE_CHANGES("value_changes"),
    NUMERIC_DELTA_SUM("numeric_delta_sum"),
    NUMERIC_DELTA_MAX("numeric_delta_max"),
    ARRAY_LEN_CHANGES("array_len_changes"),
    CRITICAL_CHANGES("critical_changes");

    private final String key;

    Feature(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /** Read this feature's value from a vector. */
    public double valueIn(FeatureVector vector) {
        return switch (this) {
            case ADDED_FIELDS -> vector.addedFields();
            case REMOVED_FIELDS -> vector.removedFields();
            case TYPE_CHANGES -> vector.typeChanges();
            case VALUE_CHANGES -> vector.valueChanges();
            case NUMERIC_DELTA_SUM -> vector.numericDeltaSum();
            case NUMERIC_DELTA_MAX -> vector.numericDeltaMax();
            case ARRAY_LEN_CHANGES -> vector.arrayLenChanges();
            case CRITICAL_CHANGES -> vector.criticalChanges();
        };
    }

    /** The count feature a change of the given kind increments. */
    public static Feature countedBy(Change change) {
        if (change.isLengthMarker()) {
            return ARRAY_LEN_CHANGES;
        }
        return switch (change.kind()) {
            case ADDED -> ADDED_FIELDS;
            case REMOVED -> REMOVED_FIELDS;
            case TYPE_CHANGED -> TYPE_CHANGES;
            case VALUE_CHANGED -> VALUE_CHANGES;
        };
    }

    /**
     * Resolve a feature from its key. Accepts {@code critical_changes}, {@code critical-changes}
     * and {@code CRITICAL_CHANGES}.
     */
    public static Feature fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Feature key must not be null");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Feature feature : values()) {
            if (feature.key.equals(normalized)) {
                return feature;
            }
        }
        throw new IllegalArgumentException("Unknown feature '" + key + "'");
    }
}
