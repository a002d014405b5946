package com.qoeguard.core.model;

import com.qoeguard.core.json.JsonValue;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A single difference between baseline and candidate at one {@link JsonPath}.
 * <p>
 * {@code before} is {@code null} exactly when the kind is {@link ChangeKind#ADDED};
 * {@code after} is {@code null} exactly when the kind is {@link ChangeKind#REMOVED}.
 */
public record Change(JsonPath path, ChangeKind kind, JsonValue before, JsonValue after) {

    public Change {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case ADDED -> {
                require(before == null, "added change must not carry a baseline value", path);
                require(after != null, "added change must carry a candidate value", path);
            }
            case REMOVED -> {
                require(before != null, "removed change must carry a baseline value", path);
                require(after == null, "removed change must not carry a candidate value", path);
            }
            case TYPE_CHANGED -> {
                require(before != null && after != null, "type change needs both values", path);
                require(before.type() != after.type(), "type change needs different JSON types", path);
            }
            case VALUE_CHANGED -> {
                require(before != null && after != null, "value change needs both values", path);
                require(before.type() == after.type(), "value change needs the same JSON type", path);
                require(!before.equals(after), "value change needs different values", path);
            }
        }
    }

    public static Change added(JsonPath path, JsonValue after) {
        return new Change(path, ChangeKind.ADDED, null, after);
    }

    public static Change removed(JsonPath path, JsonValue before) {
        return new Change(path, ChangeKind.REMOVED, before, null);
    }

    public static Change typeChanged(JsonPath path, JsonValue before, JsonValue after) {
        return new Change(path, ChangeKind.TYPE_CHANGED, before, after);
    }

    public static Change valueChanged(JsonPath path, JsonValue before, JsonValue after) {
        return new Change(path, ChangeKind.VALUE_CHANGED, before, after);
    }

    /** Synthetic change recording an array's cardinality moving from {@code oldSize} to {@code newSize}. */
    public static Change lengthChanged(JsonPath arrayPath, int oldSize, int newSize) {
        return valueChanged(arrayPath.lengthMarker(), JsonValue.of(oldSize), JsonValue.of(newSize));
    }

    public boolean isLengthMarker() {
        return path.isLengthMarker();
    }

    /**
     * Magnitude {@code |after - before|} for a value change between two numbers, saturated
     * at {@link Double#MAX_VALUE}. Empty for every other change, including length markers.
     */
    public OptionalDouble numericDelta() {
        if (kind != ChangeKind.VALUE_CHANGED || isLengthMarker()
                || !(before instanceof JsonValue.NumberValue b)
                || !(after instanceof JsonValue.NumberValue a)) {
            return OptionalDouble.empty();
        }
        double delta = Math.abs(a.value() - b.value());
        return OptionalDouble.of(Double.isFinite(delta) ? delta : Double.MAX_VALUE);
    }

    /** The change that would be reported with baseline and candidate swapped. */
    public Change inverse() {
        return new Change(path, kind.inverse(), after, before);
    }

    private static void require(boolean condition, String message, JsonPath path) {
        if (!condition) {
            throw new IllegalArgumentException(message + " at " + path);
        }
    }
}
