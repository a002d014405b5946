package com.qoeguard.core.json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable decoded JSON value.
 * <p>
 * Closed over the six JSON variants. Callers branch on {@link #type()}; the diff engine
 * relies on the variant tag alone to tell a type change from a value change, so
 * {@code 8000} and {@code "8000"} are never considered equal.
 */
public sealed interface JsonValue
        permits JsonValue.NullValue, JsonValue.BoolValue, JsonValue.NumberValue,
                JsonValue.StringValue, JsonValue.ArrayValue, JsonValue.ObjectValue {

    enum Type {
        NULL, BOOLEAN, NUMBER, STRING, ARRAY, OBJECT
    }

    Type type();

    static JsonValue nullValue() {
        return NullValue.INSTANCE;
    }

    static JsonValue of(boolean value) {
        return new BoolValue(value);
    }

    static JsonValue of(double value) {
        return new NumberValue(value);
    }

    static JsonValue of(String value) {
        return new StringValue(value);
    }

    static JsonValue array(JsonValue... items) {
        return new ArrayValue(List.of(items));
    }

    static JsonValue array(List<JsonValue> items) {
        return new ArrayValue(items);
    }

    static JsonValue object(Map<String, JsonValue> fields) {
        return new ObjectValue(fields);
    }

    record NullValue() implements JsonValue {
        static final NullValue INSTANCE = new NullValue();

        @Override
        public Type type() {
            return Type.NULL;
        }
    }

    record BoolValue(boolean value) implements JsonValue {
        @Override
        public Type type() {
            return Type.BOOLEAN;
        }
    }

    record NumberValue(double value) implements JsonValue {
        public NumberValue {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("JSON numbers must be finite: " + value);
            }
        }

        @Override
        public Type type() {
            return Type.NUMBER;
        }
    }

    record StringValue(String value) implements JsonValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Type type() {
            return Type.STRING;
        }
    }

    record ArrayValue(List<JsonValue> items) implements JsonValue {
        public ArrayValue {
            items = List.copyOf(items);
        }

        public int size() {
            return items.size();
        }

        @Override
        public Type type() {
            return Type.ARRAY;
        }
    }

    /** Field order follows insertion order of the source document. */
    record ObjectValue(Map<String, JsonValue> fields) implements JsonValue {
        public ObjectValue {
            Objects.requireNonNull(fields, "fields");
            fields.forEach((k, v) -> {
                Objects.requireNonNull(k, "field name");
                Objects.requireNonNull(v, "field value");
            });
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public Type type() {
            return Type.OBJECT;
        }
    }
}
