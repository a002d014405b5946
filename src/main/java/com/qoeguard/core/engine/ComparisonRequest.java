package com.qoeguard.core.engine;

import com.qoeguard.core.json.JsonValue;

import java.util.Objects;

/**
 * A named baseline/candidate pair submitted for validation.
 */
public record ComparisonRequest(String name, JsonValue baseline, JsonValue candidate) {
    public ComparisonRequest {
        Objects.requireNonNull(name, "name");
        baseline = baseline != null ? baseline : JsonValue.nullValue();
        candidate = candidate != null ? candidate : JsonValue.nullValue();
    }
}
