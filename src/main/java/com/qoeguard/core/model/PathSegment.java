package com.qoeguard.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One step of a {@link JsonPath}: an object field, an array index, or the synthetic
 * length marker that carries an array's cardinality change.
 */
public sealed interface PathSegment permits PathSegment.Field, PathSegment.Index, PathSegment.LengthMarker {

    /** Render this segment as it appears after its parent in a dotted/bracketed path. */
    String render();

    record Field(String name) implements PathSegment {
        private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

        public Field {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String render() {
            if (IDENTIFIER.matcher(name).matches()) {
                return "." + name;
            }
            return "['" + name.replace("\\", "\\\\").replace("'", "\\'") + "']";
        }
    }

    record Index(int index) implements PathSegment {
        public Index {
            if (index < 0) {
                throw new IllegalArgumentException("Array index must be non-negative: " + index);
            }
        }

        @Override
        public String render() {
            return "[" + index + "]";
        }
    }

    record LengthMarker() implements PathSegment {
        static final LengthMarker INSTANCE = new LengthMarker();

        @Override
        public String render() {
            return ".length()";
        }
    }
}
