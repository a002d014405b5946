package com.qoeguard.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured location of a value inside a JSON document.
 * <p>
 * Equality and matching always use the segment list. {@link #toString()} renders the
 * canonical display form ({@code $.playback.items[2].url}) and is never parsed back.
 */
public record JsonPath(List<PathSegment> segments) {

    private static final JsonPath ROOT = new JsonPath(List.of());

    public JsonPath {
        segments = List.copyOf(segments);
        for (int i = 0; i < segments.size() - 1; i++) {
            if (segments.get(i) instanceof PathSegment.LengthMarker) {
                throw new IllegalArgumentException("Length marker must be the last path segment");
            }
        }
    }

    public static JsonPath root() {
        return ROOT;
    }

    public JsonPath field(String name) {
        return append(new PathSegment.Field(name));
    }

    public JsonPath index(int index) {
        return append(new PathSegment.Index(index));
    }

    /** Path of the synthetic change recording this array's length delta. */
    public JsonPath lengthMarker() {
        return append(PathSegment.LengthMarker.INSTANCE);
    }

    public boolean isLengthMarker() {
        return !segments.isEmpty() && segments.get(segments.size() - 1) instanceof PathSegment.LengthMarker;
    }

    /** Segment-wise prefix test; {@code $.ab} is not a prefix of {@code $.abc}. */
    public boolean startsWith(JsonPath prefix) {
        if (prefix.segments.size() > segments.size()) {
            return false;
        }
        return segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    private JsonPath append(PathSegment segment) {
        List<PathSegment> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new JsonPath(next);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("$");
        for (PathSegment segment : segments) {
            sb.append(segment.render());
        }
        return sb.toString();
    }
}
