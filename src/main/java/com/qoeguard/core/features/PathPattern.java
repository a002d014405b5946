package com.qoeguard.core.features;

import com.qoeguard.core.config.ConfigurationException;
import com.qoeguard.core.model.JsonPath;
import com.qoeguard.core.model.PathSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Segment-wise path prefix used by criticality rules and allowed-drift lists.
 * <p>
 * Syntax: {@code $} followed by any of {@code .name}, {@code ['quoted name']}, {@code [3]},
 * {@code [*]} (any index) and {@code .*} (any field). {@code $.ab} matches {@code $.ab.c}
 * but never {@code $.abc}.
 */
public final class PathPattern {

    private sealed interface Step permits FieldStep, IndexStep, AnyField, AnyIndex {
        boolean matches(PathSegment segment);
    }

    private record FieldStep(String name) implements Step {
        public boolean matches(PathSegment segment) {
            return segment instanceof PathSegment.Field f && f.name().equals(name);
        }
    }

    private record IndexStep(int index) implements Step {
        public boolean matches(PathSegment segment) {
            return segment instanceof PathSegment.Index i && i.index() == index;
        }
    }

    private record AnyField() implements Step {
        public boolean matches(PathSegment segment) {
            return segment instanceof PathSegment.Field;
        }
    }

    private record AnyIndex() implements Step {
        public boolean matches(PathSegment segment) {
            return segment instanceof PathSegment.Index;
        }
    }

    private final String source;
    private final List<Step> steps;

    private PathPattern(String source, List<Step> steps) {
        this.source = source;
        this.steps = List.copyOf(steps);
    }

    /**
     * Parse a pattern string.
     *
     * @throws ConfigurationException if the pattern is blank or not well formed
     */
    public static PathPattern parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new ConfigurationException("Path pattern must not be blank");
        }
        String p = pattern.trim();
        if (p.charAt(0) != '$') {
            throw invalid(p, 0, "must start with '$'");
        }
        List<Step> steps = new ArrayList<>();
        int pos = 1;
        while (pos < p.length()) {
            char c = p.charAt(pos);
            if (c == '.') {
                int start = ++pos;
                if (pos < p.length() && p.charAt(pos) == '*') {
                    steps.add(new AnyField());
                    pos++;
                    continue;
                }
                while (pos < p.length() && p.charAt(pos) != '.' && p.charAt(pos) != '[') {
                    pos++;
                }
                if (pos == start) {
                    throw invalid(p, start, "empty field name");
                }
                steps.add(new FieldStep(p.substring(start, pos)));
            } else if (c == '[') {
                pos++;
                if (pos >= p.length()) {
                    throw invalid(p, pos, "unterminated '['");
                }
                char next = p.charAt(pos);
                if (next == '\'' || next == '"') {
                    StringBuilder name = new StringBuilder();
                    pos++;
                    boolean closed = false;
                    while (pos < p.length()) {
                        char ch = p.charAt(pos);
                        if (ch == '\\' && pos + 1 < p.length()) {
                            name.append(p.charAt(pos + 1));
                            pos += 2;
                        } else if (ch == next) {
                            closed = true;
                            pos++;
                            break;
                        } else {
                            name.append(ch);
                            pos++;
                        }
                    }
                    if (!closed) {
                        throw invalid(p, pos, "unterminated quoted field name");
                    }
                    steps.add(new FieldStep(name.toString()));
                } else if (next == '*') {
                    steps.add(new AnyIndex());
                    pos++;
                } else {
                    int start = pos;
                    while (pos < p.length() && Character.isDigit(p.charAt(pos))) {
                        pos++;
                    }
                    if (pos == start) {
                        throw invalid(p, start, "expected index, '*' or quoted field name");
                    }
                    try {
                        steps.add(new IndexStep(Integer.parseInt(p.substring(start, pos))));
                    } catch (NumberFormatException e) {
                        throw new ConfigurationException("Invalid path pattern '" + p + "': index out of range", e);
                    }
                }
                if (pos >= p.length() || p.charAt(pos) != ']') {
                    throw invalid(p, pos, "expected ']'");
                }
                pos++;
            } else {
                throw invalid(p, pos, "unexpected character '" + c + "'");
            }
        }
        return new PathPattern(p, steps);
    }

    /** True when every step of this pattern matches the leading segments of {@code path}. */
    public boolean matchesPrefixOf(JsonPath path) {
        List<PathSegment> segments = path.segments();
        if (steps.size() > segments.size()) {
            return false;
        }
        for (int i = 0; i < steps.size(); i++) {
            if (!steps.get(i).matches(segments.get(i))) {
                return false;
            }
        }
        return true;
    }

    public int depth() {
        return steps.size();
    }

    public String source() {
        return source;
    }

    private static ConfigurationException invalid(String pattern, int position, String reason) {
        return new ConfigurationException(
                "Invalid path pattern '" + pattern + "' at position " + position + ": " + reason);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathPattern other && steps.equals(other.steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
