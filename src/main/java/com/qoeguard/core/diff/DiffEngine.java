package com.qoeguard.core.diff;

import com.qoeguard.core.json.JsonValue;
import com.qoeguard.core.model.Change;
import com.qoeguard.core.model.JsonPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Hierarchical structural diff between a baseline and a candidate JSON document.
 * <p>
 * Output order is deterministic: depth-first pre-order over the baseline's own field and
 * index order. At each object level, removed and shared fields come first in baseline order,
 * then fields that exist only in the candidate in candidate order. For arrays of different
 * length, the length-marker change precedes the per-index changes.
 * <p>
 * Every pair of values yields a change list; there is no error path. Stateless and safe to
 * share between threads.
 */
public class DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    public List<Change> diff(JsonValue baseline, JsonValue candidate) {
        List<Change> changes = new ArrayList<>();
        walk(orNull(baseline), orNull(candidate), JsonPath.root(), changes);
        log.debug("Diff produced {} changes", changes.size());
        return Collections.unmodifiableList(changes);
    }

    private void walk(JsonValue before, JsonValue after, JsonPath path, List<Change> out) {
        if (before.type() != after.type()) {
            // 8000 vs "8000" is a representation change, never normalized away
            out.add(Change.typeChanged(path, before, after));
            return;
        }
        switch (before.type()) {
            case OBJECT -> diffObjects((JsonValue.ObjectValue) before, (JsonValue.ObjectValue) after, path, out);
            case ARRAY -> diffArrays((JsonValue.ArrayValue) before, (JsonValue.ArrayValue) after, path, out);
            default -> {
                if (!sameScalar(before, after)) {
                    out.add(Change.valueChanged(path, before, after));
                }
            }
        }
    }

    private void diffObjects(JsonValue.ObjectValue before, JsonValue.ObjectValue after,
                             JsonPath path, List<Change> out) {
        Map<String, JsonValue> candidateFields = after.fields();
        for (Map.Entry<String, JsonValue> entry : before.fields().entrySet()) {
            JsonValue counterpart = candidateFields.get(entry.getKey());
            JsonPath child = path.field(entry.getKey());
            if (counterpart == null) {
                out.add(Change.removed(child, entry.getValue()));
            } else {
                walk(entry.getValue(), counterpart, child, out);
            }
        }
        Map<String, JsonValue> baselineFields = before.fields();
        for (Map.Entry<String, JsonValue> entry : candidateFields.entrySet()) {
            if (!baselineFields.containsKey(entry.getKey())) {
                out.add(Change.added(path.field(entry.getKey()), entry.getValue()));
            }
        }
    }

    private void diffArrays(JsonValue.ArrayValue before, JsonValue.ArrayValue after,
                            JsonPath path, List<Change> out) {
        List<JsonValue> oldItems = before.items();
        List<JsonValue> newItems = after.items();
        if (oldItems.size() != newItems.size()) {
            out.add(Change.lengthChanged(path, oldItems.size(), newItems.size()));
        }
        int overlap = Math.min(oldItems.size(), newItems.size());
        for (int i = 0; i < overlap; i++) {
            walk(oldItems.get(i), newItems.get(i), path.index(i), out);
        }
        for (int i = overlap; i < oldItems.size(); i++) {
            out.add(Change.removed(path.index(i), oldItems.get(i)));
        }
        for (int i = overlap; i < newItems.size(); i++) {
            out.add(Change.added(path.index(i), newItems.get(i)));
        }
    }

    private static boolean sameScalar(JsonValue before, JsonValue after) {
        return switch (before.type()) {
            case NULL -> true;
            case BOOLEAN -> ((JsonValue.BoolValue) before).value() == ((JsonValue.BoolValue) after).value();
            case NUMBER -> ((JsonValue.NumberValue) before).value() == ((JsonValue.NumberValue) after).value();
            case STRING -> ((JsonValue.StringValue) before).value().equals(((JsonValue.StringValue) after).value());
            default -> throw new IllegalStateException("Not a scalar: " + before.type());
        };
    }

    private static JsonValue orNull(JsonValue value) {
        return value != null ? value : JsonValue.nullValue();
    }
}
