package com.qoeguard.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between Jackson's tree model and {@link JsonValue}.
 */
public final class JsonValues {

    private JsonValues() {
        // utility class
    }

    /**
     * Convert a Jackson tree into a {@link JsonValue}. A {@code null} or missing node maps
     * to the JSON {@code null} value, so an absent document compares as {@code null}.
     */
    public static JsonValue fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JsonValue.nullValue();
        }
        if (node.isBoolean()) {
            return JsonValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return JsonValue.of(saturate(node.doubleValue()));
        }
        if (node.isTextual()) {
            return JsonValue.of(node.textValue());
        }
        if (node.isArray()) {
            List<JsonValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromNode(item));
            }
            return JsonValue.array(items);
        }
        if (node.isObject()) {
            Map<String, JsonValue> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                fields.put(entry.getKey(), fromNode(entry.getValue()));
            }
            return JsonValue.object(fields);
        }
        // Binary and POJO nodes only appear in hand-built trees; keep their text form.
        return JsonValue.of(node.asText());
    }

    /** Numbers beyond the double range, such as {@code 1e400}, clamp to the largest finite value. */
    static double saturate(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return Double.MAX_VALUE;
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return -Double.MAX_VALUE;
        }
        return value;
    }

    /**
     * Convert a {@link JsonValue} back into a Jackson tree for report serialization.
     * Integral numbers are written without a fractional part.
     */
    public static JsonNode toNode(JsonValue value) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        switch (value.type()) {
            case NULL:
                return factory.nullNode();
            case BOOLEAN:
                return factory.booleanNode(((JsonValue.BoolValue) value).value());
            case NUMBER: {
                double d = ((JsonValue.NumberValue) value).value();
                if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                    return factory.numberNode((long) d);
                }
                return factory.numberNode(d);
            }
            case STRING:
                return factory.textNode(((JsonValue.StringValue) value).value());
            case ARRAY: {
                ArrayNode array = factory.arrayNode();
                for (JsonValue item : ((JsonValue.ArrayValue) value).items()) {
                    array.add(toNode(item));
                }
                return array;
            }
            case OBJECT: {
                ObjectNode object = factory.objectNode();
                ((JsonValue.ObjectValue) value).fields().forEach((k, v) -> object.set(k, toNode(v)));
                return object;
            }
            default:
                throw new IllegalStateException("Unhandled JSON type " + value.type());
        }
    }

    /** Short single-line rendering used in console summaries. */
    public static String toDisplayString(JsonValue value) {
        if (value == null) {
            return "<absent>";
        }
        return toNode(value).toString();
    }
}
