package com.qoeguard.core.model;

import com.qoeguard.core.json.JsonValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonPathTest {

    @Test
    @DisplayName("paths render in dotted and bracketed form")
    void rendering() {
        assertEquals("$", JsonPath.root().toString());
        assertEquals("$.playback.items[2].url",
                JsonPath.root().field("playback").field("items").index(2).field("url").toString());
        assertEquals("$['content-type']", JsonPath.root().field("content-type").toString());
        assertEquals("$.ads.length()", JsonPath.root().field("ads").lengthMarker().toString());
    }

    @Test
    @DisplayName("prefix checks compare whole segments")
    void startsWith() {
        JsonPath abc = JsonPath.root().field("abc");
        assertFalse(abc.startsWith(JsonPath.root().field("ab")));
        assertTrue(abc.field("x").startsWith(abc));
        assertTrue(abc.startsWith(JsonPath.root()));
    }

    @Test
    @DisplayName("a field literally named length() is not a marker")
    void markerIsStructural() {
        JsonPath literal = JsonPath.root().field("ads").field("length()");
        JsonPath marker = JsonPath.root().field("ads").lengthMarker();
        assertNotEquals(literal, marker);
        assertFalse(literal.isLengthMarker());
        assertTrue(marker.isLengthMarker());
        assertThrows(IllegalArgumentException.class, () -> marker.field("x"));
    }

    @Test
    @DisplayName("changes enforce which sides are present")
    void changeInvariants() {
        JsonPath p = JsonPath.root().field("a");
        assertThrows(IllegalArgumentException.class, () -> new Change(p, ChangeKind.ADDED, JsonValue.of(1), JsonValue.of(2)));
        assertThrows(IllegalArgumentException.class, () -> Change.typeChanged(p, JsonValue.of(1), JsonValue.of(2)));
        assertThrows(IllegalArgumentException.class, () -> Change.valueChanged(p, JsonValue.of(1), JsonValue.of(1)));
        assertEquals(3.0, Change.valueChanged(p, JsonValue.of(5), JsonValue.of(2)).numericDelta().getAsDouble());
        assertTrue(Change.lengthChanged(p, 3, 2).numericDelta().isEmpty());
    }

    @Test
    @DisplayName("gate decisions order by severity")
    void severity() {
        assertEquals(GateDecision.FAIL, GateDecision.worst(GateDecision.WARN, GateDecision.FAIL));
        assertEquals(GateDecision.WARN, GateDecision.worst(GateDecision.WARN, GateDecision.PASS));
        assertTrue(GateDecision.WARN.isWorseThan(GateDecision.PASS));
    }
}
