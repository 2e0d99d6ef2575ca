package nl.bytesoflife.coefficients.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonParserTest {

    private final JsonParser parser = new JsonParser();

    @Test
    void parsesNestedObjectsInDocumentOrder() {
        Map<String, Object> root = parser.parseObject(
                "{\"zeta\": {\"b\": 1, \"a\": 2}, \"alpha\": [1.5, -2, 3e2], \"flag\": true, \"none\": null}");

        assertEquals(List.of("zeta", "alpha", "flag", "none"), List.copyOf(root.keySet()));
        @SuppressWarnings("unchecked")
        Map<String, Object> zeta = (Map<String, Object>) root.get("zeta");
        assertEquals(List.of("b", "a"), List.copyOf(zeta.keySet()));
        assertEquals(List.of(1.5, -2, 300.0), root.get("alpha"));
        assertEquals(Boolean.TRUE, root.get("flag"));
        assertTrue(root.containsKey("none"));
        assertNull(root.get("none"));
    }

    @Test
    void numberTypesFollowTheirNotation() {
        assertEquals(42, parser.parse("42"));
        assertEquals(4_000_000_000L, parser.parse("4000000000"));
        assertEquals(0.25, parser.parse("0.25"));
    }

    @Test
    void decodesEscapes() {
        assertEquals("a\"b\\c/d\n\u00e9", parser.parse("\"a\\\"b\\\\c\\/d\\n\\u00e9\""));
    }

    @Test
    void rejectsTrailingContent() {
        JsonParser.ParseException e = assertThrows(JsonParser.ParseException.class,
                () -> parser.parse("{\"a\": 1} x"));
        assertTrue(e.getMessage().contains("trailing"));
        assertEquals(9, e.getPosition());
    }

    @Test
    void rejectsDuplicateKeys() {
        assertThrows(JsonParser.ParseException.class, () -> parser.parse("{\"a\": 1, \"a\": 2}"));
    }

    @Test
    void rejectsTruncatedInput() {
        assertThrows(JsonParser.ParseException.class, () -> parser.parse("{\"a\": [1, 2"));
        assertThrows(JsonParser.ParseException.class, () -> parser.parse(""));
        assertThrows(JsonParser.ParseException.class, () -> parser.parse(null));
    }

    @Test
    void rejectsInvalidEscape() {
        assertThrows(JsonParser.ParseException.class, () -> parser.parse("\"\\x\""));
    }

    @Test
    void parseObjectRequiresObjectRoot() {
        assertThrows(JsonParser.ParseException.class, () -> parser.parseObject("[1, 2]"));
    }
}
