package org.khoros.community.transport;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Jackson-backed {@link Json} codec used for request and response bodies.
 */
class JsonTest {

    @Nested
    class EncoderTests {

        @Test
        void encodesNestedPayloadInInsertionOrder() {
            var data = new LinkedHashMap<String, Object>();
            data.put("type", "board");
            data.put("id", "my-board");
            data.put("hidden", true);

            assertEquals("{\"data\":{\"type\":\"board\",\"id\":\"my-board\",\"hidden\":true}}",
                    Json.encode(Map.of("data", data)));
        }

        @Test
        void escapesControlCharacters() {
            assertEquals("\"line1\\nline2\"", Json.encode("line1\nline2"));
            assertEquals("\"quote\\\"here\"", Json.encode("quote\"here"));
        }

        @Test
        void encodesLists() {
            assertEquals("[{\"id\":\"1\"},{\"id\":\"2\"}]", Json.encode(List.of(Map.of("id", "1"), Map.of("id", "2"))));
        }
    }

    @Nested
    class DecoderTests {

        @Test
        void decodesPlainJavaTree() {
            var decoded = Json.decodeObject("{\"items\":[1,\"two\",null,false],\"count\":2}");

            assertEquals(List.of(1, "two", false), ((List<?>) decoded.get("items")).stream()
                    .filter(java.util.Objects::nonNull).toList());
            assertEquals(2, decoded.get("count"));
        }

        @Test
        void rejectsMalformedInput() {
            assertThrows(IllegalArgumentException.class, () -> Json.decode("{\"a\":"));
            assertThrows(IllegalArgumentException.class, () -> Json.decode("{} trailing"));
        }

        @Test
        void rejectsBlankInput() {
            assertThrows(IllegalArgumentException.class, () -> Json.decode("   "));
        }

        @Test
        void rejectsNonObjectWhenObjectExpected() {
            assertThrows(IllegalArgumentException.class, () -> Json.decodeObject("[1,2]"));
        }

        @Test
        void rejectsExcessiveNesting() {
            var deep = "[".repeat(Json.MAX_DEPTH + 10) + "]".repeat(Json.MAX_DEPTH + 10);
            assertThrows(IllegalArgumentException.class, () -> Json.decode(deep));
        }
    }
}
