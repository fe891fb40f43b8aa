package com.hashicorp.vault.broker.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hashicorp.vault.broker.MalformedResponseException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Json serialization and parsing.
 */
class JsonTest {

    // --- write tests ---

    @Test
    void write_withEmptyMap_returnsEmptyObject() {
        assertThat(Json.write(Map.of())).isEqualTo("{}");
    }

    @Test
    void write_withScalars_returnsValidJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("key", "value");
        map.put("count", 42);
        map.put("enabled", true);
        map.put("missing", null);

        assertThat(Json.write(map)).isEqualTo("{\"key\":\"value\",\"count\":42,\"enabled\":true,\"missing\":null}");
    }

    @Test
    void write_withSpecialCharacters_escapesCorrectly() {
        String result = Json.write(Map.of("text", "line1\nline2\ttab\"quote\\backslash\u0001"));

        assertThat(result).contains("\\n").contains("\\t").contains("\\\"").contains("\\\\").contains("\\u0001");
    }

    @Test
    void write_withNestedMapAndList_serializesCorrectly() {
        String result = Json.write(Map.of("outer", Map.of("items", List.of("a", "b"))));

        assertThat(result).isEqualTo("{\"outer\":{\"items\":[\"a\",\"b\"]}}");
    }

    // --- parseObject tests ---

    @Test
    void parseObject_withNestedStructures_preservesTypes() {
        Map<String, Object> result = Json.parseObject(
                "{\"s\":\"x\",\"i\":1,\"d\":1.5,\"b\":false,\"n\":null,\"l\":[1,\"two\"],\"o\":{\"k\":\"v\"}}");

        assertThat(result)
                .containsEntry("s", "x")
                .containsEntry("i", 1L)
                .containsEntry("d", 1.5)
                .containsEntry("b", false)
                .containsEntry("n", null)
                .containsEntry("l", List.of(1L, "two"))
                .containsEntry("o", Map.of("k", "v"));
        assertThat(result.keySet()).containsExactly("s", "i", "d", "b", "n", "l", "o");
    }

    @Test
    void parseObject_withEscapes_unescapesStrings() {
        Map<String, Object> result = Json.parseObject("{\"t\":\"a\\nb\\u0041\\\"\"}");

        assertThat(result).containsEntry("t", "a\nbA\"");
    }

    @Test
    void parseObject_withExponent_returnsDouble() {
        assertThat(Json.parseObject("{\"e\":1e3}")).containsEntry("e", 1000.0);
    }

    @Test
    void parseObject_withWhitespace_parses() {
        assertThat(Json.parseObject("  {\n \"a\" : [ ] ,\n \"b\" : { } }  "))
                .containsEntry("a", List.of())
                .containsEntry("b", Map.of());
    }

    @Test
    void parseObject_withEmptyBody_throwsException() {
        assertThatThrownBy(() -> Json.parseObject("  "))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void parseObject_withArrayRoot_throwsException() {
        assertThatThrownBy(() -> Json.parseObject("[1,2]"))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void parseObject_withTrailingContent_throwsException() {
        assertThatThrownBy(() -> Json.parseObject("{\"a\":1} extra"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("trailing");
    }

    @Test
    void parseObject_withUnterminatedString_throwsException() {
        assertThatThrownBy(() -> Json.parseObject("{\"a\":\"oops}"))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void parseObject_roundTripsWrittenMap() {
        Map<String, Object> written = new HashMap<>();
        written.put("role_id", "r");
        written.put("nested", Map.of("ttl", 60L));

        assertThat(Json.parseObject(Json.write(written))).isEqualTo(written);
    }

    // --- parseErrors tests ---

    @Test
    void parseErrors_withErrorsArray_returnsMessages() {
        assertThat(Json.parseErrors("{\"errors\":[\"permission denied\",\"second\"]}"))
                .containsExactly("permission denied", "second");
    }

    @Test
    void parseErrors_withoutErrors_returnsEmptyList() {
        assertThat(Json.parseErrors("{\"data\":{}}")).isEmpty();
        assertThat(Json.parseErrors("<html>bad gateway</html>")).isEmpty();
    }
}
