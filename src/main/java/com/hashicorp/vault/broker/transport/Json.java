package com.hashicorp.vault.broker.transport;

import com.hashicorp.vault.broker.MalformedResponseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON codec for the Vault HTTP API.
 *
 * <p>Covers the structures Vault exchanges: objects, arrays, strings, numbers,
 * booleans and null. Parsed objects keep key order ({@link LinkedHashMap}), integral
 * numbers become {@link Long} and everything else numeric becomes {@link Double}.
 */
public final class Json {

    private Json() {
        // Utility class
    }

    /**
     * Serializes a value to JSON.
     *
     * <p>Supports String, Number, Boolean, null, Map (with string keys) and Iterable
     * values. Any other value is written as its {@code toString()}.
     */
    public static String write(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value);
        return sb.toString();
    }

    /**
     * Parses a JSON document whose top level is an object.
     *
     * @param json the document
     * @return the parsed object
     * @throws MalformedResponseException if the document is not a well-formed JSON object
     */
    public static Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedResponseException("Expected a JSON object but the body was empty");
        }
        try {
            Parser parser = new Parser(json);
            Map<String, Object> result = parser.readObject();
            parser.expectEnd();
            return result;
        } catch (IllegalStateException | NumberFormatException e) {
            throw new MalformedResponseException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts Vault's {@code errors} array from an error body.
     *
     * @return the error messages, or an empty list if the body has none or is not JSON
     */
    public static List<String> parseErrors(String json) {
        Map<String, Object> root;
        try {
            root = parseObject(json);
        } catch (MalformedResponseException e) {
            return Collections.emptyList();
        }

        Object errors = root.get("errors");
        if (!(errors instanceof List)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) errors) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static void writeValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String) {
            writeString(sb, (String) value);
        } else if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof Map) {
            writeObject(sb, (Map<?, ?>) value);
        } else if (value instanceof Iterable) {
            writeArray(sb, (Iterable<?>) value);
        } else {
            writeString(sb, value.toString());
        }
    }

    private static void writeObject(StringBuilder sb, Map<?, ?> map) {
        sb.append('{');
        String separator = "";
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            sb.append(separator);
            writeString(sb, String.valueOf(entry.getKey()));
            sb.append(':');
            writeValue(sb, entry.getValue());
            separator = ",";
        }
        sb.append('}');
    }

    private static void writeArray(StringBuilder sb, Iterable<?> items) {
        sb.append('[');
        String separator = "";
        for (Object item : items) {
            sb.append(separator);
            writeValue(sb, item);
            separator = ",";
        }
        sb.append(']');
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }

    /**
     * Recursive descent parser over a single document.
     */
    private static final class Parser {
        private final String json;
        private int pos;

        Parser(String json) {
            this.json = json;
        }

        Map<String, Object> readObject() {
            skipWhitespace();
            expect('{');
            Map<String, Object> map = new LinkedHashMap<>();
            skipWhitespace();
            if (tryConsume('}')) {
                return map;
            }
            do {
                skipWhitespace();
                String key = readString();
                skipWhitespace();
                expect(':');
                map.put(key, readValue());
                skipWhitespace();
            } while (tryConsume(','));
            expect('}');
            return map;
        }

        List<Object> readArray() {
            expect('[');
            List<Object> list = new ArrayList<>();
            skipWhitespace();
            if (tryConsume(']')) {
                return list;
            }
            do {
                list.add(readValue());
                skipWhitespace();
            } while (tryConsume(','));
            expect(']');
            return list;
        }

        Object readValue() {
            skipWhitespace();
            char c = peek();
            switch (c) {
                case '{':
                    return readObject();
                case '[':
                    return readArray();
                case '"':
                    return readString();
                case 't':
                    return readLiteral("true", Boolean.TRUE);
                case 'f':
                    return readLiteral("false", Boolean.FALSE);
                case 'n':
                    return readLiteral("null", null);
                default:
                    if (c == '-' || Character.isDigit(c)) {
                        return readNumber();
                    }
                    throw new IllegalStateException("Unexpected character '" + c + "' at position " + pos);
            }
        }

        String readString() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (pos < json.length()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (pos >= json.length()) {
                    break;
                }
                char escaped = json.charAt(pos++);
                switch (escaped) {
                    case 'b':
                        sb.append('\b');
                        break;
                    case 'f':
                        sb.append('\f');
                        break;
                    case 'n':
                        sb.append('\n');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'u':
                        if (pos + 4 > json.length()) {
                            throw new IllegalStateException("Truncated unicode escape at position " + pos);
                        }
                        sb.append((char) Integer.parseInt(json.substring(pos, pos + 4), 16));
                        pos += 4;
                        break;
                    default:
                        sb.append(escaped);
                }
            }
            throw new IllegalStateException("Unterminated string");
        }

        Number readNumber() {
            int start = pos;
            boolean integral = true;
            tryConsume('-');
            skipDigits();
            if (tryConsume('.')) {
                integral = false;
                skipDigits();
            }
            if (pos < json.length() && (json.charAt(pos) == 'e' || json.charAt(pos) == 'E')) {
                integral = false;
                pos++;
                if (!tryConsume('+')) {
                    tryConsume('-');
                }
                skipDigits();
            }
            String text = json.substring(start, pos);
            if (integral) {
                try {
                    return Long.parseLong(text);
                } catch (NumberFormatException e) {
                    // Too large for a long
                    return Double.parseDouble(text);
                }
            }
            return Double.parseDouble(text);
        }

        Object readLiteral(String literal, Object value) {
            if (!json.startsWith(literal, pos)) {
                throw new IllegalStateException("Expected '" + literal + "' at position " + pos);
            }
            pos += literal.length();
            return value;
        }

        void expectEnd() {
            skipWhitespace();
            if (pos != json.length()) {
                throw new IllegalStateException("Unexpected trailing content at position " + pos);
            }
        }

        private void skipDigits() {
            while (pos < json.length() && Character.isDigit(json.charAt(pos))) {
                pos++;
            }
        }

        private void skipWhitespace() {
            while (pos < json.length() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }

        private char peek() {
            if (pos >= json.length()) {
                throw new IllegalStateException("Unexpected end of JSON");
            }
            return json.charAt(pos);
        }

        private void expect(char c) {
            char actual = peek();
            if (actual != c) {
                throw new IllegalStateException(
                        "Expected '" + c + "' but found '" + actual + "' at position " + pos);
            }
            pos++;
        }

        private boolean tryConsume(char c) {
            if (pos < json.length() && json.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }
    }
}
