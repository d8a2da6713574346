package org.axion.engine.serialization;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency JSON reader and writer.
 *
 * Objects are read into insertion-ordered maps and written in map iteration
 * order, so a {@link LinkedHashMap} gives a fixed field order. The compact
 * form is byte-stable and is what proof hashes are computed over.
 *
 * Supports: objects, arrays, strings, integers, decimals, booleans, null
 */
public final class Json {

    private Json() {
    }

    // ========== PARSING ==========

    /**
     * Parse a JSON document into a Map (for objects), List (for arrays),
     * String, Long, Double, Boolean or null.
     *
     * @throws JsonParseException if the text is not a single JSON value
     */
    public static Object parse(String json) {
        Parser parser = new Parser(json);
        Object value = parser.parseValue();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new JsonParseException("Unexpected trailing content", parser.pos);
        }
        return value;
    }

    /**
     * Parse JSON that must be an object.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json) {
        Object result = parse(json);
        if (!(result instanceof Map)) {
            throw new JsonParseException("Expected a JSON object", 0);
        }
        return (Map<String, Object>) result;
    }

    // ========== SERIALIZATION ==========

    /**
     * Serialize to compact JSON with no insignificant whitespace.
     */
    public static String toJson(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value, -1, 0);
        return sb.toString();
    }

    /**
     * Serialize with two-space indentation, for files meant to be read.
     */
    public static String toPrettyJson(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value, 2, 0);
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static void writeValue(StringBuilder sb, Object value, int indent, int depth) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value instanceof Number n) {
            sb.append(n);
        } else if (value instanceof Boolean b) {
            sb.append(b ? "true" : "false");
        } else if (value instanceof Map<?, ?> m) {
            writeObject(sb, (Map<String, Object>) m, indent, depth);
        } else if (value instanceof List<?> l) {
            writeArray(sb, l, indent, depth);
        } else {
            writeString(sb, value.toString());
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    private static void writeObject(StringBuilder sb, Map<String, Object> map, int indent, int depth) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }
        sb.append('{');
        boolean first = true;
        for (var entry : map.entrySet()) {
            if (!first)
                sb.append(',');
            first = false;
            newline(sb, indent, depth + 1);
            writeString(sb, entry.getKey());
            sb.append(indent < 0 ? ":" : ": ");
            writeValue(sb, entry.getValue(), indent, depth + 1);
        }
        newline(sb, indent, depth);
        sb.append('}');
    }

    private static void writeArray(StringBuilder sb, List<?> list, int indent, int depth) {
        if (list.isEmpty()) {
            sb.append("[]");
            return;
        }
        sb.append('[');
        boolean first = true;
        for (Object item : list) {
            if (!first)
                sb.append(',');
            first = false;
            newline(sb, indent, depth + 1);
            writeValue(sb, item, indent, depth + 1);
        }
        newline(sb, indent, depth);
        sb.append(']');
    }

    private static void newline(StringBuilder sb, int indent, int depth) {
        if (indent >= 0) {
            sb.append('\n').append(" ".repeat(indent * depth));
        }
    }

    // ========== PARSER IMPLEMENTATION ==========

    private static class Parser {
        private final String json;
        private int pos = 0;

        Parser(String json) {
            this.json = json == null ? "" : json;
        }

        boolean atEnd() {
            return pos >= json.length();
        }

        Object parseValue() {
            skipWhitespace();
            if (atEnd())
                throw new JsonParseException("Unexpected end of input", pos);

            char c = json.charAt(pos);
            return switch (c) {
                case '{' -> parseObject();
                case '[' -> parseArray();
                case '"' -> parseString();
                case 't', 'f' -> parseBoolean();
                case 'n' -> parseNull();
                default -> parseNumber();
            };
        }

        private Map<String, Object> parseObject() {
            Map<String, Object> map = new LinkedHashMap<>();
            pos++; // skip '{'
            skipWhitespace();

            if (!atEnd() && json.charAt(pos) == '}') {
                pos++;
                return map;
            }

            while (true) {
                skipWhitespace();
                if (atEnd() || json.charAt(pos) != '"')
                    throw new JsonParseException("Expected object key", pos);
                String key = parseString();
                skipWhitespace();
                expect(':');
                if (map.containsKey(key))
                    throw new JsonParseException("Duplicate key '" + key + "'", pos);
                map.put(key, parseValue());
                skipWhitespace();

                if (atEnd())
                    throw new JsonParseException("Unterminated object", pos);
                char c = json.charAt(pos++);
                if (c == '}')
                    return map;
                if (c != ',')
                    throw new JsonParseException("Expected ',' or '}'", pos - 1);
            }
        }

        private List<Object> parseArray() {
            List<Object> list = new ArrayList<>();
            pos++; // skip '['
            skipWhitespace();

            if (!atEnd() && json.charAt(pos) == ']') {
                pos++;
                return list;
            }

            while (true) {
                list.add(parseValue());
                skipWhitespace();

                if (atEnd())
                    throw new JsonParseException("Unterminated array", pos);
                char c = json.charAt(pos++);
                if (c == ']')
                    return list;
                if (c != ',')
                    throw new JsonParseException("Expected ',' or ']'", pos - 1);
            }
        }

        private String parseString() {
            int start = pos;
            pos++; // skip opening quote
            StringBuilder sb = new StringBuilder();
            while (pos < json.length()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                } else if (c == '\\' && pos < json.length()) {
                    char escaped = json.charAt(pos++);
                    switch (escaped) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case '/' -> sb.append('/');
                        case 'b' -> sb.append('\b');
                        case 'f' -> sb.append('\f');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        case 'u' -> {
                            if (pos + 4 > json.length())
                                throw new JsonParseException("Truncated unicode escape", pos);
                            try {
                                sb.append((char) Integer.parseInt(json.substring(pos, pos + 4), 16));
                            } catch (NumberFormatException e) {
                                throw new JsonParseException("Invalid unicode escape", pos);
                            }
                            pos += 4;
                        }
                        default -> throw new JsonParseException("Invalid escape '\\" + escaped + "'", pos - 1);
                    }
                } else {
                    sb.append(c);
                }
            }
            throw new JsonParseException("Unterminated string", start);
        }

        private Number parseNumber() {
            int start = pos;
            if (pos < json.length() && json.charAt(pos) == '-')
                pos++;
            int digits = pos;
            while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                pos++;
            if (pos == digits)
                throw new JsonParseException("Unexpected character '" + json.charAt(start) + "'", start);

            boolean isFloat = false;
            if (pos < json.length() && json.charAt(pos) == '.') {
                isFloat = true;
                pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                    pos++;
            }
            if (pos < json.length() && (json.charAt(pos) == 'e' || json.charAt(pos) == 'E')) {
                isFloat = true;
                pos++;
                if (pos < json.length() && (json.charAt(pos) == '+' || json.charAt(pos) == '-'))
                    pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                    pos++;
            }

            String num = json.substring(start, pos);
            try {
                if (isFloat) {
                    return Double.valueOf(num);
                }
                return Long.valueOf(num);
            } catch (NumberFormatException e) {
                throw new JsonParseException("Invalid number '" + num + "'", start);
            }
        }

        private Boolean parseBoolean() {
            if (json.startsWith("true", pos)) {
                pos += 4;
                return true;
            } else if (json.startsWith("false", pos)) {
                pos += 5;
                return false;
            }
            throw new JsonParseException("Invalid boolean", pos);
        }

        private Object parseNull() {
            if (json.startsWith("null", pos)) {
                pos += 4;
                return null;
            }
            throw new JsonParseException("Invalid null", pos);
        }

        void skipWhitespace() {
            while (pos < json.length() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }

        private void expect(char expected) {
            if (pos < json.length() && json.charAt(pos) == expected) {
                pos++;
            } else {
                throw new JsonParseException("Expected '" + expected + "'", pos);
            }
        }
    }

    // ========== TYPED ACCESSORS ==========

    /**
     * Get a required string field.
     */
    public static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof String s) {
            return s;
        }
        throw new JsonParseException("Field '" + key + "' must be a string", 0);
    }

    /**
     * Get a required integer field.
     */
    public static int getInt(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Long n && n >= Integer.MIN_VALUE && n <= Integer.MAX_VALUE) {
            return n.intValue();
        }
        throw new JsonParseException("Field '" + key + "' must be an integer", 0);
    }

    /**
     * Get a required boolean field.
     */
    public static boolean getBoolean(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        throw new JsonParseException("Field '" + key + "' must be a boolean", 0);
    }

    /**
     * Get a required nested object.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> getObject(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        throw new JsonParseException("Field '" + key + "' must be an object", 0);
    }

    /**
     * Get a required list.
     */
    @SuppressWarnings("unchecked")
    public static List<Object> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            return (List<Object>) value;
        }
        throw new JsonParseException("Field '" + key + "' must be an array", 0);
    }
}
