package courier.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec}. Only objects with string values are accepted; nested
 * structures are carried as JSON text inside a string value.
 */
public final class FlatJsonCodec implements JsonCodec {
    static final FlatJsonCodec INSTANCE = new FlatJsonCodec();

    FlatJsonCodec() {
    }

    @Override
    public String toJson(Map<String, String> fields) {
        StringBuilder out = new StringBuilder(64).append('{');
        String separator = "";
        for (Map.Entry<String, String> field : fields.entrySet()) {
            if (field.getKey() == null || field.getValue() == null) {
                throw new IllegalArgumentException("JSON fields cannot contain null keys or values");
            }
            out.append(separator);
            quote(field.getKey(), out);
            out.append(':');
            quote(field.getValue(), out);
            separator = ",";
        }
        return out.append('}').toString();
    }

    @Override
    public Map<String, String> parseObject(String json) {
        if (json == null) {
            throw new IllegalArgumentException("JSON text is null");
        }
        Cursor cursor = new Cursor(json);
        cursor.expect('{');
        Map<String, String> fields = new LinkedHashMap<>();
        if (cursor.consumeIf('}')) {
            cursor.expectEnd();
            return fields;
        }
        do {
            String key = cursor.readString();
            cursor.expect(':');
            fields.put(key, cursor.readString());
        } while (cursor.consumeIf(','));
        cursor.expect('}');
        cursor.expectEnd();
        return fields;
    }

    private static void quote(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        void expect(char expected) {
            skipWhitespace();
            if (pos >= text.length() || text.charAt(pos) != expected) {
                throw error("Expected '" + expected + "'");
            }
            pos++;
        }

        boolean consumeIf(char candidate) {
            skipWhitespace();
            if (pos < text.length() && text.charAt(pos) == candidate) {
                pos++;
                return true;
            }
            return false;
        }

        void expectEnd() {
            skipWhitespace();
            if (pos != text.length()) {
                throw error("Trailing characters after JSON object");
            }
        }

        String readString() {
            expect('"');
            StringBuilder value = new StringBuilder();
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return value.toString();
                }
                if (c != '\\') {
                    value.append(c);
                    continue;
                }
                if (pos >= text.length()) {
                    break;
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case '"', '\\', '/' -> value.append(escaped);
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case 'b' -> value.append('\b');
                    case 'f' -> value.append('\f');
                    case 'u' -> value.append(readUnicode());
                    default -> throw error("Unsupported escape \\" + escaped);
                }
            }
            throw error("Unterminated string");
        }

        private char readUnicode() {
            if (pos + 4 > text.length()) {
                throw error("Truncated unicode escape");
            }
            try {
                char c = (char) Integer.parseInt(text.substring(pos, pos + 4), 16);
                pos += 4;
                return c;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid unicode escape at offset " + pos, e);
            }
        }

        private void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException(message + " at offset " + pos);
        }
    }
}
