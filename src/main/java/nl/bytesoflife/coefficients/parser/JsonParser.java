package nl.bytesoflife.coefficients.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON reader used for the coefficient dataset and the HTTP exchange bodies.
 * Objects become {@link LinkedHashMap}s (document order preserved), arrays become
 * {@link List}s, numbers become {@link Integer}, {@link Long} or {@link Double}.
 */
public class JsonParser {

    public Object parse(String json) {
        if (json == null) {
            throw new ParseException("JSON input is null", 0);
        }
        JsonTokenizer tokenizer = new JsonTokenizer(json);
        Object value = parseValue(tokenizer);
        tokenizer.skipWhitespace();
        if (tokenizer.hasMore()) {
            throw new ParseException("Unexpected trailing content", tokenizer.pos);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> parseObject(String json) {
        Object result = parse(json);
        if (result instanceof Map) {
            return (Map<String, Object>) result;
        }
        throw new ParseException("Expected JSON object at root", 0);
    }

    private Object parseValue(JsonTokenizer t) {
        t.skipWhitespace();
        char c = t.peek();
        return switch (c) {
            case '{' -> parseObject(t);
            case '[' -> parseArray(t);
            case '"' -> parseString(t);
            case 't', 'f' -> parseBoolean(t);
            case 'n' -> parseNull(t);
            default -> parseNumber(t);
        };
    }

    private Map<String, Object> parseObject(JsonTokenizer t) {
        t.expect('{');
        Map<String, Object> map = new LinkedHashMap<>();
        t.skipWhitespace();
        if (t.peek() == '}') {
            t.advance();
            return map;
        }
        while (true) {
            t.skipWhitespace();
            String key = parseString(t);
            t.expect(':');
            Object value = parseValue(t);
            if (map.containsKey(key)) {
                throw new ParseException("Duplicate key \"" + key + "\"", t.pos);
            }
            map.put(key, value);
            t.skipWhitespace();
            if (t.peek() == ',') {
                t.advance();
            } else {
                break;
            }
        }
        t.expect('}');
        return map;
    }

    private List<Object> parseArray(JsonTokenizer t) {
        t.expect('[');
        List<Object> list = new ArrayList<>();
        t.skipWhitespace();
        if (t.peek() == ']') {
            t.advance();
            return list;
        }
        while (true) {
            list.add(parseValue(t));
            t.skipWhitespace();
            if (t.peek() == ',') {
                t.advance();
            } else {
                break;
            }
        }
        t.expect(']');
        return list;
    }

    private String parseString(JsonTokenizer t) {
        t.expect('"');
        StringBuilder sb = new StringBuilder();
        while (t.peek() != '"') {
            char c = t.advance();
            if (c == '\\') {
                char esc = t.advance();
                switch (esc) {
                    case '"', '\\', '/' -> sb.append(esc);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        String hex = "" + t.advance() + t.advance() + t.advance() + t.advance();
                        try {
                            sb.append((char) Integer.parseInt(hex, 16));
                        } catch (NumberFormatException e) {
                            throw new ParseException("Invalid unicode escape \\u" + hex, t.pos);
                        }
                    }
                    default -> throw new ParseException("Invalid escape \\" + esc, t.pos);
                }
            } else {
                sb.append(c);
            }
        }
        t.expect('"');
        return sb.toString();
    }

    private Number parseNumber(JsonTokenizer t) {
        int start = t.pos;
        StringBuilder sb = new StringBuilder();
        while (t.hasMore() && isNumberChar(t.peek())) {
            sb.append(t.advance());
        }
        String s = sb.toString();
        if (s.isEmpty()) {
            throw new ParseException("Unexpected character '" + t.peek() + "'", start);
        }
        try {
            if (s.contains(".") || s.contains("e") || s.contains("E")) {
                return Double.parseDouble(s);
            }
            try {
                return Integer.parseInt(s);
            } catch (NumberFormatException e) {
                return Long.parseLong(s);
            }
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid number '" + s + "'", start);
        }
    }

    private boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '-' || c == '+' || c == '.' || c == 'e' || c == 'E';
    }

    private Boolean parseBoolean(JsonTokenizer t) {
        if (t.peek() == 't') {
            t.expectWord("true");
            return Boolean.TRUE;
        } else {
            t.expectWord("false");
            return Boolean.FALSE;
        }
    }

    private Object parseNull(JsonTokenizer t) {
        t.expectWord("null");
        return null;
    }

    private static class JsonTokenizer {
        private final String input;
        private int pos;

        JsonTokenizer(String input) {
            this.input = input;
            this.pos = 0;
        }

        void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        char peek() {
            if (pos >= input.length()) throw new ParseException("Unexpected end of JSON", pos);
            return input.charAt(pos);
        }

        char advance() {
            if (pos >= input.length()) throw new ParseException("Unexpected end of JSON", pos);
            return input.charAt(pos++);
        }

        boolean hasMore() {
            return pos < input.length();
        }

        void expect(char c) {
            skipWhitespace();
            if (pos >= input.length() || input.charAt(pos) != c) {
                throw new ParseException("Expected '" + c + "' but got " +
                        (pos < input.length() ? "'" + input.charAt(pos) + "'" : "EOF"), pos);
            }
            pos++;
        }

        void expectWord(String word) {
            for (int i = 0; i < word.length(); i++) {
                if (pos >= input.length() || input.charAt(pos) != word.charAt(i)) {
                    throw new ParseException("Expected '" + word + "'", pos - i);
                }
                pos++;
            }
        }
    }

    public static class ParseException extends RuntimeException {
        private final int position;

        public ParseException(String message, int position) {
            super(message + " at position " + position);
            this.position = position;
        }

        public int getPosition() {
            return position;
        }
    }
}
