package nl.bytesoflife.coefficients.parser;

import java.util.Collection;

/**
 * Builds a single flat JSON object. Values are appended in call order.
 *
 * <pre>
 * String body = new JsonWriter()
 *     .field("coefficient", 1.25)
 *     .field("warning", "clamped")
 *     .toJson();
 * </pre>
 */
public class JsonWriter {

    private final StringBuilder json = new StringBuilder("{");
    private boolean first = true;

    public JsonWriter field(String name, String value) {
        key(name).append(escapeJson(value));
        return this;
    }

    public JsonWriter field(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("JSON cannot represent " + value + " for field " + name);
        }
        key(name).append(formatNumber(value));
        return this;
    }

    public JsonWriter field(String name, long value) {
        key(name).append(value);
        return this;
    }

    public JsonWriter field(String name, boolean value) {
        key(name).append(value);
        return this;
    }

    public JsonWriter field(String name, Collection<String> values) {
        StringBuilder sb = key(name).append('[');
        boolean firstValue = true;
        for (String value : values) {
            if (!firstValue) sb.append(',');
            firstValue = false;
            sb.append(escapeJson(value));
        }
        sb.append(']');
        return this;
    }

    /**
     * Appends the field only when the value is non-null.
     */
    public JsonWriter optionalField(String name, String value) {
        if (value != null) {
            field(name, value);
        }
        return this;
    }

    public String toJson() {
        return json + "}";
    }

    @Override
    public String toString() {
        return toJson();
    }

    private StringBuilder key(String name) {
        if (!first) json.append(',');
        first = false;
        return json.append(escapeJson(name)).append(':');
    }

    /**
     * Shortest round-trip decimal form, without a trailing ".0" for whole numbers.
     */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    public static String escapeJson(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 32) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append("\"");
        return sb.toString();
    }
}
