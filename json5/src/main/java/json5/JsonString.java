package json5;

import java.util.Objects;

/**
 * A string literal; {@link #value()} is the decoded text with quotes removed and escapes resolved.
 */
public record JsonString(String value, Span span) implements JsonNode {

    public JsonString {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(span, "span");
    }

    public JsonString(String value) {
        this(value, Span.NONE);
    }

    @Override
    public Type type() {
        return Type.STRING;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonString s && s.value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "JsonString[" + value + "]";
    }
}
