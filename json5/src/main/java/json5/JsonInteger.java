package json5;

/**
 * A numeric literal written without fraction or exponent whose value fits in a {@code long}.
 */
public record JsonInteger(long value, Span span) implements JsonNode {

    public JsonInteger(long value) {
        this(value, Span.NONE);
    }

    @Override
    public Type type() {
        return Type.INTEGER;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonInteger i && i.value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "JsonInteger[" + value + "]";
    }
}
