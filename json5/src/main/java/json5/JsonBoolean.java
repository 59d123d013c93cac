package json5;

public record JsonBoolean(boolean value, Span span) implements JsonNode {

    public JsonBoolean(boolean value) {
        this(value, Span.NONE);
    }

    @Override
    public Type type() {
        return Type.BOOLEAN;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonBoolean b && b.value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return "JsonBoolean[" + value + "]";
    }
}
