package json5;

public record JsonNull(Span span) implements JsonNode {

    public JsonNull() {
        this(Span.NONE);
    }

    @Override
    public Type type() {
        return Type.NULL;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonNull;
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return "JsonNull";
    }
}
