package json5;

import java.util.List;
import java.util.Objects;

/**
 * An array literal. The span covers the brackets; elements keep source order.
 *
 * @since 0.1.0
 */
public record JsonArray(List<JsonNode> elements, Span span) implements JsonNode {

    public JsonArray {
        elements = List.copyOf(elements);
        Objects.requireNonNull(span, "span");
    }

    public JsonArray(List<JsonNode> elements) {
        this(elements, Span.NONE);
    }

    public static JsonArray of(JsonNode... elements) {
        return new JsonArray(List.of(elements));
    }

    @Override
    public Type type() {
        return Type.ARRAY;
    }

    public JsonNode get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonArray a && a.elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "JsonArray" + elements;
    }
}
