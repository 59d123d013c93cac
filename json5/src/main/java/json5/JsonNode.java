package json5;

/**
 * A parsed JSON5 value together with the {@link Span} it was read from.
 *
 * <p> Nodes are immutable. {@code equals} and {@code hashCode} compare value and structure only,
 * so two trees parsed from differently formatted text are equal when they hold the same data.
 *
 * @since 0.1.0
 */
public sealed interface JsonNode permits JsonArray, JsonBoolean, JsonFloat, JsonInteger, JsonNull, JsonObject, JsonString {

    /**
     * Where this node was parsed from, or {@link Span#NONE} for nodes built in code.
     */
    Span span();

    Type type();

    /**
     * Render this node as compact JSON5 text.
     */
    default String stringify() {
        return Json5.stringify(this);
    }

    enum Type {
        NULL,
        BOOLEAN,
        INTEGER,
        FLOAT,
        STRING,
        ARRAY,
        OBJECT
    }
}
