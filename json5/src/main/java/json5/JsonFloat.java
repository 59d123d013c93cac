package json5;

/**
 * Any other numeric literal: one with a fraction or exponent, {@code Infinity}, {@code NaN},
 * or an integer too large for a {@code long}.
 *
 * <p> Equality follows {@link Double#compare}: {@code NaN} equals itself, {@code 0.0} and {@code -0.0} differ.
 */
public record JsonFloat(double value, Span span) implements JsonNode {

    public JsonFloat(double value) {
        this(value, Span.NONE);
    }

    @Override
    public Type type() {
        return Type.FLOAT;
    }

    public boolean isFinite() {
        return Double.isFinite(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonFloat f && Double.compare(f.value, value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "JsonFloat[" + value + "]";
    }
}
