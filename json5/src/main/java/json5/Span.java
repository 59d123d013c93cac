package json5;

/**
 * A half-open range {@code [start, end)} in source text.
 *
 * <p> Offsets are UTF-16 char indices into the source string; line and column are 1-based.
 * Nodes built in code rather than parsed carry {@link #NONE}.
 *
 * @since 0.1.0
 */
public record Span(Position start, Position end) {

    /**
     * Span of a node that was not parsed from source text.
     */
    public static final Span NONE = new Span(Position.NONE, Position.NONE);

    public Span {
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException("Span end " + end.offset() + " precedes start " + start.offset());
        }
    }

    public static Span of(Position start, Position end) {
        return new Span(start, end);
    }

    public static Span at(Position position) {
        return new Span(position, position);
    }

    public boolean isNone() {
        return start.offset() < 0;
    }

    public int length() {
        return end.offset() - start.offset();
    }

    /**
     * The slice of {@code source} this span covers.
     */
    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    public boolean contains(Span other) {
        return start.offset() <= other.start.offset() && other.end.offset() <= end.offset();
    }

    public Span merge(Span other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new Span(newStart, newEnd);
    }

    @Override
    public String toString() {
        return isNone() ? "<none>" : start + "-" + end;
    }

    /**
     * A point in source text.
     *
     * @param offset 0-based char offset
     * @param line   1-based line
     * @param column 1-based column, counted in chars
     */
    public record Position(int offset, int line, int column) {

        public static final Position START = new Position(0, 1, 1);

        static final Position NONE = new Position(-1, 0, 0);

        @Override
        public String toString() {
            return line + ":" + column;
        }
    }
}
