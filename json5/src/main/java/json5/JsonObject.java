package json5;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An object literal. The span covers the braces; members keep source order and keys are unique.
 *
 * <p> Equality is order-sensitive: {@code {a:1,b:2}} and {@code {b:2,a:1}} are different values.
 *
 * @since 0.1.0
 */
public record JsonObject(OrderedMembers members, Span span) implements JsonNode {

    public JsonObject {
        Objects.requireNonNull(members, "members");
        Objects.requireNonNull(span, "span");
    }

    public JsonObject(OrderedMembers members) {
        this(members, Span.NONE);
    }

    /**
     * Build an unlocated object from a map, in the map's iteration order.
     */
    public static JsonObject of(Map<String, ? extends JsonNode> values) {
        var builder = OrderedMembers.builder();
        for (var en : values.entrySet()) builder.add(new Member(en.getKey(), en.getValue()));
        return new JsonObject(builder.build());
    }

    @Override
    public Type type() {
        return Type.OBJECT;
    }

    public @Nullable JsonNode get(String key) {
        var member = members.member(key);
        return member == null ? null : member.value();
    }

    public boolean containsKey(String key) {
        return members.containsKey(key);
    }

    public List<String> keys() {
        return members.keys();
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public Map<String, JsonNode> toMap() {
        return members.toMap();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonObject other && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return "JsonObject" + members;
    }

    /**
     * One {@code key: value} pair. {@code keySpan} locates the key token (quotes included),
     * so callers can report problems with a key separately from its value.
     */
    public record Member(String key, Span keySpan, JsonNode value) {

        public Member {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(keySpan, "keySpan");
            Objects.requireNonNull(value, "value");
        }

        public Member(String key, JsonNode value) {
            this(key, Span.NONE, value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Member m && m.key.equals(key) && m.value.equals(value);
        }

        @Override
        public int hashCode() {
            return 31 * key.hashCode() + value.hashCode();
        }

        @Override
        public String toString() {
            return key + "=" + value;
        }
    }
}
