package json5;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Insertion-ordered, key-unique member list of a {@link JsonObject}.
 *
 * <p> Members live in a list that fixes iteration order; a hash index from key to list position gives
 * constant-time lookup. Instances are immutable; the parser fills a {@link Builder}.
 *
 * @since 0.1.0
 */
public final class OrderedMembers implements Iterable<JsonObject.Member> {

    private static final OrderedMembers EMPTY = new OrderedMembers(List.of(), Map.of());

    private final List<JsonObject.Member> members;
    private final Map<String, Integer> index;

    private OrderedMembers(List<JsonObject.Member> members, Map<String, Integer> index) {
        this.members = members;
        this.index = index;
    }

    public static OrderedMembers empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public boolean containsKey(String key) {
        return index.containsKey(key);
    }

    public JsonObject.@Nullable Member member(String key) {
        Integer i = index.get(key);
        return i == null ? null : members.get(i);
    }

    public JsonObject.Member member(int position) {
        return members.get(position);
    }

    public List<JsonObject.Member> asList() {
        return members;
    }

    public List<String> keys() {
        var keys = new ArrayList<String>(members.size());
        for (var m : members) keys.add(m.key());
        return Collections.unmodifiableList(keys);
    }

    @Override
    public Iterator<JsonObject.Member> iterator() {
        return members.iterator();
    }

    /**
     * Key to value, in member order.
     */
    public Map<String, JsonNode> toMap() {
        var map = new LinkedHashMap<String, JsonNode>(Json5.mapCap(members.size()));
        for (var m : members) map.put(m.key(), m.value());
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OrderedMembers other && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return members.toString();
    }

    /**
     * Accumulates members in order. Not thread-safe; one builder per object literal.
     */
    public static final class Builder {
        private final List<JsonObject.Member> members = new ArrayList<>();
        private final Map<String, Integer> index = new HashMap<>();

        private Builder() {}

        public boolean containsKey(String key) {
            return index.containsKey(key);
        }

        /**
         * Append a member whose key is not yet present.
         *
         * @throws IllegalArgumentException if the key is already present
         */
        public Builder add(JsonObject.Member member) {
            Objects.requireNonNull(member, "member");
            if (index.putIfAbsent(member.key(), members.size()) != null) {
                throw new IllegalArgumentException("Duplicate key: " + member.key());
            }
            members.add(member);
            return this;
        }

        /**
         * Add the member, or replace the value of an existing member with the same key in place.
         */
        public Builder put(JsonObject.Member member) {
            Objects.requireNonNull(member, "member");
            Integer i = index.get(member.key());
            if (i == null) return add(member);
            var previous = members.get(i);
            members.set(i, new JsonObject.Member(previous.key(), previous.keySpan(), member.value()));
            return this;
        }

        public OrderedMembers build() {
            if (members.isEmpty()) return EMPTY;
            return new OrderedMembers(List.copyOf(members), Map.copyOf(index));
        }
    }
}
