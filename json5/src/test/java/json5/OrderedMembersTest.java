package json5;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.ArrayList;
import org.junit.jupiter.api.Test;

class OrderedMembersTest {

    private static JsonObject.Member member(String key, long value) {
        return new JsonObject.Member(key, new JsonInteger(value));
    }

    @Test
    void keepsInsertionOrder() {
        var builder = OrderedMembers.builder();
        var expected = new ArrayList<String>();
        for (int k = 99; k >= 0; k--) {
            builder.add(member("key" + k, k));
            expected.add("key" + k);
        }
        var members = builder.build();

        assertThat(members.keys()).containsExactlyElementsOf(expected);
        assertThat(members.toMap().keySet()).containsExactlyElementsOf(expected);
        assertThat(members.member(0).key()).isEqualTo("key99");
        assertThat(members.member("key42").value()).isEqualTo(new JsonInteger(42));
        assertThat(members.size()).isEqualTo(100);
    }

    @Test
    void addRejectsDuplicates() {
        var builder = OrderedMembers.builder().add(member("a", 1));
        assertThatCode(() -> builder.add(member("a", 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate key: a");
    }

    @Test
    void putReplacesInPlace() {
        var members = OrderedMembers.builder()
                .put(member("a", 1))
                .put(member("b", 2))
                .put(member("a", 3))
                .build();

        assertThat(members.keys()).containsExactly("a", "b");
        assertThat(members.member("a").value()).isEqualTo(new JsonInteger(3));
    }

    @Test
    void lookupOfMissingKey() {
        var members = OrderedMembers.builder().add(member("a", 1)).build();
        assertThat(members.member("b")).isNull();
        assertThat(members.containsKey("b")).isFalse();
        assertThat(members.containsKey("a")).isTrue();
    }

    @Test
    void builtInstanceIsImmutable() {
        var members = OrderedMembers.builder().add(member("a", 1)).build();
        assertThatCode(() -> members.asList().add(member("b", 2))).isInstanceOf(UnsupportedOperationException.class);
        assertThatCode(() -> members.keys().add("b")).isInstanceOf(UnsupportedOperationException.class);
        assertThatCode(() -> members.toMap().put("b", new JsonNull())).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyIsShared() {
        assertThat(OrderedMembers.builder().build()).isSameAs(OrderedMembers.empty());
        assertThat(OrderedMembers.empty().isEmpty()).isTrue();
        assertThat(OrderedMembers.empty().iterator().hasNext()).isFalse();
    }

    @Test
    void equalityIgnoresKeySpans() {
        var located = OrderedMembers.builder()
                .add(new JsonObject.Member("a", Json5.parse("'a'").span(), new JsonInteger(1)))
                .build();
        var unlocated = OrderedMembers.builder().add(member("a", 1)).build();

        assertThat(located).isEqualTo(unlocated);
        assertThat(located.hashCode()).isEqualTo(unlocated.hashCode());
    }
}
