// file: core/src/test/java/io/diffserve/core/SnapshotTest.java
package io.diffserve.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Snapshot behavior:
 *  - checksum depends on content only,
 *  - keys are kept in canonical order,
 *  - incremental edits agree with building from scratch.
 */
class SnapshotTest {

    private static final JsonNodeFactory N = JsonNodeFactory.instance;

    private static JsonNode json(String s) throws Exception {
        return CanonicalJson.MAPPER.readTree(s);
    }

    @Test
    void checksum_is_independent_of_construction_order() {
        Map<String, JsonNode> forward = new LinkedHashMap<>();
        forward.put("a", N.textNode("1"));
        forward.put("b", N.numberNode(2));
        forward.put("c", N.booleanNode(true));

        Map<String, JsonNode> backward = new LinkedHashMap<>();
        backward.put("c", N.booleanNode(true));
        backward.put("b", N.numberNode(2));
        backward.put("a", N.textNode("1"));

        Snapshot s1 = Snapshot.of(forward);
        Snapshot s2 = Snapshot.of(backward);

        assertEquals(s1.checksum(), s2.checksum());
        assertEquals(s1, s2);
        assertArrayEquals(s1.encode(), s2.encode());
    }

    @Test
    void nested_object_member_order_does_not_matter() throws Exception {
        Snapshot s1 = Snapshot.of(Map.of("user", json("{\"name\":\"ann\",\"age\":3}")));
        Snapshot s2 = Snapshot.of(Map.of("user", json("{\"age\":3,\"name\":\"ann\"}")));

        assertEquals(s1.checksum(), s2.checksum());
    }

    @Test
    void numerically_equal_values_are_the_same_value() throws Exception {
        Snapshot ints = Snapshot.of(Map.of("n", json("1")));
        Snapshot decimals = Snapshot.of(Map.of("n", N.numberNode(new BigDecimal("1.000"))));
        Snapshot doubles = Snapshot.of(Map.of("n", json("1.0")));

        assertEquals(ints.checksum(), decimals.checksum());
        assertEquals(ints.checksum(), doubles.checksum());
    }

    @Test
    void different_content_gives_different_checksum() {
        Snapshot a = Snapshot.of(Map.of("foo", N.textNode("bar")));
        Snapshot b = Snapshot.of(Map.of("foo", N.textNode("baz")));
        Snapshot c = Snapshot.of(Map.of("fo", N.textNode("obar")));

        assertNotEquals(a.checksum(), b.checksum());
        assertNotEquals(a.checksum(), c.checksum());
        assertNotEquals(Snapshot.empty().checksum(), a.checksum());
    }

    @Test
    void keys_are_sorted() {
        Snapshot s = Snapshot.of(Map.of("b", N.nullNode(), "a", N.nullNode(), "C", N.nullNode()));
        assertEquals(List.of("C", "a", "b"), List.copyOf(s.keys()));
    }

    @Test
    void incremental_edits_match_fresh_build() {
        Snapshot base = Snapshot.of(Map.of("a", N.numberNode(1), "b", N.numberNode(2)));

        Snapshot edited = base.with("c", N.numberNode(3)).without("a").with("b", N.numberNode(20));
        Snapshot fresh = Snapshot.of(Map.of("b", N.numberNode(20), "c", N.numberNode(3)));

        assertEquals(fresh.checksum(), edited.checksum());
        assertEquals(fresh, edited);
        // base itself is untouched
        assertEquals(2, base.size());
        assertEquals(1, base.get("a").intValue());
    }

    @Test
    void input_values_are_copied() {
        ObjectNode value = N.objectNode().put("x", 1);
        Snapshot s = Snapshot.of(Map.of("k", value));
        Checksum before = s.checksum();

        value.put("x", 2);

        assertEquals(1, s.get("k").get("x").intValue());
        assertEquals(before, s.checksum());
    }

    @Test
    void entries_compare_by_key_and_canonical_value() throws Exception {
        Snapshot.Entry a = Snapshot.of(Map.of("k", json("{\"x\":1,\"y\":2}"))).entries().iterator().next();
        Snapshot.Entry b = Snapshot.of(Map.of("k", json("{\"y\":2,\"x\":1}"))).entries().iterator().next();
        Snapshot.Entry other = Snapshot.of(Map.of("j", json("{\"x\":1,\"y\":2}"))).entries().iterator().next();

        assertNotSame(a.digest(), b.digest());
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(1, new HashSet<>(List.of(a, b)).size());
        assertNotEquals(a, other);
    }

    @Test
    void empty_key_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Snapshot.of(Map.of("", N.textNode("v"))));
    }

    @Test
    void json_round_trip_preserves_checksum() throws Exception {
        Snapshot s = Snapshot.fromJson(json("{\"z\":[1,2,{\"q\":null}],\"a\":\"x\"}"));
        Snapshot back = Snapshot.fromJson(CanonicalJson.decode(s.encode()));

        assertEquals(s.checksum(), back.checksum());
        assertEquals("{\"a\":\"x\",\"z\":[1,2,{\"q\":null}]}", new String(s.encode()));
    }

    @Test
    void from_json_requires_an_object() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> Snapshot.fromJson(json("[1,2]")));
        assertThrows(IllegalArgumentException.class, () -> Snapshot.fromJson(null));
    }
}
