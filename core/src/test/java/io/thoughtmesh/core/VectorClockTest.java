package io.thoughtmesh.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Clock ordering, merge and validation behavior.
 */
class VectorClockTest {

    @Test
    void clock_after_a_merge_and_local_write_dominates_both_inputs() {
        var local = new VectorClock(Map.of("node-001", 2));
        var remote = new VectorClock(Map.of("node-001", 1, "node-002", 3));
        var next = local.merge(remote).bump("node-001");

        assertEquals(CausalOrder.LEFT_DOMINATES_RIGHT, next.compare(local));
        assertEquals(CausalOrder.LEFT_DOMINATES_RIGHT, next.compare(remote));
        assertEquals(CausalOrder.RIGHT_DOMINATES_LEFT, remote.compare(next));
        assertTrue(local.happensBefore(next));
        assertTrue(remote.happensBefore(next));
        assertFalse(next.happensBefore(local));
    }

    @Test
    void writes_on_two_nodes_without_a_merge_are_concurrent() {
        var shared = new VectorClock(Map.of("node-001", 1));
        var onFirst = shared.bump("node-001");
        var onSecond = shared.bump("node-002");

        assertEquals(CausalOrder.CONCURRENT, onFirst.compare(onSecond));
        assertEquals(CausalOrder.CONCURRENT, onSecond.compare(onFirst));
        assertFalse(onFirst.happensBefore(onSecond));
        assertFalse(onSecond.happensBefore(onFirst));
        assertTrue(shared.happensBefore(onSecond));
    }

    @Test
    void disjoint_node_sets_compare_symmetrically() {
        var a = new VectorClock(Map.of("n1", 1));
        var b = new VectorClock(Map.of("n2", 1));

        assertEquals(CausalOrder.CONCURRENT, a.compare(b));
        assertEquals(a.compare(b).swap(), b.compare(a));

        // A clock that only knows a subset of the nodes is dominated on that basis alone
        var superset = new VectorClock(Map.of("n1", 1, "n2", 1));
        assertTrue(a.happensBefore(superset));
        assertEquals(CausalOrder.LEFT_DOMINATES_RIGHT, superset.compare(a));
    }

    @Test
    void equal_clocks_do_not_happen_before_each_other() {
        var a = new VectorClock(Map.of("n1", 2, "n2", 1));
        var b = new VectorClock(Map.of("n2", 1, "n1", 2));

        assertEquals(CausalOrder.EQUAL, a.compare(b));
        assertFalse(a.happensBefore(b));
        assertFalse(b.happensBefore(a));
        assertEquals(a, b);
    }

    @Test
    void explicit_zero_entries_are_equivalent_to_missing_ones() {
        var withZero = new VectorClock(Map.of("n1", 1, "n2", 0));
        var without = new VectorClock(Map.of("n1", 1));

        assertEquals(CausalOrder.EQUAL, withZero.compare(without));
        assertEquals(withZero, without);
        assertEquals(withZero.hashCode(), without.hashCode());
    }

    @Test
    void bump_raises_only_the_given_node_by_one() {
        var vc = new VectorClock(Map.of("n1", 4, "n2", 7));

        var bumped = vc.bump("n1");

        assertEquals(5, bumped.get("n1"));
        assertEquals(7, bumped.get("n2"));
        assertEquals(1, VectorClock.empty().bump("n3").get("n3"));
        // receiver untouched
        assertEquals(4, vc.get("n1"));
    }

    @Test
    void merge_is_pointwise_max_commutative_and_idempotent() {
        var a = new VectorClock(Map.of("n1", 3, "n2", 1));
        var b = new VectorClock(Map.of("n2", 5, "n3", 2));

        var ab = a.merge(b);

        assertEquals(new VectorClock(Map.of("n1", 3, "n2", 5, "n3", 2)), ab);
        assertEquals(ab, b.merge(a));
        assertEquals(ab, ab.merge(a));
        assertEquals(ab, ab.merge(b));
        assertFalse(ab.happensBefore(a));
        assertTrue(a.happensBefore(ab));
    }

    @Test
    void rejects_negative_counters_and_blank_node_ids() {
        assertThrows(IllegalArgumentException.class, () -> new VectorClock(Map.of("n1", -1)));
        assertThrows(IllegalArgumentException.class, () -> new VectorClock(Map.of(" ", 1)));
    }

    @Test
    void entries_are_read_only() {
        var vc = new VectorClock(Map.of("n1", 1));
        assertThrows(UnsupportedOperationException.class, () -> vc.entries().put("n2", 1));
    }
}
