// file: core/src/main/java/io/thoughtmesh/core/VectorClock.java
package io.thoughtmesh.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable vector clock: a mapping from nodeId -> counter.
 * <p>
 * Used by replicas to:
 *  - stamp every local write (add / remove) with the causal history it saw,
 *  - decide whether one stored version happened-before another, and
 *  - detect concurrent writes that need semantic resolution.
 * <p>
 * Design:
 *  - Immutable: every "mutation" returns a new clock.
 *  - Missing entries count as 0, so clocks over disjoint node sets compare
 *    symmetrically.
 *  - equals/hashCode follow the causal view: explicit zero entries are ignored.
 */
public final class VectorClock {

    private static final VectorClock EMPTY = new VectorClock(Map.of());

    // Insertion-ordered, unmodifiable copy.
    private final Map<String, Integer> vv;

    /**
     * Create a new vector clock from the provided entries.
     * The input map is copied; negative counters are rejected.
     */
    public VectorClock(Map<String, Integer> vv) {
        Objects.requireNonNull(vv, "vv");
        var copy = new LinkedHashMap<String, Integer>(vv.size());
        for (var e : vv.entrySet()) {
            String nodeId = Objects.requireNonNull(e.getKey(), "nodeId");
            int counter = Objects.requireNonNull(e.getValue(), "counter");
            if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
            if (counter < 0) throw new IllegalArgumentException("counter for " + nodeId + " must be >= 0");
            copy.put(nodeId, counter);
        }
        this.vv = Collections.unmodifiableMap(copy);
    }

    /** Empty clock. */
    public static VectorClock empty() { return EMPTY; }

    /** Current entries (read-only view). */
    public Map<String, Integer> entries() { return vv; }

    /** Counter for {@code nodeId}, 0 when the node was never seen. */
    public int get(String nodeId) { return vv.getOrDefault(nodeId, 0); }

    /**
     * Return a new VectorClock where {@code nodeId}'s counter is incremented by 1.
     * If the node is not present yet, it is treated as 0 and becomes 1.
     */
    public VectorClock bump(String nodeId) {
        Objects.requireNonNull(nodeId, "nodeId");
        var m = new LinkedHashMap<>(vv);
        m.put(nodeId, m.getOrDefault(nodeId, 0) + 1);
        return new VectorClock(m);
    }

    /**
     * Point-wise maximum of this clock and {@code other}.
     * Idempotent and commutative; never lowers a counter.
     */
    public VectorClock merge(VectorClock other) {
        Objects.requireNonNull(other, "other");
        var m = new LinkedHashMap<>(vv);
        for (var e : other.vv.entrySet()) {
            m.merge(e.getKey(), e.getValue(), Math::max);
        }
        return new VectorClock(m);
    }

    /**
     * True iff every counter here is {@code <=} the other's and at least one
     * is strictly smaller.
     */
    public boolean happensBefore(VectorClock other) {
        return compare(other) == CausalOrder.RIGHT_DOMINATES_LEFT;
    }

    /**
     * Compare this clock (A) to another clock (B) under the standard vector-clock order.
     * <p>
     * Missing entries are treated as 0. Intuition:
     *  - If A >= B elementwise and A != B, then A has "seen" all events B has
     *    plus at least one more, so A dominates B.
     *  - If both A > B somewhere and B > A somewhere, neither dominates, so
     *    the versions are concurrent.
     */
    public CausalOrder compare(VectorClock other) {
        Objects.requireNonNull(other, "other");
        boolean aGreater = false;
        boolean bGreater = false;

        var ids = new HashSet<String>(vv.keySet());
        ids.addAll(other.vv.keySet());

        for (var id : ids) {
            int a = get(id);
            int b = other.get(id);
            if (a > b) aGreater = true;
            if (a < b) bGreater = true;
            // Early exit: once both are strictly greater on some components, it is Concurrent
            if (aGreater && bGreater) return CausalOrder.CONCURRENT;
        }

        if (!aGreater && !bGreater) return CausalOrder.EQUAL;
        if (aGreater) return CausalOrder.LEFT_DOMINATES_RIGHT;
        return CausalOrder.RIGHT_DOMINATES_LEFT;
    }

    private Map<String, Integer> nonZero() {
        var m = new HashMap<String, Integer>();
        vv.forEach((k, v) -> {
            if (v != 0) m.put(k, v);
        });
        return m;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorClock vc)) return false;
        return nonZero().equals(vc.nonZero());
    }

    @Override public int hashCode() { return nonZero().hashCode(); }

    @Override public String toString() { return vv.toString(); }
}
