// file: core/src/main/java/io/thoughtmesh/core/StoredVersion.java
package io.thoughtmesh.core;

import java.util.Objects;

/**
 * Immutable envelope for a thought held in a replica's store.
 * <p>
 * Fields:
 *  - thought:    the replicated record (kept even when tombstoned, so a
 *                tombstone can still be resolved against a concurrent write).
 *  - writeTime:  wall-clock millis at the storing node. Only a tie-breaker
 *                during semantic resolution, never part of causal ordering.
 *  - writerNode: node that produced this version (local writer or resolver).
 *  - clock:      vector clock snapshot taken at write time.
 *  - tombstone:  delete marker that replicates like a write.
 * <p>
 * Invariants:
 *  - All fields are immutable, so versions can be shared between replicas
 *    without copying.
 */
public final class StoredVersion {
    private final Thought thought;
    private final long writeTime;
    private final String writerNode;
    private final VectorClock clock;
    private final boolean tombstone;

    public StoredVersion(Thought thought, long writeTime, String writerNode, VectorClock clock, boolean tombstone) {
        this.thought = Objects.requireNonNull(thought, "thought");
        this.writerNode = Objects.requireNonNull(writerNode, "writerNode");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (writerNode.isBlank()) throw new IllegalArgumentException("writerNode must not be blank");
        this.writeTime = writeTime;
        this.tombstone = tombstone;
    }

    public static StoredVersion live(Thought thought, long writeTime, String writerNode, VectorClock clock) {
        return new StoredVersion(thought, writeTime, writerNode, clock, false);
    }

    public Thought thought() { return thought; }

    public String cid() { return thought.cid(); }

    public long writeTime() { return writeTime; }

    public String writerNode() { return writerNode; }

    public VectorClock clock() { return clock; }

    public boolean tombstone() { return tombstone; }

    /** Same thought, tombstoned with a fresh write stamp. */
    public StoredVersion toTombstone(long writeTime, String writerNode, VectorClock clock) {
        return new StoredVersion(thought, writeTime, writerNode, clock, true);
    }

    /** Thought plus the CRDT metadata callers are allowed to see. */
    public DecoratedThought decorate() {
        return new DecoratedThought(thought, clock, writeTime, writerNode, clock.get(writerNode));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredVersion that)) return false;
        return writeTime == that.writeTime
                && tombstone == that.tombstone
                && thought.equals(that.thought)
                && writerNode.equals(that.writerNode)
                && clock.equals(that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(thought, writeTime, writerNode, clock, tombstone);
    }

    @Override
    public String toString() {
        return "StoredVersion{cid=" + thought.cid()
                + ", writer=" + writerNode
                + ", writeTime=" + writeTime
                + ", clock=" + clock
                + (tombstone ? ", tombstone" : "")
                + "}";
    }
}
