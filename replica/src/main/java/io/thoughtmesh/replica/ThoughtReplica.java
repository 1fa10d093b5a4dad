// file: replica/src/main/java/io/thoughtmesh/replica/ThoughtReplica.java
package io.thoughtmesh.replica;

import io.thoughtmesh.core.CausalityComparator;
import io.thoughtmesh.core.ConflictResolver;
import io.thoughtmesh.core.DecoratedThought;
import io.thoughtmesh.core.SemanticConflictResolver;
import io.thoughtmesh.core.StoredVersion;
import io.thoughtmesh.core.Thought;
import io.thoughtmesh.core.VectorClock;
import io.thoughtmesh.core.VersionRelation;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One participant of the thought CRDT (LWW-Element-Set + vector clocks).
 * <p>
 * Responsibilities:
 *  - Own this node's vector clock and version store.
 *  - Stamp local writes: bump our own counter, snapshot the clock into the
 *    new {@link StoredVersion}.
 *  - Merge remote state snapshots through the {@link MergeEngine}, then absorb
 *    the remote clock (point-wise max).
 *  - Export / import the whole replica as a {@link ReplicaState}.
 * <p>
 * Local add over a concurrent entry:
 *  - {@link #add} installs the new write over an existing entry that is
 *    concurrent with it without semantic resolution. Only {@link #merge}
 *    resolves concurrency. Kept as-is; the asymmetry is covered by tests.
 * <p>
 * All public methods are synchronized; callers are still expected to keep one
 * logical operation in flight per replica.
 */
public class ThoughtReplica {
    private static final Logger log = Logger.getLogger(ThoughtReplica.class.getName());

    private final VersionStore store;
    private final MergeEngine mergeEngine;
    private final Clock wallClock;

    private String nodeId;
    private VectorClock clock = VectorClock.empty();

    /**
     * Replica with the semantic resolver and the system UTC wall clock.
     */
    public ThoughtReplica(String nodeId) {
        this(nodeId, Clock.systemUTC(), new SemanticConflictResolver());
    }

    /**
     * Full constructor.
     *
     * @param nodeId    identity of this node in vector clocks
     * @param wallClock source of write times (tie-breaking only)
     * @param resolver  policy for concurrent versions met during merges
     */
    public ThoughtReplica(String nodeId, Clock wallClock, ConflictResolver resolver) {
        Objects.requireNonNull(nodeId, "nodeId");
        if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
        this.nodeId = nodeId;
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.mergeEngine = new MergeEngine(resolver);
        this.store = new InMemoryVersionStore();
    }

    /**
     * Rebuild a replica from an exported state.
     */
    public static ThoughtReplica fromState(ReplicaState state) {
        return fromState(state, Clock.systemUTC(), new SemanticConflictResolver());
    }

    public static ThoughtReplica fromState(ReplicaState state, Clock wallClock, ConflictResolver resolver) {
        Objects.requireNonNull(state, "state");
        var replica = new ThoughtReplica(state.nodeId(), wallClock, resolver);
        replica.loadState(state);
        return replica;
    }

    public synchronized String nodeId() {
        return nodeId;
    }

    public synchronized VectorClock clock() {
        return clock;
    }

    /**
     * Add or update a thought.
     * <p>
     * Steps:
     *  1) Bump our counter.
     *  2) Build a version stamped with now, this node and the clock snapshot.
     *  3) Install it unless the existing entry is causally newer or identical.
     *  4) Return the decorated view of whatever is stored for the cid.
     */
    public synchronized DecoratedThought add(Thought thought) {
        Objects.requireNonNull(thought, "thought");
        clock = clock.bump(nodeId);

        var incoming = StoredVersion.live(thought, wallClock.millis(), nodeId, clock);
        StoredVersion existing = store.get(thought.cid());
        if (existing == null || shouldUpdate(existing, incoming)) {
            store.put(incoming);
            return incoming.decorate();
        }
        log.log(Level.FINE, "node {0}: ignored causally stale write on {1}", new Object[]{nodeId, thought.cid()});
        return existing.decorate();
    }

    /**
     * Tombstone a thought. Absent cids are a no-op apart from the counter bump.
     */
    public synchronized void remove(String cid) {
        Objects.requireNonNull(cid, "cid");
        clock = clock.bump(nodeId);

        StoredVersion existing = store.get(cid);
        if (existing != null) {
            store.put(existing.toTombstone(wallClock.millis(), nodeId, clock));
        }
    }

    /**
     * Merge a remote replica's state into this one. The remote state is only read.
     */
    public synchronized MergeReport merge(ReplicaState remote) {
        Objects.requireNonNull(remote, "remote");
        MergeReport report = mergeEngine.merge(nodeId, store, remote.store());
        clock = clock.merge(remote.clock());
        return report;
    }

    /**
     * All live (non-tombstoned) thoughts with their CRDT metadata.
     */
    public synchronized List<DecoratedThought> getThoughts() {
        var out = new ArrayList<DecoratedThought>(store.size());
        for (StoredVersion v : store.snapshotAll().values()) {
            if (!v.tombstone()) {
                out.add(v.decorate());
            }
        }
        return List.copyOf(out);
    }

    /**
     * Live thought for {@code cid}, or null when absent or tombstoned.
     */
    public synchronized DecoratedThought get(String cid) {
        StoredVersion v = store.get(cid);
        return v == null || v.tombstone() ? null : v.decorate();
    }

    /**
     * Number of stored entries, tombstones included.
     */
    public synchronized int size() {
        return store.size();
    }

    public synchronized ReplicaState getState() {
        return new ReplicaState(nodeId, clock, store.snapshotAll());
    }

    /**
     * Replace node id, clock and store with the given state.
     */
    public synchronized void loadState(ReplicaState state) {
        Objects.requireNonNull(state, "state");
        store.replaceAll(state.store());
        nodeId = state.nodeId();
        clock = state.clock();
    }

    private static boolean shouldUpdate(StoredVersion existing, StoredVersion incoming) {
        VersionRelation relation = CausalityComparator.classify(existing, incoming);
        return relation == VersionRelation.THEIRS_NEWER || relation == VersionRelation.CONCURRENT;
    }
}
