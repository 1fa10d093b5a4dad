// file: replica/src/main/java/io/thoughtmesh/replica/ReplicaState.java
package io.thoughtmesh.replica;

import io.thoughtmesh.core.StoredVersion;
import io.thoughtmesh.core.VectorClock;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Complete, immutable description of a replica: {@code (nodeId, clock, store)}.
 * <p>
 * This is the unit exchanged between replicas (state-based CRDT) and the only
 * thing that ever crosses a serialization boundary.
 */
public record ReplicaState(
        String nodeId,
        VectorClock clock,
        Map<String, StoredVersion> store
) {
    public ReplicaState {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(store, "store");
        if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");

        var copy = new LinkedHashMap<String, StoredVersion>(store.size());
        store.forEach((cid, v) -> {
            Objects.requireNonNull(v, "version");
            if (!v.cid().equals(cid)) {
                throw new IllegalArgumentException(
                        "store key %s does not match version cid %s".formatted(cid, v.cid()));
            }
            copy.put(cid, v);
        });
        store = Collections.unmodifiableMap(copy);
    }

    /** State of a node that has not written or merged anything yet. */
    public static ReplicaState empty(String nodeId) {
        return new ReplicaState(nodeId, VectorClock.empty(), Map.of());
    }
}
