// file: replica/src/main/java/io/thoughtmesh/replica/InMemoryVersionStore.java
package io.thoughtmesh.replica;

import io.thoughtmesh.core.StoredVersion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory {@link VersionStore} backed by an insertion-ordered map.
 * <p>
 * Not thread safe on its own; the owning replica serializes access.
 */
public final class InMemoryVersionStore implements VersionStore {

    private final Map<String, StoredVersion> mem = new LinkedHashMap<>();

    @Override
    public StoredVersion get(String cid) {
        Objects.requireNonNull(cid, "cid");
        return mem.get(cid);
    }

    @Override
    public void put(StoredVersion version) {
        Objects.requireNonNull(version, "version");
        mem.put(version.cid(), version);
    }

    @Override
    public int size() {
        return mem.size();
    }

    @Override
    public Map<String, StoredVersion> snapshotAll() {
        // StoredVersion is immutable, so a shallow copy is a full snapshot.
        return Collections.unmodifiableMap(new LinkedHashMap<>(mem));
    }

    @Override
    public void replaceAll(Map<String, StoredVersion> entries) {
        Objects.requireNonNull(entries, "entries");
        var copy = new LinkedHashMap<String, StoredVersion>(entries.size());
        for (var e : entries.entrySet()) {
            StoredVersion v = Objects.requireNonNull(e.getValue(), "version");
            if (!v.cid().equals(e.getKey())) {
                throw new IllegalArgumentException(
                        "store key %s does not match version cid %s".formatted(e.getKey(), v.cid()));
            }
            copy.put(e.getKey(), v);
        }
        mem.clear();
        mem.putAll(copy);
    }
}
