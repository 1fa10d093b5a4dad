// file: replica/src/main/java/io/thoughtmesh/replica/VersionStore.java
package io.thoughtmesh.replica;

import io.thoughtmesh.core.StoredVersion;

import java.util.Map;

/**
 * Minimal synchronous store of the latest known version per cid.
 * <p>
 * Semantics:
 *  - put() replaces the entry for the version's cid in place.
 *  - Entries are never removed; deletes are stored as tombstoned versions so
 *    they keep replicating and ordering against concurrent re-adds.
 *  - Iteration order is insertion order of the first write per cid and carries
 *    no meaning.
 */
public interface VersionStore {

    /**
     * Current version for a cid (tombstones included), or null if never written.
     */
    StoredVersion get(String cid);

    /**
     * Install {@code version} as the entry for {@code version.cid()}.
     */
    void put(StoredVersion version);

    /**
     * Number of entries, tombstones included.
     */
    int size();

    /**
     * Immutable, insertion-ordered snapshot of all entries.
     */
    Map<String, StoredVersion> snapshotAll();

    /**
     * Replace the entire content with {@code entries}.
     */
    void replaceAll(Map<String, StoredVersion> entries);
}
