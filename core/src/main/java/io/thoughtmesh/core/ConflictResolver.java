// file: core/src/main/java/io/thoughtmesh/core/ConflictResolver.java
package io.thoughtmesh.core;

import java.util.Objects;

/**
 * Policy for turning two concurrent versions of the same cid into one.
 * <p>
 * Only called for pairs the {@link CausalityComparator} classified as
 * {@link VersionRelation#CONCURRENT}. Implementations must be pure functions of
 * their inputs: two replicas resolving the same pair (in either role) have to
 * end up with the same thought, otherwise replicas never converge.
 */
public interface ConflictResolver {

    /**
     * Resolve a concurrent pair.
     *
     * @param ours        version held by the merging replica
     * @param theirs      version received from the remote replica
     * @param localNodeId node performing the merge; becomes the writer of the result
     */
    Resolution resolve(StoredVersion ours, StoredVersion theirs, String localNodeId);

    /**
     * Outcome of a resolution.
     *
     * @param version  the version to install
     * @param strategy name of the rule that produced it (surfaced in merge reports)
     */
    record Resolution(StoredVersion version, String strategy) {
        public Resolution {
            Objects.requireNonNull(version, "version");
            Objects.requireNonNull(strategy, "strategy");
        }
    }
}
