// file: replica/src/main/java/io/thoughtmesh/replica/MergeReport.java
package io.thoughtmesh.replica;

import io.thoughtmesh.core.StoredVersion;

import java.util.List;
import java.util.Objects;

/**
 * What a single {@code merge} call changed.
 *
 * @param added     cids we had never seen, installed verbatim
 * @param updated   cids where the remote version causally dominated ours
 * @param conflicts concurrent pairs and how they were resolved
 */
public record MergeReport(
        List<String> added,
        List<String> updated,
        List<Conflict> conflicts
) {
    public MergeReport {
        added = List.copyOf(added);
        updated = List.copyOf(updated);
        conflicts = List.copyOf(conflicts);
    }

    /** True when the merge left the local store untouched. */
    public boolean isNoop() {
        return added.isEmpty() && updated.isEmpty() && conflicts.isEmpty();
    }

    /**
     * One resolved concurrent modification. Conflicts are outcomes, not errors;
     * they are reported for audit.
     *
     * @param cid          key both replicas wrote concurrently
     * @param ourVersion   local version before the merge
     * @param theirVersion remote version
     * @param resolution   version installed locally
     * @param strategy     resolver rule that produced {@code resolution}
     */
    public record Conflict(
            String cid,
            StoredVersion ourVersion,
            StoredVersion theirVersion,
            StoredVersion resolution,
            String strategy
    ) {
        public Conflict {
            Objects.requireNonNull(cid, "cid");
            Objects.requireNonNull(ourVersion, "ourVersion");
            Objects.requireNonNull(theirVersion, "theirVersion");
            Objects.requireNonNull(resolution, "resolution");
            Objects.requireNonNull(strategy, "strategy");
        }
    }
}
