// file: core/src/main/java/io/thoughtmesh/core/CausalityComparator.java
package io.thoughtmesh.core;

import java.util.Objects;

/**
 * Classifies two versions of the same cid by their vector clocks.
 * <p>
 * Mapping from {@link CausalOrder} (ours.compare(theirs)):
 *  - RIGHT_DOMINATES_LEFT -> THEIRS_NEWER
 *  - LEFT_DOMINATES_RIGHT -> OURS_NEWER
 *  - EQUAL                -> IDENTICAL
 *  - CONCURRENT           -> CONCURRENT
 * <p>
 * Write times and producer timestamps are never consulted here.
 */
public final class CausalityComparator {

    private CausalityComparator() {
        // utility
    }

    public static VersionRelation classify(StoredVersion ours, StoredVersion theirs) {
        Objects.requireNonNull(ours, "ours");
        Objects.requireNonNull(theirs, "theirs");
        if (!ours.cid().equals(theirs.cid())) {
            throw new IllegalArgumentException(
                    "cannot compare versions of different cids: %s vs %s".formatted(ours.cid(), theirs.cid()));
        }
        return classify(ours.clock(), theirs.clock());
    }

    public static VersionRelation classify(VectorClock ours, VectorClock theirs) {
        return switch (ours.compare(theirs)) {
            case RIGHT_DOMINATES_LEFT -> VersionRelation.THEIRS_NEWER;
            case LEFT_DOMINATES_RIGHT -> VersionRelation.OURS_NEWER;
            case EQUAL -> VersionRelation.IDENTICAL;
            case CONCURRENT -> VersionRelation.CONCURRENT;
        };
    }
}
