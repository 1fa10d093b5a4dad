// file: replica/src/main/java/io/thoughtmesh/replica/MergeEngine.java
package io.thoughtmesh.replica;

import io.thoughtmesh.core.CausalityComparator;
import io.thoughtmesh.core.ConflictResolver;
import io.thoughtmesh.core.StoredVersion;
import io.thoughtmesh.core.VersionRelation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Folds a remote store snapshot into a local {@link VersionStore}.
 * <p>
 * For every remote entry:
 *  - unknown cid        -> install verbatim, report as added;
 *  - THEIRS_NEWER       -> overwrite, report as updated;
 *  - OURS_NEWER / IDENTICAL -> keep ours;
 *  - CONCURRENT         -> install the {@link ConflictResolver}'s result and
 *                          report the conflict.
 * <p>
 * The engine never touches the remote snapshot and does not merge vector
 * clocks; the replica absorbs the remote clock after the store walk.
 */
public final class MergeEngine {
    private static final Logger log = Logger.getLogger(MergeEngine.class.getName());

    private final ConflictResolver resolver;

    public MergeEngine(ConflictResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public MergeReport merge(String localNodeId, VersionStore local, Map<String, StoredVersion> remote) {
        Objects.requireNonNull(localNodeId, "localNodeId");
        Objects.requireNonNull(local, "local");
        Objects.requireNonNull(remote, "remote");

        List<String> added = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<MergeReport.Conflict> conflicts = new ArrayList<>();

        for (var e : remote.entrySet()) {
            String cid = e.getKey();
            StoredVersion theirs = e.getValue();
            StoredVersion ours = local.get(cid);

            if (ours == null) {
                local.put(theirs);
                added.add(cid);
                continue;
            }

            VersionRelation relation = CausalityComparator.classify(ours, theirs);
            switch (relation) {
                case THEIRS_NEWER -> {
                    local.put(theirs);
                    updated.add(cid);
                }
                case CONCURRENT -> {
                    ConflictResolver.Resolution res = resolver.resolve(ours, theirs, localNodeId);
                    local.put(res.version());
                    conflicts.add(new MergeReport.Conflict(cid, ours, theirs, res.version(), res.strategy()));
                    log.log(Level.FINE, "node {0}: resolved concurrent writes on {1} via {2}",
                            new Object[]{localNodeId, cid, res.strategy()});
                }
                case OURS_NEWER, IDENTICAL -> log.log(Level.FINEST, "node {0}: kept {1} ({2})",
                        new Object[]{localNodeId, cid, relation.label()});
            }
        }

        var report = new MergeReport(added, updated, conflicts);
        Level level = report.isNoop() ? Level.FINE : Level.INFO;
        if (log.isLoggable(level)) {
            log.log(level, String.format(
                    "node %s merged %d remote entries: added=%d updated=%d conflicts=%d",
                    localNodeId, remote.size(), added.size(), updated.size(), conflicts.size()));
        }
        return report;
    }
}
