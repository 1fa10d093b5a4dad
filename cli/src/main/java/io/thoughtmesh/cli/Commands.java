// file: cli/src/main/java/io/thoughtmesh/cli/Commands.java
package io.thoughtmesh.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.thoughtmesh.core.DecoratedThought;
import io.thoughtmesh.core.SemanticConflictResolver;
import io.thoughtmesh.core.Thought;
import io.thoughtmesh.replica.MergeReport;
import io.thoughtmesh.replica.ReplicaState;
import io.thoughtmesh.replica.ReplicaStateCodec;
import io.thoughtmesh.replica.ThoughtReplica;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Implementation of the CLI commands over replica state files.
 *
 * Every mutating command follows the same cycle:
 *  1) read the state file into a {@link ThoughtReplica},
 *  2) apply the operation,
 *  3) write the replica state back and print the outcome.
 */
public final class Commands {

    private static final ObjectMapper MAPPER = ReplicaStateCodec.mapper();

    private final PrintStream out;
    private final Clock wallClock;

    public Commands(PrintStream out, Clock wallClock) {
        this.out = Objects.requireNonNull(out, "out");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public void run(CliConfig cfg) {
        switch (cfg.command()) {
            case "help" -> out.print(CliConfig.usage());
            case "init" -> init(cfg);
            case "add" -> add(cfg);
            case "remove" -> remove(cfg);
            case "show" -> show(cfg);
            case "merge" -> merge(cfg);
            case "demo" -> demo();
            default -> throw new CliException("unknown command: " + cfg.command());
        }
    }

    private void init(CliConfig cfg) {
        Path path = Path.of(arg(cfg, 0, "init requires <state>"));
        if (Files.exists(path)) {
            throw new CliException("state file already exists: " + path);
        }
        ReplicaStateCodec.write(path, ReplicaState.empty(cfg.nodeId()));
        out.println("Initialized replica " + cfg.nodeId() + " at " + path);
    }

    private void add(CliConfig cfg) {
        Path path = Path.of(arg(cfg, 0, "add requires <state>"));
        if (cfg.topic() == null || cfg.topic().isBlank()) throw new CliException("add requires --topic");
        if (cfg.payload() == null) throw new CliException("add requires --payload");

        ThoughtReplica replica = load(path);
        JsonNode payload = parsePayload(cfg.payload());
        long ts = cfg.ts() != null ? cfg.ts() : wallClock.millis();
        String origin = cfg.origin() != null ? cfg.origin() : replica.nodeId();

        Thought thought = cfg.cid() == null
                ? Thought.create(cfg.topic(), ts, payload, cfg.links(), origin)
                : new Thought(cfg.cid(), cfg.topic(), ts, payload, cfg.links(), origin, null);

        DecoratedThought stored = replica.add(thought);
        ReplicaStateCodec.write(path, replica.getState());
        print(render(stored));
    }

    private void remove(CliConfig cfg) {
        Path path = Path.of(arg(cfg, 0, "remove requires <state> <cid>"));
        String cid = arg(cfg, 1, "remove requires <state> <cid>");

        ThoughtReplica replica = load(path);
        boolean present = replica.get(cid) != null;
        replica.remove(cid);
        ReplicaStateCodec.write(path, replica.getState());
        out.println(present ? "Removed " + cid : "No live thought " + cid);
    }

    private void show(CliConfig cfg) {
        Path path = Path.of(arg(cfg, 0, "show requires <state>"));
        print(renderAll(load(path).getThoughts()));
    }

    private void merge(CliConfig cfg) {
        Path localPath = Path.of(arg(cfg, 0, "merge requires <local-state> <remote-state>"));
        Path remotePath = Path.of(arg(cfg, 1, "merge requires <local-state> <remote-state>"));

        ThoughtReplica local = load(localPath);
        ReplicaState remote = ReplicaStateCodec.read(remotePath);
        MergeReport report = local.merge(remote);
        ReplicaStateCodec.write(localPath, local.getState());

        out.printf("Merged %s -> %s%n", remote.nodeId(), local.nodeId());
        printReport(report);
    }

    /**
     * Two nodes write the same metric concurrently, then node-001 merges node-002.
     */
    private void demo() {
        var node1 = new ThoughtReplica("node-001", wallClock, new SemanticConflictResolver());
        var node2 = new ThoughtReplica("node-002", wallClock, new SemanticConflictResolver());
        long now = wallClock.millis();

        node1.add(new Thought("thought-harmony", "metric", now,
                json("{\"H\":0.8,\"tau\":0.2}"), List.of(), "node-001", null));
        node2.add(new Thought("thought-dream", "dream", now + 100,
                json("{\"vision\":\"Distributed consciousness\"}"), List.of(), "node-002", null));

        node1.add(new Thought("thought-shared", "metric", now + 200,
                json("{\"H\":0.95,\"tau\":0.05,\"node\":\"1\"}"), List.of("thought-harmony"), "node-001", null));
        node2.add(new Thought("thought-shared", "metric", now + 200,
                json("{\"H\":0.85,\"tau\":0.15,\"node\":\"2\"}"), List.of("thought-harmony"), "node-002", null));

        out.println("Merging node-002 -> node-001");
        printReport(node1.merge(node2.getState()));
        out.println("Final state of node-001:");
        print(renderAll(node1.getThoughts()));
    }

    // ---------- helpers ----------

    private void printReport(MergeReport report) {
        out.printf("  added:     %d %s%n", report.added().size(), report.added());
        out.printf("  updated:   %d %s%n", report.updated().size(), report.updated());
        out.printf("  conflicts: %d%n", report.conflicts().size());
        for (MergeReport.Conflict c : report.conflicts()) {
            out.printf("    %s via %s -> %s%n",
                    c.cid(), c.strategy(), c.resolution().tombstone() ? "<deleted>" : c.resolution().thought().payload());
        }
    }

    static ObjectNode render(DecoratedThought t) {
        ObjectNode node = MAPPER.valueToTree(ReplicaStateCodec.toJson(t.thought()));
        ObjectNode crdt = node.putObject("_crdt");
        crdt.set("vectorClock", MAPPER.valueToTree(t.clock().entries()));
        crdt.put("lastModified", t.lastModified());
        crdt.put("modifiedBy", t.modifiedBy());
        crdt.put("version", t.version());
        return node;
    }

    private static ArrayNode renderAll(List<DecoratedThought> thoughts) {
        ArrayNode arr = MAPPER.createArrayNode();
        thoughts.forEach(t -> arr.add(render(t)));
        return arr;
    }

    private void print(JsonNode node) {
        try {
            out.println(MAPPER.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render output", e);
        }
    }

    private ThoughtReplica load(Path path) {
        if (!Files.exists(path)) {
            throw new CliException("state file not found: " + path + " (run init first)");
        }
        return ThoughtReplica.fromState(ReplicaStateCodec.read(path), wallClock, new SemanticConflictResolver());
    }

    private static JsonNode parsePayload(String raw) {
        try {
            return MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new CliException("payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode json(String raw) {
        try {
            return MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String arg(CliConfig cfg, int index, String error) {
        if (cfg.positional().size() <= index) {
            throw new CliException(error);
        }
        return cfg.positional().get(index);
    }
}
