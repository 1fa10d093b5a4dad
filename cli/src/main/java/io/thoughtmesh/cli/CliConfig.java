// file: cli/src/main/java/io/thoughtmesh/cli/CliConfig.java
package io.thoughtmesh.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parsed command line.
 *
 * Supports:
 *  - command:    init | add | remove | show | merge | demo | help
 *  - positional: state file paths and cids, in command order
 *  - nodeId:     node identity for {@code init} (default: node-a)
 *  - topic, payload, cid, links, ts, origin: thought fields for {@code add}
 */
public record CliConfig(
        String command,
        List<String> positional,
        String nodeId,
        String topic,
        String payload,
        String cid,
        List<String> links,
        Long ts,
        String origin
) {

    public CliConfig {
        positional = List.copyOf(positional);
        links = List.copyOf(links);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --node-id, -n   <id>
     *   --topic,   -t   <topic>
     *   --payload, -p   <json>
     *   --cid           <cid>
     *   --links,   -l   <cid,cid,...>
     *   --ts            <millis>
     *   --origin        <node>
     *   --help,    -h
     *
     * The first non-flag argument is the command; the rest are positional.
     */
    public static CliConfig fromArgs(String[] args) {
        // Defaults
        String command = null;
        List<String> positional = new ArrayList<>();
        String nodeId = "node-a";
        String topic = null;
        String payload = null;
        String cid = null;
        List<String> links = List.of();
        Long ts = null;
        String origin = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> command = "help";

                case "--node-id", "-n" -> {
                    ensureValue(args, i);
                    nodeId = args[++i];
                }

                case "--topic", "-t" -> {
                    ensureValue(args, i);
                    topic = args[++i];
                }

                case "--payload", "-p" -> {
                    ensureValue(args, i);
                    payload = args[++i];
                }

                case "--cid" -> {
                    ensureValue(args, i);
                    cid = args[++i];
                }

                case "--links", "-l" -> {
                    ensureValue(args, i);
                    links = Arrays.stream(args[++i].split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .toList();
                }

                case "--ts" -> {
                    ensureValue(args, i);
                    try {
                        ts = Long.parseLong(args[++i]);
                    } catch (NumberFormatException e) {
                        throw new CliException("Invalid ts: " + args[i]);
                    }
                }

                case "--origin" -> {
                    ensureValue(args, i);
                    origin = args[++i];
                }

                default -> {
                    if (args[i].startsWith("-")) {
                        throw new CliException("Unknown option: " + args[i]);
                    }
                    if (command == null) {
                        command = args[i];
                    } else {
                        positional.add(args[i]);
                    }
                }
            }
        }
        if (command == null) {
            throw new CliException("missing command");
        }
        if (nodeId.isBlank()) {
            throw new CliException("node-id must not be blank");
        }
        return new CliConfig(command, positional, nodeId, topic, payload, cid, links, ts, origin);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("Missing value for option: " + args[i]);
        }
    }

    public static String usage() {
        return """
            Usage: thoughtmesh <command> [options]

            Commands:
              init   <state> [--node-id <id>]          Create an empty replica state file
              add    <state> --topic <t> --payload <json> [--cid <cid>] [--links a,b] [--ts <ms>] [--origin <id>]
                                                       Add or update a thought
              remove <state> <cid>                     Tombstone a thought
              show   <state>                           Print live thoughts
              merge  <local-state> <remote-state>      Merge remote into local (local file is rewritten)
              demo                                     Run the two-node concurrent merge demo

            Options:
              --node-id, -n   Node identifier for init (default: node-a)
              --help,    -h   Show this help message
            """;
    }
}
