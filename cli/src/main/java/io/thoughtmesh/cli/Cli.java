// file: cli/src/main/java/io/thoughtmesh/cli/Cli.java
package io.thoughtmesh.cli;

import io.thoughtmesh.replica.StateCodecException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.logging.LogManager;

/**
 * Command line front end for thought replicas kept in JSON state files.
 *
 * Usage:
 *   thoughtmesh init   <state> [--node-id <id>]
 *   thoughtmesh add    <state> --topic <t> --payload <json> [--cid <cid>]
 *   thoughtmesh remove <state> <cid>
 *   thoughtmesh show   <state>
 *   thoughtmesh merge  <local-state> <remote-state>
 *   thoughtmesh demo
 *
 * Examples:
 *   thoughtmesh init a.json -n n1
 *   thoughtmesh add a.json -t metric -p '{"H":0.8,"tau":0.2}' --cid t1
 *   thoughtmesh merge a.json b.json
 */
public final class Cli {

    private Cli() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }
            CliConfig cfg = CliConfig.fromArgs(args);
            new Commands(System.out, Clock.systemUTC()).run(cfg);
        } catch (CliException | StateCodecException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private static void configureLogging() {
        try (InputStream in = Cli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("warning: could not load logging.properties: " + e.getMessage());
        }
    }

    private static void usageAndExit(String message) {
        System.err.println("error: " + message);
        System.err.print(CliConfig.usage());
        System.exit(1);
    }
}
