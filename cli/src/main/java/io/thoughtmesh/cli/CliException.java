// file: cli/src/main/java/io/thoughtmesh/cli/CliException.java
package io.thoughtmesh.cli;

/**
 * Usage or input error reported to the user without a stack trace.
 */
public final class CliException extends RuntimeException {
    public CliException(String message) {
        super(message);
    }

    public CliException(String message, Throwable cause) {
        super(message, cause);
    }
}
