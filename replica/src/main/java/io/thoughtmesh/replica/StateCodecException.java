// file: replica/src/main/java/io/thoughtmesh/replica/StateCodecException.java
package io.thoughtmesh.replica;

/**
 * Raised when a replica state cannot be encoded, decoded, read or written.
 */
public class StateCodecException extends RuntimeException {
    public StateCodecException(String message, Throwable cause) {
        super(message, cause);
    }

    public StateCodecException(String message) {
        super(message);
    }
}
