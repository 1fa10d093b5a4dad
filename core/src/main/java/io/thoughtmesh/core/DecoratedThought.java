// file: core/src/main/java/io/thoughtmesh/core/DecoratedThought.java
package io.thoughtmesh.core;

/**
 * Read-side view of a stored thought.
 *
 * @param thought      the record itself
 * @param clock        vector clock of the stored version
 * @param lastModified write time of the stored version (millis)
 * @param modifiedBy   node that wrote (or resolved) the stored version
 * @param version      the writer's own counter in {@code clock}
 */
public record DecoratedThought(
        Thought thought,
        VectorClock clock,
        long lastModified,
        String modifiedBy,
        int version
) {
    public String cid() {
        return thought.cid();
    }
}
