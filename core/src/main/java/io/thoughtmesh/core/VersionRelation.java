// file: core/src/main/java/io/thoughtmesh/core/VersionRelation.java
package io.thoughtmesh.core;

/**
 * Relationship between our stored version of a cid and a remote one,
 * seen from the local replica.
 */
public enum VersionRelation {
    /** Ours happened-before theirs: take theirs. */
    THEIRS_NEWER("theirs-newer"),
    /** Theirs happened-before ours: keep ours. */
    OURS_NEWER("ours-newer"),
    /** Neither saw the other: resolve semantically. */
    CONCURRENT("concurrent"),
    /** Same causal history: nothing to do. */
    IDENTICAL("identical");

    private final String label;

    VersionRelation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
