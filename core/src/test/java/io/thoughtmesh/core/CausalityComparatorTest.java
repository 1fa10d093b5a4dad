package io.thoughtmesh.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CausalityComparatorTest {

    private static StoredVersion version(String cid, Map<String, Integer> vc, long writeTime) {
        var thought = new Thought(cid, "metric", 1_000L, JsonNodeFactory.instance.objectNode(), List.of(), "n1", null);
        return StoredVersion.live(thought, writeTime, "n1", new VectorClock(vc));
    }

    @Test
    void remote_that_saw_our_write_is_theirs_newer() {
        var ours = version("t1", Map.of("n1", 1), 5_000L);
        var theirs = version("t1", Map.of("n1", 1, "n2", 1), 1_000L);

        assertEquals(VersionRelation.THEIRS_NEWER, CausalityComparator.classify(ours, theirs));
        assertEquals(VersionRelation.OURS_NEWER, CausalityComparator.classify(theirs, ours));
    }

    @Test
    void relations_have_readable_labels() {
        assertEquals("theirs-newer", VersionRelation.THEIRS_NEWER.label());
        assertEquals("ours-newer", VersionRelation.OURS_NEWER.label());
        assertEquals("concurrent", VersionRelation.CONCURRENT.label());
        assertEquals("identical", VersionRelation.IDENTICAL.label());
    }

    @Test
    void independent_writes_are_concurrent() {
        var ours = version("t1", Map.of("n1", 1), 1_000L);
        var theirs = version("t1", Map.of("n2", 1), 1_000L);

        assertEquals(VersionRelation.CONCURRENT, CausalityComparator.classify(ours, theirs));
        assertEquals(VersionRelation.CONCURRENT, CausalityComparator.classify(theirs, ours));
    }

    @Test
    void equal_clocks_are_identical() {
        var ours = version("t1", Map.of("n1", 2, "n2", 1), 1_000L);
        var theirs = version("t1", Map.of("n1", 2, "n2", 1), 9_000L);

        assertEquals(VersionRelation.IDENTICAL, CausalityComparator.classify(ours, theirs));
    }

    @Test
    void write_times_never_decide_causality() {
        // Causally newer version with a much older wall clock still wins.
        var ours = version("t1", Map.of("n1", 1), 9_999_999L);
        var theirs = version("t1", Map.of("n1", 2), 1L);

        assertEquals(VersionRelation.THEIRS_NEWER, CausalityComparator.classify(ours, theirs));
    }

    @Test
    void rejects_versions_of_different_cids() {
        var a = version("t1", Map.of("n1", 1), 1L);
        var b = version("t2", Map.of("n1", 1), 1L);

        assertThrows(IllegalArgumentException.class, () -> CausalityComparator.classify(a, b));
    }
}
