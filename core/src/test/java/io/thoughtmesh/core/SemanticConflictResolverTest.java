package io.thoughtmesh.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SemanticConflictResolverTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final SemanticConflictResolver resolver = new SemanticConflictResolver();

    private static JsonNode json(String raw) {
        try {
            return MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static StoredVersion version(String node, String topic, long ts, String payload,
                                         List<String> links, long writeTime) {
        var thought = new Thought("t1", topic, ts, json(payload), links, node, "sig-" + node);
        return StoredVersion.live(thought, writeTime, node, new VectorClock(Map.of(node, 1)));
    }

    @Test
    void metric_numbers_on_both_sides_are_averaged() {
        var ours = version("n1", "metric", 1_000L, "{\"H\":0.8,\"tau\":0.2,\"label\":\"mine\"}", List.of(), 10L);
        var theirs = version("n2", "metric", 2_000L, "{\"H\":0.9,\"tau\":0.1,\"label\":\"yours\",\"nodes\":3}", List.of(), 20L);

        var res = resolver.resolve(ours, theirs, "n1");
        JsonNode payload = res.version().thought().payload();

        assertEquals(SemanticConflictResolver.SEMANTIC_MERGE, res.strategy());
        assertEquals(0.85, payload.get("H").asDouble(), 1e-9);
        assertEquals(0.15, payload.get("tau").asDouble(), 1e-9);
        // non-shared or non-numeric fields come from the later producer ts
        assertEquals("yours", payload.get("label").asText());
        assertEquals(3, payload.get("nodes").asInt());
    }

    @Test
    void resolution_is_independent_of_which_side_is_local() {
        var a = version("n1", "metric", 1_000L, "{\"H\":0.8,\"tau\":0.2,\"node\":\"1\"}", List.of("x"), 10L);
        var b = version("n2", "metric", 1_000L, "{\"H\":0.9,\"tau\":0.1,\"node\":\"2\"}", List.of("y"), 10L);

        var atN1 = resolver.resolve(a, b, "n1").version();
        var atN2 = resolver.resolve(b, a, "n2").version();

        assertEquals(atN1.thought(), atN2.thought());
        assertEquals(ThoughtIds.canonicalJson(atN1.thought().payload()),
                ThoughtIds.canonicalJson(atN2.thought().payload()));
        assertEquals(atN1.clock(), atN2.clock());
        assertEquals(atN1.writeTime(), atN2.writeTime());
        // the merging node authors the resolution
        assertEquals("n1", atN1.writerNode());
        assertEquals("n2", atN2.writerNode());
    }

    @Test
    void writer_node_never_picks_the_newer_side() {
        // same ts and write time; only the writers differ between the two runs
        var v1 = new Thought("t1", "note", 1_000L, json("{\"v\":1}"), List.of(), "o", null);
        var v2 = new Thought("t1", "note", 1_000L, json("{\"v\":2}"), List.of(), "o", null);

        var first = resolver.resolve(
                StoredVersion.live(v1, 10L, "z", new VectorClock(Map.of("z", 1))),
                StoredVersion.live(v2, 10L, "a", new VectorClock(Map.of("a", 1))), "z").version();
        var second = resolver.resolve(
                StoredVersion.live(v1, 10L, "a", new VectorClock(Map.of("a", 1))),
                StoredVersion.live(v2, 10L, "z", new VectorClock(Map.of("z", 1))), "a").version();

        assertEquals(json("{\"v\":2}"), first.thought().payload());
        assertEquals(first.thought(), second.thought());
    }

    @Test
    void resolved_version_merges_clocks_and_write_times() {
        var ours = version("n1", "other", 1_000L, "{\"v\":1}", List.of(), 50L);
        var theirs = version("n2", "other", 2_000L, "{\"v\":2}", List.of(), 40L);

        var resolved = resolver.resolve(ours, theirs, "n1").version();

        assertEquals(new VectorClock(Map.of("n1", 1, "n2", 1)), resolved.clock());
        assertEquals(50L, resolved.writeTime());
        assertTrue(ours.clock().happensBefore(resolved.clock()));
        assertTrue(theirs.clock().happensBefore(resolved.clock()));
        assertFalse(resolved.tombstone());
    }

    @Test
    void event_payloads_are_unioned_with_sources_kept() {
        var ours = version("n1", "event", 1_000L, "{\"type\":\"a\",\"impact\":0.3}", List.of(), 10L);
        var theirs = version("n2", "event", 2_000L, "{\"type\":\"b\",\"data\":{\"k\":1}}", List.of(), 10L);

        JsonNode payload = resolver.resolve(ours, theirs, "n1").version().thought().payload();

        assertTrue(payload.get("merged").asBoolean());
        assertEquals("b", payload.get("type").asText());
        assertEquals(0.3, payload.get("impact").asDouble(), 1e-9);
        assertEquals(1, payload.get("data").get("k").asInt());
        assertEquals(2, payload.get("sources").size());
        assertEquals(json("{\"type\":\"a\",\"impact\":0.3}"), payload.get("sources").get(0));
        assertEquals(json("{\"type\":\"b\",\"data\":{\"k\":1}}"), payload.get("sources").get(1));
    }

    @Test
    void dream_visions_are_concatenated_older_first() {
        var ours = version("n1", "dream", 2_000L, "{\"vision\":\"mesh\",\"lucidity\":0.4}", List.of(), 10L);
        var theirs = version("n2", "dream", 1_000L, "{\"vision\":\"tides\",\"symbols\":[\"wave\"]}", List.of(), 10L);

        JsonNode payload = resolver.resolve(ours, theirs, "n1").version().thought().payload();

        assertEquals("tides | mesh", payload.get("vision").asText());
        assertEquals(0.4, payload.get("lucidity").asDouble(), 1e-9);
        assertEquals("wave", payload.get("symbols").get(0).asText());
        assertNull(payload.get("merged"));
    }

    @Test
    void dream_text_present_on_one_side_is_kept_as_is() {
        var ours = version("n1", "dream", 1_000L, "{\"content\":\"alone\"}", List.of(), 10L);
        var theirs = version("n2", "dream", 2_000L, "{\"lucidity\":1}", List.of(), 10L);

        JsonNode payload = resolver.resolve(ours, theirs, "n1").version().thought().payload();

        assertEquals("alone", payload.get("content").asText());
    }

    @Test
    void unknown_topics_take_the_newer_payload_whole() {
        var ours = version("n1", "weather", 5_000L, "{\"sky\":\"clear\",\"wind\":3}", List.of(), 10L);
        var theirs = version("n2", "weather", 4_000L, "{\"sky\":\"storm\"}", List.of(), 99L);

        var thought = resolver.resolve(ours, theirs, "n2").version().thought();

        assertEquals(json("{\"sky\":\"clear\",\"wind\":3}"), thought.payload());
        assertEquals("n1", thought.origin());
        assertEquals("sig-n1", thought.sig());
        assertEquals(5_000L, thought.ts());
    }

    @Test
    void non_object_payloads_take_the_newer_side() {
        var ours = version("n1", "metric", 1_000L, "0.5", List.of(), 10L);
        var theirs = version("n2", "metric", 2_000L, "{\"H\":1.0}", List.of(), 10L);

        assertEquals(json("{\"H\":1.0}"), resolver.resolve(ours, theirs, "n1").version().thought().payload());
    }

    @Test
    void links_are_unioned_without_duplicates() {
        var ours = version("n1", "event", 1_000L, "{}", List.of("c", "a"), 10L);
        var theirs = version("n2", "event", 2_000L, "{}", List.of("b", "a"), 10L);

        var thought = resolver.resolve(ours, theirs, "n1").version().thought();

        assertEquals(List.of("a", "b", "c"), thought.links());
    }

    @Test
    void tombstone_with_later_write_time_wins() {
        var live = version("n1", "metric", 1_000L, "{\"H\":0.5}", List.of(), 100L);
        var tomb = version("n2", "metric", 1_000L, "{\"H\":0.7}", List.of(), 200L)
                .toTombstone(200L, "n2", new VectorClock(Map.of("n2", 2)));

        var res = resolver.resolve(live, tomb, "n1");

        assertEquals(SemanticConflictResolver.TOMBSTONE_LWW, res.strategy());
        assertTrue(res.version().tombstone());
        assertEquals(new VectorClock(Map.of("n1", 1, "n2", 2)), res.version().clock());
        assertEquals("n1", res.version().writerNode());
    }

    @Test
    void later_live_write_overrides_concurrent_tombstone() {
        var tomb = version("n1", "metric", 1_000L, "{\"H\":0.5}", List.of(), 100L)
                .toTombstone(100L, "n1", new VectorClock(Map.of("n1", 2)));
        var live = version("n2", "metric", 900L, "{\"H\":0.7}", List.of(), 300L);

        var res = resolver.resolve(tomb, live, "n1");

        assertFalse(res.version().tombstone());
        assertEquals(json("{\"H\":0.7}"), res.version().thought().payload());
        assertEquals(300L, res.version().writeTime());
    }

    @Test
    void tombstone_wins_a_write_time_tie() {
        var live = version("n1", "metric", 1_000L, "{\"H\":0.5}", List.of(), 100L);
        var tomb = version("n2", "metric", 1_000L, "{\"H\":0.5}", List.of(), 100L)
                .toTombstone(100L, "n2", new VectorClock(Map.of("n2", 2)));

        assertTrue(resolver.resolve(live, tomb, "n1").version().tombstone());
        assertTrue(resolver.resolve(tomb, live, "n2").version().tombstone());
    }
}
