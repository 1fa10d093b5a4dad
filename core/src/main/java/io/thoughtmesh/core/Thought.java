// file: core/src/main/java/io/thoughtmesh/core/Thought.java
package io.thoughtmesh.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;
import java.util.Objects;

/**
 * A content-addressed record replicated between nodes.
 * <p>
 * Fields:
 *  - cid:     content id, unique within a replica's store.
 *  - topic:   logical channel; picks the merge policy (see {@link Topic}).
 *  - ts:      producer timestamp in millis. Supplied by the producer and never
 *             used to decide causality, only as a tie-breaker in resolution.
 *  - payload: topic-dependent JSON value.
 *  - links:   cids of causal predecessors.
 *  - origin:  node that produced the thought (may be null).
 *  - sig:     opaque signature, carried but not verified (may be null).
 * <p>
 * The payload is deep-copied on the way in and on the way out, so a Thought is
 * immutable even though {@link JsonNode} is not.
 */
public record Thought(
        String cid,
        String topic,
        long ts,
        JsonNode payload,
        List<String> links,
        String origin,
        String sig
) {
    public Thought {
        Objects.requireNonNull(cid, "cid");
        Objects.requireNonNull(topic, "topic");
        if (cid.isBlank()) throw new IllegalArgumentException("cid must not be blank");
        if (topic.isBlank()) throw new IllegalArgumentException("topic must not be blank");
        payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
        links = links == null ? List.of() : List.copyOf(links);
    }

    /**
     * Build a thought whose cid is derived from its content.
     */
    public static Thought create(String topic, long ts, JsonNode payload, List<String> links, String origin) {
        String cid = ThoughtIds.contentId(topic, ts, payload, links, origin);
        return new Thought(cid, topic, ts, payload, links, origin, null);
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    /** Merge policy selected by this thought's topic string. */
    public Topic topicKind() {
        return Topic.fromName(topic);
    }
}
