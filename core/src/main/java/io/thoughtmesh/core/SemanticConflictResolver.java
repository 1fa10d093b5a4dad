// file: core/src/main/java/io/thoughtmesh/core/SemanticConflictResolver.java
package io.thoughtmesh.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Topic-aware resolver for concurrent thoughts.
 * <p>
 * Algorithm:
 *  1) Order the two sides canonically (older / newer) by producer ts, then
 *     write time, then payload text, links, origin, sig and topic. Local and
 *     remote roles play no part, so every replica computes the same result. Sides
 *     that tie on all of these carry the same thought.
 *  2) If either side is a tombstone, the side with the later write time wins
 *     as-is (ties go to the tombstone). Strategy {@value #TOMBSTONE_LWW}.
 *  3) Otherwise merge payloads by {@link Topic}. Strategy {@value #SEMANTIC_MERGE}:
 *      - METRIC: field union, newer wins; numbers present on both sides are averaged.
 *      - EVENT:  field union, newer wins; adds merged=true and sources=[older, newer].
 *      - DREAM:  field union, newer wins; "vision"/"content" text is joined
 *                older + " | " + newer.
 *      - OTHER:  newer payload wins outright.
 *     Links are always unioned (deduplicated, sorted). Identity fields
 *     (cid, topic, ts, origin, sig) come from the newer side.
 *  4) Wrap the result with clock = max(both clocks), writeTime = max(both
 *     write times), writer = the merging node.
 */
public final class SemanticConflictResolver implements ConflictResolver {

    public static final String SEMANTIC_MERGE = "semantic-merge";
    public static final String TOMBSTONE_LWW = "tombstone-lww";

    static final String TEXT_SEPARATOR = " | ";
    private static final List<String> DREAM_TEXT_FIELDS = List.of("vision", "content");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Comparator<String> NULLABLE = Comparator.nullsFirst(Comparator.naturalOrder());

    // Only replicated content takes part: the writer of a resolved version is the
    // merging node and differs between replicas.
    static final Comparator<StoredVersion> CANONICAL_ORDER = Comparator
            .comparingLong((StoredVersion v) -> v.thought().ts())
            .thenComparingLong(StoredVersion::writeTime)
            .thenComparing(v -> ThoughtIds.canonicalJson(v.thought().payload()))
            .thenComparing(v -> String.join("\n", v.thought().links()))
            .thenComparing(v -> v.thought().origin(), NULLABLE)
            .thenComparing(v -> v.thought().sig(), NULLABLE)
            .thenComparing(v -> v.thought().topic());

    @Override
    public Resolution resolve(StoredVersion ours, StoredVersion theirs, String localNodeId) {
        Objects.requireNonNull(ours, "ours");
        Objects.requireNonNull(theirs, "theirs");
        Objects.requireNonNull(localNodeId, "localNodeId");

        boolean oursFirst = CANONICAL_ORDER.compare(ours, theirs) <= 0;
        StoredVersion older = oursFirst ? ours : theirs;
        StoredVersion newer = oursFirst ? theirs : ours;

        if (ours.tombstone() || theirs.tombstone()) {
            StoredVersion winner = tombstoneWinner(older, newer);
            return new Resolution(
                    wrap(winner.thought(), winner.tombstone(), ours, theirs, localNodeId),
                    TOMBSTONE_LWW);
        }

        Thought merged = mergeThoughts(older.thought(), newer.thought());
        return new Resolution(wrap(merged, false, ours, theirs, localNodeId), SEMANTIC_MERGE);
    }

    private static StoredVersion tombstoneWinner(StoredVersion older, StoredVersion newer) {
        if (older.writeTime() != newer.writeTime()) {
            return older.writeTime() > newer.writeTime() ? older : newer;
        }
        if (older.tombstone() != newer.tombstone()) {
            return older.tombstone() ? older : newer;
        }
        return newer;
    }

    private static StoredVersion wrap(Thought thought, boolean tombstone,
                                      StoredVersion ours, StoredVersion theirs, String localNodeId) {
        return new StoredVersion(
                thought,
                Math.max(ours.writeTime(), theirs.writeTime()),
                localNodeId,
                ours.clock().merge(theirs.clock()),
                tombstone
        );
    }

    static Thought mergeThoughts(Thought older, Thought newer) {
        var links = new TreeSet<String>(older.links());
        links.addAll(newer.links());

        JsonNode payload = mergePayloads(older.payload(), newer.payload(), newer.topicKind());
        return new Thought(
                newer.cid(),
                newer.topic(),
                newer.ts(),
                payload,
                new ArrayList<>(links),
                newer.origin(),
                newer.sig()
        );
    }

    static JsonNode mergePayloads(JsonNode older, JsonNode newer, Topic topic) {
        if (!older.isObject() || !newer.isObject()) {
            // No field structure to merge.
            return newer;
        }
        var o = (ObjectNode) older;
        var n = (ObjectNode) newer;
        return switch (topic) {
            case METRIC -> averageShared(o, n);
            case EVENT -> withSources(union(o, n), o, n);
            case DREAM -> joinText(union(o, n), o, n);
            case OTHER -> n;
        };
    }

    private static ObjectNode union(ObjectNode older, ObjectNode newer) {
        ObjectNode result = NODES.objectNode();
        result.setAll(older.deepCopy());
        result.setAll(newer.deepCopy());
        return result;
    }

    private static ObjectNode averageShared(ObjectNode older, ObjectNode newer) {
        ObjectNode result = union(older, newer);
        for (Iterator<Map.Entry<String, JsonNode>> it = older.fields(); it.hasNext(); ) {
            var e = it.next();
            JsonNode other = newer.get(e.getKey());
            if (e.getValue().isNumber() && other != null && other.isNumber()) {
                result.put(e.getKey(), (e.getValue().doubleValue() + other.doubleValue()) / 2);
            }
        }
        return result;
    }

    private static ObjectNode withSources(ObjectNode result, ObjectNode older, ObjectNode newer) {
        result.put("merged", true);
        ArrayNode sources = result.putArray("sources");
        sources.add(older.deepCopy());
        sources.add(newer.deepCopy());
        return result;
    }

    private static ObjectNode joinText(ObjectNode result, ObjectNode older, ObjectNode newer) {
        for (String field : DREAM_TEXT_FIELDS) {
            JsonNode a = older.get(field);
            JsonNode b = newer.get(field);
            if (a != null && a.isTextual() && b != null && b.isTextual()) {
                result.put(field, a.asText() + TEXT_SEPARATOR + b.asText());
            }
        }
        return result;
    }
}
