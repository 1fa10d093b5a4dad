// file: core/src/main/java/io/thoughtmesh/core/ThoughtIds.java
package io.thoughtmesh.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content addressing for thoughts.
 * <p>
 * The id is "thought-" followed by the first 32 hex characters of
 * SHA-256 over a canonical JSON form (object keys sorted at every level),
 * so the same content always yields the same id on every node.
 */
public final class ThoughtIds {

    private static final String PREFIX = "thought-";
    private static final int HEX_CHARS = 32;

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private ThoughtIds() {
        // utility
    }

    public static String contentId(String topic, long ts, JsonNode payload, List<String> links, String origin) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("topic", topic);
        canonical.put("ts", ts);
        // JsonNode -> plain maps/lists so ORDER_MAP_ENTRIES_BY_KEYS applies recursively
        canonical.put("payload", payload == null ? null : CANONICAL.convertValue(payload, Object.class));
        canonical.put("links", links == null ? List.of() : links);
        canonical.put("origin", origin);

        try {
            byte[] bytes = CANONICAL.writeValueAsBytes(canonical);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(bytes);
            return PREFIX + HexFormat.of().formatHex(digest).substring(0, HEX_CHARS);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String canonicalJson(JsonNode node) {
        try {
            return CANONICAL.writeValueAsString(CANONICAL.convertValue(node, Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("node is not serializable", e);
        }
    }
}
