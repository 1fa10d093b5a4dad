// file: replica/src/main/java/io/thoughtmesh/replica/ReplicaStateCodec.java
package io.thoughtmesh.replica;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.thoughtmesh.core.StoredVersion;
import io.thoughtmesh.core.Thought;
import io.thoughtmesh.core.VectorClock;
import io.thoughtmesh.replica.dto.ReplicaStateJson;
import io.thoughtmesh.replica.dto.StoredVersionJson;
import io.thoughtmesh.replica.dto.ThoughtJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of {@link ReplicaState}.
 * <p>
 * Responsibilities:
 *  - Map the domain values to the public-field DTOs in {@code dto} and back.
 *  - Read / write a state file for tools that keep replicas on disk.
 * <p>
 * Notes:
 *  - Store order is preserved (LinkedHashMap on both sides).
 *  - The shape is a convenience for transports and tools; nothing guarantees
 *    compatibility across versions.
 */
public final class ReplicaStateCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ReplicaStateCodec() {
        // utility
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String encode(ReplicaState state) {
        try {
            return MAPPER.writeValueAsString(toJson(state));
        } catch (JsonProcessingException e) {
            throw new StateCodecException("Failed to encode state of " + state.nodeId(), e);
        }
    }

    public static ReplicaState decode(String json) {
        ReplicaStateJson dto;
        try {
            dto = MAPPER.readValue(json, ReplicaStateJson.class);
        } catch (JsonProcessingException e) {
            throw new StateCodecException("Malformed replica state JSON", e);
        }
        return fromJson(dto);
    }

    public static void write(Path path, ReplicaState state) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(path, encode(state));
        } catch (IOException e) {
            throw new StateCodecException("Failed to write replica state to " + path, e);
        }
    }

    public static ReplicaState read(Path path) {
        try {
            return decode(Files.readString(path));
        } catch (IOException e) {
            throw new StateCodecException("Failed to read replica state from " + path, e);
        }
    }

    // ---------- domain -> dto ----------

    public static ReplicaStateJson toJson(ReplicaState state) {
        var dto = new ReplicaStateJson();
        dto.nodeId = state.nodeId();
        dto.vectorClock = new LinkedHashMap<>(state.clock().entries());
        dto.store = new LinkedHashMap<>();
        state.store().forEach((cid, v) -> dto.store.put(cid, toJson(v)));
        return dto;
    }

    public static StoredVersionJson toJson(StoredVersion v) {
        var dto = new StoredVersionJson();
        dto.thought = toJson(v.thought());
        dto.writeTime = v.writeTime();
        dto.writerNode = v.writerNode();
        dto.vectorClock = new LinkedHashMap<>(v.clock().entries());
        dto.tombstone = v.tombstone();
        return dto;
    }

    public static ThoughtJson toJson(Thought t) {
        var dto = new ThoughtJson();
        dto.cid = t.cid();
        dto.ts = t.ts();
        dto.topic = t.topic();
        dto.payload = t.payload();
        dto.links = t.links();
        dto.sig = t.sig();
        dto.origin = t.origin();
        return dto;
    }

    // ---------- dto -> domain ----------

    public static ReplicaState fromJson(ReplicaStateJson dto) {
        if (dto == null) throw new StateCodecException("replica state must not be null");
        try {
            Map<String, StoredVersion> store = new LinkedHashMap<>();
            if (dto.store != null) {
                dto.store.forEach((cid, v) -> store.put(cid, fromJson(v)));
            }
            return new ReplicaState(dto.nodeId, clockOf(dto.vectorClock), store);
        } catch (NullPointerException | IllegalArgumentException e) {
            throw new StateCodecException("Invalid replica state: " + e.getMessage(), e);
        }
    }

    private static StoredVersion fromJson(StoredVersionJson dto) {
        if (dto == null || dto.thought == null) {
            throw new IllegalArgumentException("store entry without a thought");
        }
        return new StoredVersion(
                fromJson(dto.thought),
                dto.writeTime,
                dto.writerNode,
                clockOf(dto.vectorClock),
                dto.tombstone
        );
    }

    private static Thought fromJson(ThoughtJson dto) {
        return new Thought(dto.cid, dto.topic, dto.ts, dto.payload, dto.links, dto.origin, dto.sig);
    }

    private static VectorClock clockOf(Map<String, Integer> entries) {
        return entries == null ? VectorClock.empty() : new VectorClock(entries);
    }
}
