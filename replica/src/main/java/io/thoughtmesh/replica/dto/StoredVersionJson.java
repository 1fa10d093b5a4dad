// file: replica/src/main/java/io/thoughtmesh/replica/dto/StoredVersionJson.java
package io.thoughtmesh.replica.dto;

import java.util.Map;

/**
 * JSON form of one store entry: the thought plus its CRDT metadata.
 */
public class StoredVersionJson {
    public ThoughtJson thought;
    public long writeTime;
    public String writerNode;
    public Map<String, Integer> vectorClock;
    public boolean tombstone;
}
