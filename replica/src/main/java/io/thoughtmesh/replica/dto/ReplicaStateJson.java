// file: replica/src/main/java/io/thoughtmesh/replica/dto/ReplicaStateJson.java
package io.thoughtmesh.replica.dto;

import java.util.Map;

/**
 * JSON form of a whole replica.
 * Example:
 *   {
 *     "nodeId": "n1",
 *     "vectorClock": {"n1": 2, "n2": 1},
 *     "store": { "t1": { "thought": {...}, "writeTime": ..., ... } }
 *   }
 */
public class ReplicaStateJson {
    public String nodeId;
    public Map<String, Integer> vectorClock;
    public Map<String, StoredVersionJson> store;
}
