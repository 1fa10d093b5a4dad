// file: replica/src/main/java/io/thoughtmesh/replica/dto/ThoughtJson.java
package io.thoughtmesh.replica.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * JSON form of a thought.
 * Example:
 *   {
 *     "cid": "t1",
 *     "ts": 1728000000000,
 *     "topic": "metric",
 *     "payload": {"H": 0.8, "tau": 0.2},
 *     "links": [],
 *     "sig": null,
 *     "origin": "n1"
 *   }
 */
public class ThoughtJson {
    public String cid;
    public long ts;
    public String topic;
    public JsonNode payload;
    public List<String> links;
    public String sig;     // opaque, never verified
    public String origin;
}
