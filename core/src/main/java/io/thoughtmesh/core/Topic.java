// file: core/src/main/java/io/thoughtmesh/core/Topic.java
package io.thoughtmesh.core;

import java.util.Locale;

/**
 * Closed set of topics with a dedicated merge policy.
 * <p>
 * Thoughts carry their topic as a free-form string; anything that is not one of
 * the known names maps to {@link #OTHER}.
 */
public enum Topic {
    METRIC("metric"),
    EVENT("event"),
    DREAM("dream"),
    OTHER("other");

    private final String wireName;

    Topic(String wireName) {
        this.wireName = wireName;
    }

    public static Topic fromName(String topic) {
        if (topic == null) return OTHER;
        String name = topic.trim().toLowerCase(Locale.ROOT);
        for (Topic t : values()) {
            if (t.wireName.equals(name)) return t;
        }
        return OTHER;
    }
}
