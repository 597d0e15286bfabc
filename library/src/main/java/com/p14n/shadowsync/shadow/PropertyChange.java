package com.p14n.shadowsync.shadow;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One property difference between two shadow versions. {@code previous} is
 * null for additions and {@code current} is null for removals.
 */
public record PropertyChange(Section section, String name, ChangeType type, JsonNode previous, JsonNode current) {

    public static PropertyChange added(Section section, String name, JsonNode value) {
        return new PropertyChange(section, name, ChangeType.ADDED, null, value);
    }

    public static PropertyChange changed(Section section, String name, JsonNode previous, JsonNode value) {
        return new PropertyChange(section, name, ChangeType.CHANGED, previous, value);
    }

    public static PropertyChange removed(Section section, String name, JsonNode previous) {
        return new PropertyChange(section, name, ChangeType.REMOVED, previous, null);
    }
}
