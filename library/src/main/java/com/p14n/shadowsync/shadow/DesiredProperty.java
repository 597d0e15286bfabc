package com.p14n.shadowsync.shadow;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A requested value. {@code applied} becomes true once the device reports
 * the same value.
 */
public record DesiredProperty(JsonNode value, long timestamp, boolean applied) {

    public DesiredProperty asApplied() {
        return applied ? this : new DesiredProperty(value, timestamp, true);
    }
}
