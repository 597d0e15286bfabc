package com.p14n.shadowsync.shadow;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param timestamp when the device asserted the value, epoch millis
 */
public record ReportedProperty(JsonNode value, long timestamp) {
}
