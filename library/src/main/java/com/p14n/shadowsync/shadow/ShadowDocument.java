package com.p14n.shadowsync.shadow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.shadowsync.codec.JsonUtil;

/**
 * The authoritative state of one device. Immutable; every mutation produces a
 * new document.
 *
 * @param version         advanced by one on every accepted value change
 * @param lastModified    epoch millis of the last change, including metadata
 * @param active          false once the device has been decommissioned
 * @param reportedRemoved when each removed reported property was removed, so
 *                        an older write cannot bring it back
 * @param desiredRemoved  the same for removed desired properties
 */
public record ShadowDocument(String deviceId,
        Map<String, ReportedProperty> reported,
        Map<String, DesiredProperty> desired,
        long version,
        long lastModified,
        boolean active,
        Map<String, Long> reportedRemoved,
        Map<String, Long> desiredRemoved) {

    public ShadowDocument {
        if (deviceId == null || deviceId.isEmpty()) {
            throw new IllegalArgumentException("Device id cannot be null or empty");
        }
        reported = Collections.unmodifiableMap(new TreeMap<>(reported == null ? Map.of() : reported));
        desired = Collections.unmodifiableMap(new TreeMap<>(desired == null ? Map.of() : desired));
        reportedRemoved = Collections
                .unmodifiableMap(new TreeMap<>(reportedRemoved == null ? Map.of() : reportedRemoved));
        desiredRemoved = Collections
                .unmodifiableMap(new TreeMap<>(desiredRemoved == null ? Map.of() : desiredRemoved));
    }

    public ShadowDocument(String deviceId, Map<String, ReportedProperty> reported,
            Map<String, DesiredProperty> desired, long version, long lastModified, boolean active) {
        this(deviceId, reported, desired, version, lastModified, active, Map.of(), Map.of());
    }

    public static ShadowDocument create(String deviceId, long now) {
        return new ShadowDocument(deviceId, Map.of(), Map.of(), 0, now, true);
    }

    public JsonNode reportedValue(String name) {
        ReportedProperty property = reported.get(name);
        return property == null ? null : property.value();
    }

    public JsonNode desiredValue(String name) {
        DesiredProperty property = desired.get(name);
        return property == null ? null : property.value();
    }

    /**
     * A desired property is in sync when the device reports the same value.
     */
    public boolean isInSync(String name) {
        JsonNode wanted = desiredValue(name);
        return wanted != null && JsonUtil.sameValue(wanted, reportedValue(name));
    }

    /**
     * Desired values the device has not yet reported, by property name.
     */
    public Map<String, JsonNode> pendingDelta() {
        Map<String, JsonNode> pending = new LinkedHashMap<>();
        desired.forEach((name, property) -> {
            if (!JsonUtil.sameValue(property.value(), reportedValue(name))) {
                pending.put(name, property.value());
            }
        });
        return pending;
    }

    public ShadowDocument deactivated(long now) {
        return new ShadowDocument(deviceId, reported, desired, version, now, false, reportedRemoved,
                desiredRemoved);
    }
}
