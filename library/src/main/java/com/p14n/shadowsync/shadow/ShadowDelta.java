package com.p14n.shadowsync.shadow;

import java.util.List;
import java.util.Optional;

/**
 * The property changes made by one accepted mutation, tagged with the version
 * transition. An empty delta (no changes, {@code fromVersion == toVersion},
 * null kind) means the mutation was a no-op.
 */
public record ShadowDelta(String deviceId,
        long fromVersion,
        long toVersion,
        DeltaKind kind,
        long timestamp,
        List<PropertyChange> changes) {

    public ShadowDelta {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static ShadowDelta empty(String deviceId, long version, long timestamp) {
        return new ShadowDelta(deviceId, version, version, null, timestamp, List.of());
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public List<PropertyChange> changes(Section section) {
        return changes.stream().filter(c -> c.section() == section).toList();
    }

    public Optional<PropertyChange> change(Section section, String name) {
        return changes.stream()
                .filter(c -> c.section() == section && c.name().equals(name))
                .findFirst();
    }
}
