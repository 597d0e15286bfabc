package com.p14n.shadowsync.shadow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.shadowsync.codec.JsonUtil;

/**
 * The reconciliation rules, as pure functions over immutable documents.
 *
 * <p>
 * Properties are merged one at a time with last-writer-wins on the
 * property's own timestamp: an incoming value older than the stored one is
 * ignored, an equal or newer one replaces it. Re-asserting the stored value
 * produces no change, although a newer timestamp is still recorded so that a
 * later but older write cannot win. A null (or JSON null) value removes the
 * property under the same rule. The version advances by one when at least one
 * value changed.
 * </p>
 *
 * <p>
 * A removal leaves a tombstone carrying its timestamp. Writes older than the
 * tombstone are ignored, so the outcome does not depend on arrival order.
 * </p>
 */
public class ShadowReconciler {

    private final boolean pruneAppliedDesired;

    public ShadowReconciler(boolean pruneAppliedDesired) {
        this.pruneAppliedDesired = pruneAppliedDesired;
    }

    public Reconciliation applyReported(ShadowDocument document, Map<String, JsonNode> properties, long timestamp,
            long now) {
        Map<String, ReportedProperty> reported = new TreeMap<>(document.reported());
        Map<String, Long> removed = new TreeMap<>(document.reportedRemoved());
        List<PropertyChange> changes = new ArrayList<>();
        boolean touchedOnly = false;

        for (Map.Entry<String, JsonNode> entry : sorted(properties).entrySet()) {
            String name = entry.getKey();
            JsonNode value = entry.getValue();
            ReportedProperty current = reported.get(name);
            long stored = current != null ? current.timestamp() : removed.getOrDefault(name, Long.MIN_VALUE);
            if (timestamp < stored) {
                continue;
            }
            if (isRemoval(value)) {
                removed.put(name, timestamp);
                if (current != null) {
                    reported.remove(name);
                    changes.add(PropertyChange.removed(Section.REPORTED, name, current.value()));
                } else if (timestamp > stored) {
                    touchedOnly = true;
                }
                continue;
            }
            removed.remove(name);
            if (current == null) {
                reported.put(name, new ReportedProperty(value.deepCopy(), timestamp));
                changes.add(PropertyChange.added(Section.REPORTED, name, value));
            } else if (!JsonUtil.sameValue(current.value(), value)) {
                reported.put(name, new ReportedProperty(value.deepCopy(), timestamp));
                changes.add(PropertyChange.changed(Section.REPORTED, name, current.value(), value));
            } else if (timestamp > current.timestamp()) {
                reported.put(name, new ReportedProperty(current.value(), timestamp));
                touchedOnly = true;
            }
        }

        Map<String, DesiredProperty> desired = new TreeMap<>(document.desired());
        boolean flagsChanged = settleDesired(desired, reported, desired.keySet());
        return result(document, reported, desired, removed, document.desiredRemoved(), changes,
                flagsChanged || touchedOnly, timestamp, now);
    }

    public Reconciliation applyDesired(ShadowDocument document, Map<String, JsonNode> properties, long timestamp,
            long now) {
        Map<String, DesiredProperty> desired = new TreeMap<>(document.desired());
        Map<String, Long> removed = new TreeMap<>(document.desiredRemoved());
        List<PropertyChange> changes = new ArrayList<>();
        List<String> touched = new ArrayList<>();
        boolean touchedOnly = false;

        for (Map.Entry<String, JsonNode> entry : sorted(properties).entrySet()) {
            String name = entry.getKey();
            JsonNode value = entry.getValue();
            DesiredProperty current = desired.get(name);
            long stored = current != null ? current.timestamp() : removed.getOrDefault(name, Long.MIN_VALUE);
            if (timestamp < stored) {
                continue;
            }
            if (isRemoval(value)) {
                removed.put(name, timestamp);
                if (current != null) {
                    desired.remove(name);
                    changes.add(PropertyChange.removed(Section.DESIRED, name, current.value()));
                } else if (timestamp > stored) {
                    touchedOnly = true;
                }
                continue;
            }
            removed.remove(name);
            if (current != null && JsonUtil.sameValue(current.value(), value)) {
                if (timestamp > current.timestamp()) {
                    desired.put(name, new DesiredProperty(current.value(), timestamp, current.applied()));
                    touchedOnly = true;
                }
                continue;
            }
            desired.put(name, new DesiredProperty(value.deepCopy(), timestamp, false));
            touched.add(name);
            changes.add(current == null
                    ? PropertyChange.added(Section.DESIRED, name, value)
                    : PropertyChange.changed(Section.DESIRED, name, current.value(), value));
        }

        settleDesired(desired, document.reported(), touched);
        return result(document, document.reported(), desired, document.reportedRemoved(), removed, changes,
                touchedOnly, timestamp, now);
    }

    /**
     * Flags the named pending desired properties as applied without touching
     * the version. Names that are unknown or already applied are ignored.
     */
    public Reconciliation markApplied(ShadowDocument document, Collection<String> names, long now) {
        Map<String, DesiredProperty> desired = new TreeMap<>(document.desired());
        boolean modified = false;
        for (String name : names) {
            DesiredProperty current = desired.get(name);
            if (current != null && !current.applied()) {
                applied(desired, name, current);
                modified = true;
            }
        }
        return result(document, document.reported(), desired, document.reportedRemoved(),
                document.desiredRemoved(), List.of(), modified, now, now);
    }

    public Reconciliation clearDesired(ShadowDocument document, Collection<String> names, long now) {
        Map<String, DesiredProperty> desired = new TreeMap<>(document.desired());
        Map<String, Long> removed = new TreeMap<>(document.desiredRemoved());
        List<PropertyChange> changes = new ArrayList<>();
        for (String name : new TreeSet<>(names)) {
            DesiredProperty current = desired.remove(name);
            if (current != null) {
                removed.put(name, Math.max(now, current.timestamp()));
                changes.add(PropertyChange.removed(Section.DESIRED, name, current.value()));
            }
        }
        return result(document, document.reported(), desired, document.reportedRemoved(), removed, changes, false,
                now, now);
    }

    /**
     * Marks pending desired properties whose value the device now reports.
     *
     * @return whether any flag changed
     */
    private boolean settleDesired(Map<String, DesiredProperty> desired, Map<String, ReportedProperty> reported,
            Collection<String> names) {
        boolean changed = false;
        for (String name : List.copyOf(names)) {
            DesiredProperty property = desired.get(name);
            ReportedProperty actual = reported.get(name);
            if (property != null && !property.applied() && actual != null
                    && JsonUtil.sameValue(property.value(), actual.value())) {
                applied(desired, name, property);
                changed = true;
            }
        }
        return changed;
    }

    private void applied(Map<String, DesiredProperty> desired, String name, DesiredProperty property) {
        if (pruneAppliedDesired) {
            desired.remove(name);
        } else {
            desired.put(name, property.asApplied());
        }
    }

    private static Reconciliation result(ShadowDocument document, Map<String, ReportedProperty> reported,
            Map<String, DesiredProperty> desired, Map<String, Long> reportedRemoved, Map<String, Long> desiredRemoved,
            List<PropertyChange> changes, boolean metadataChanged, long timestamp, long now) {
        if (changes.isEmpty()) {
            if (!metadataChanged) {
                return new Reconciliation(document,
                        ShadowDelta.empty(document.deviceId(), document.version(), timestamp), false);
            }
            ShadowDocument updated = new ShadowDocument(document.deviceId(), reported, desired, document.version(),
                    Math.max(now, document.lastModified()), document.active(), reportedRemoved, desiredRemoved);
            return new Reconciliation(updated,
                    ShadowDelta.empty(document.deviceId(), document.version(), timestamp), true);
        }
        long nextVersion = document.version() + 1;
        ShadowDocument updated = new ShadowDocument(document.deviceId(), reported, desired, nextVersion,
                Math.max(now, document.lastModified()), document.active(), reportedRemoved, desiredRemoved);
        boolean reportedChanged = changes.stream().anyMatch(c -> c.section() == Section.REPORTED);
        boolean desiredChanged = changes.stream().anyMatch(c -> c.section() == Section.DESIRED);
        ShadowDelta delta = new ShadowDelta(document.deviceId(), document.version(), nextVersion,
                DeltaKind.of(reportedChanged, desiredChanged), timestamp, changes);
        return new Reconciliation(updated, delta, true);
    }

    private static boolean isRemoval(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    private static Map<String, JsonNode> sorted(Map<String, JsonNode> properties) {
        Map<String, JsonNode> sorted = new TreeMap<>();
        properties.forEach((name, value) -> {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Property name cannot be null or empty");
            }
            sorted.put(name, value);
        });
        return sorted;
    }
}
