package com.p14n.shadowsync.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.shadowsync.shadow.ChangeType;
import com.p14n.shadowsync.shadow.DeltaKind;
import com.p14n.shadowsync.shadow.PropertyChange;
import com.p14n.shadowsync.shadow.Section;
import com.p14n.shadowsync.shadow.ShadowDelta;

/**
 * JSON form of a {@link ShadowDelta} as published on update topics:
 *
 * <pre>
 * {"deviceId":"wh-1","fromVersion":0,"toVersion":1,"kind":"reported-changed","timestamp":100,
 *  "state":{"reported":{"temperature":125}},
 *  "changes":[{"section":"reported","name":"temperature","type":"added","previous":null,"current":125}]}
 * </pre>
 *
 * {@code state} holds the new value of every changed property, with null for
 * removals.
 */
public final class ShadowDeltaCodec {

    private ShadowDeltaCodec() {
    }

    public static ObjectNode toJson(ShadowDelta delta) {
        ObjectNode root = JsonUtil.newObject();
        root.put("deviceId", delta.deviceId());
        root.put("fromVersion", delta.fromVersion());
        root.put("toVersion", delta.toVersion());
        if (delta.kind() == null) {
            root.putNull("kind");
        } else {
            root.put("kind", delta.kind().label());
        }
        root.put("timestamp", delta.timestamp());

        ObjectNode state = root.putObject("state");
        for (PropertyChange change : delta.changes()) {
            ObjectNode section = state.has(change.section().key())
                    ? (ObjectNode) state.get(change.section().key())
                    : state.putObject(change.section().key());
            section.set(change.name(), orNull(change.current()));
        }

        var changes = root.putArray("changes");
        for (PropertyChange change : delta.changes()) {
            ObjectNode node = changes.addObject();
            node.put("section", change.section().key());
            node.put("name", change.name());
            node.put("type", change.type().name().toLowerCase(Locale.ROOT));
            node.set("previous", orNull(change.previous()));
            node.set("current", orNull(change.current()));
        }
        return root;
    }

    public static byte[] toBytes(ShadowDelta delta) {
        return JsonUtil.toBytes(toJson(delta));
    }

    /**
     * @throws IllegalArgumentException if the document is not a delta
     */
    public static ShadowDelta fromJson(JsonNode json) {
        if (json == null || !json.isObject() || !json.hasNonNull("deviceId")) {
            throw new IllegalArgumentException("Not a shadow delta: " + json);
        }
        List<PropertyChange> changes = new ArrayList<>();
        for (JsonNode node : json.path("changes")) {
            changes.add(new PropertyChange(
                    Section.fromKey(node.path("section").asText()),
                    node.path("name").asText(),
                    ChangeType.valueOf(node.path("type").asText().toUpperCase(Locale.ROOT)),
                    valueOrNull(node.get("previous")),
                    valueOrNull(node.get("current"))));
        }
        JsonNode kind = json.get("kind");
        return new ShadowDelta(
                json.get("deviceId").asText(),
                json.path("fromVersion").asLong(),
                json.path("toVersion").asLong(),
                kind == null || kind.isNull() ? null : DeltaKind.fromLabel(kind.asText()),
                json.path("timestamp").asLong(),
                changes);
    }

    private static JsonNode orNull(JsonNode value) {
        return value == null ? JsonUtil.mapper().nullNode() : value;
    }

    private static JsonNode valueOrNull(JsonNode value) {
        return value == null || value.isNull() ? null : value;
    }
}
