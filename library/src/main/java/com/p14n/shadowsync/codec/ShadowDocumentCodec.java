package com.p14n.shadowsync.codec;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.shadowsync.shadow.DesiredProperty;
import com.p14n.shadowsync.shadow.ReportedProperty;
import com.p14n.shadowsync.shadow.ShadowDocument;

/**
 * JSON form of the reported and desired sections of a shadow, one object per
 * property carrying its metadata:
 * {@code {"temperature":{"value":125,"timestamp":100}}} and
 * {@code {"target_temperature":{"value":130,"timestamp":90,"applied":false}}}.
 * Removal tombstones map each removed name to its removal timestamp, per
 * section: {@code {"reported":{"mode":120},"desired":{}}}.
 */
public final class ShadowDocumentCodec {

    private ShadowDocumentCodec() {
    }

    public static ObjectNode reportedToJson(Map<String, ReportedProperty> reported) {
        ObjectNode root = JsonUtil.newObject();
        reported.forEach((name, property) -> {
            ObjectNode node = root.putObject(name);
            node.set("value", property.value());
            node.put("timestamp", property.timestamp());
        });
        return root;
    }

    public static ObjectNode desiredToJson(Map<String, DesiredProperty> desired) {
        ObjectNode root = JsonUtil.newObject();
        desired.forEach((name, property) -> {
            ObjectNode node = root.putObject(name);
            node.set("value", property.value());
            node.put("timestamp", property.timestamp());
            node.put("applied", property.applied());
        });
        return root;
    }

    public static Map<String, ReportedProperty> reportedFromJson(JsonNode json) {
        Map<String, ReportedProperty> reported = new TreeMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = json.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode node = entry.getValue();
            reported.put(entry.getKey(), new ReportedProperty(node.get("value"), node.path("timestamp").asLong()));
        }
        return reported;
    }

    public static Map<String, DesiredProperty> desiredFromJson(JsonNode json) {
        Map<String, DesiredProperty> desired = new TreeMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = json.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode node = entry.getValue();
            desired.put(entry.getKey(), new DesiredProperty(node.get("value"), node.path("timestamp").asLong(),
                    node.path("applied").asBoolean()));
        }
        return desired;
    }

    public static ObjectNode removedToJson(Map<String, Long> reportedRemoved, Map<String, Long> desiredRemoved) {
        ObjectNode root = JsonUtil.newObject();
        ObjectNode reported = root.putObject("reported");
        reportedRemoved.forEach((name, at) -> reported.put(name, at.longValue()));
        ObjectNode desired = root.putObject("desired");
        desiredRemoved.forEach((name, at) -> desired.put(name, at.longValue()));
        return root;
    }

    /**
     * @param section {@code "reported"} or {@code "desired"}
     */
    public static Map<String, Long> removedFromJson(JsonNode json, String section) {
        Map<String, Long> removed = new TreeMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = json.path(section).fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            removed.put(entry.getKey(), entry.getValue().asLong());
        }
        return removed;
    }

    public static ObjectNode toJson(ShadowDocument document) {
        ObjectNode root = JsonUtil.newObject();
        root.put("deviceId", document.deviceId());
        root.set("reported", reportedToJson(document.reported()));
        root.set("desired", desiredToJson(document.desired()));
        root.put("version", document.version());
        root.put("lastModified", document.lastModified());
        root.put("active", document.active());
        root.set("removed", removedToJson(document.reportedRemoved(), document.desiredRemoved()));
        return root;
    }

    public static ShadowDocument fromJson(JsonNode json) {
        JsonNode removed = json.path("removed");
        return new ShadowDocument(json.path("deviceId").asText(),
                reportedFromJson(json.path("reported")),
                desiredFromJson(json.path("desired")),
                json.path("version").asLong(),
                json.path("lastModified").asLong(),
                json.path("active").asBoolean(true),
                removedFromJson(removed, "reported"),
                removedFromJson(removed, "desired"));
    }
}
