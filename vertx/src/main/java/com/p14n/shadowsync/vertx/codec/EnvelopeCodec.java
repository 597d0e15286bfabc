package com.p14n.shadowsync.vertx.codec;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.p14n.shadowsync.data.Envelope;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonObject;

/**
 * MessageCodec for carrying {@link Envelope}s on the Vert.x EventBus.
 *
 * <p>
 * Wire format:
 * [4 bytes: length][JSON object]
 * with the body base64 encoded. Local deliveries pass the (immutable)
 * envelope through untouched.
 * </p>
 */
public class EnvelopeCodec implements MessageCodec<Envelope, Envelope> {

    public static final String NAME = "shadowsync-envelope";

    @Override
    public void encodeToWire(Buffer buffer, Envelope envelope) {
        byte[] jsonBytes = toJson(envelope).encode().getBytes(StandardCharsets.UTF_8);
        buffer.appendInt(jsonBytes.length);
        buffer.appendBytes(jsonBytes);
    }

    @Override
    public Envelope decodeFromWire(int pos, Buffer buffer) {
        int length = buffer.getInt(pos);
        byte[] jsonBytes = buffer.getBytes(pos + 4, pos + 4 + length);
        return fromJson(new JsonObject(new String(jsonBytes, StandardCharsets.UTF_8)));
    }

    @Override
    public Envelope transform(Envelope envelope) {
        return envelope;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }

    static JsonObject toJson(Envelope envelope) {
        return new JsonObject()
                .put("messageId", envelope.messageId())
                .put("correlationId", envelope.correlationId())
                .put("topic", envelope.topic())
                .put("contentType", envelope.contentType())
                .put("headers", new JsonObject(new LinkedHashMap<String, Object>(envelope.headers())))
                .put("body", envelope.body())
                .put("timestamp", envelope.timestamp())
                .put("deliveryCount", envelope.deliveryCount())
                .put("redelivered", envelope.redelivered())
                .put("traceparent", envelope.traceparent());
    }

    static Envelope fromJson(JsonObject json) {
        Map<String, String> headers = new HashMap<>();
        JsonObject headersJson = json.getJsonObject("headers");
        if (headersJson != null) {
            headersJson.forEach(entry -> headers.put(entry.getKey(), String.valueOf(entry.getValue())));
        }
        return new Envelope(
                json.getString("messageId"),
                json.getString("correlationId"),
                json.getString("topic"),
                json.getString("contentType"),
                headers,
                json.getBinary("body"),
                json.getLong("timestamp", 0L),
                json.getInteger("deliveryCount", 0),
                json.getBoolean("redelivered", false),
                json.getString("traceparent"));
    }
}
