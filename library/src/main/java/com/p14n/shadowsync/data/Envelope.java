package com.p14n.shadowsync.data;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * A message as it travels through the broker: routing topic, content
 * metadata and the raw body.
 *
 * <p>
 * {@code deliveryCount} is 0 for a freshly published message and is
 * incremented by the transport every time the message is handed to a
 * consumer. {@code redelivered} is set once a message has been returned to
 * its queue after a nack or a connection loss.
 * </p>
 */
public record Envelope(String messageId,
        String correlationId,
        String topic,
        String contentType,
        Map<String, String> headers,
        byte[] body,
        long timestamp,
        int deliveryCount,
        boolean redelivered,
        String traceparent) implements Traceable {

    public static final String APPLICATION_JSON = "application/json";
    public static final String TEXT_PLAIN = "text/plain";

    public Envelope {
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    /**
     * Creates a JSON envelope with a random message id stamped with the current
     * time.
     */
    public static Envelope create(String topic, byte[] body, Map<String, String> headers) {
        return create(topic, body, headers, System.currentTimeMillis(), null);
    }

    public static Envelope create(String topic, byte[] body, Map<String, String> headers, long timestamp,
            String correlationId) {
        return new Envelope(UUID.randomUUID().toString(), correlationId, topic, APPLICATION_JSON, headers,
                body, timestamp, 0, false, null);
    }

    public static Envelope json(String topic, String json, long timestamp) {
        return create(topic, json.getBytes(StandardCharsets.UTF_8), Map.of(), timestamp, null);
    }

    @Override
    public String id() {
        return messageId;
    }

    /**
     * The effective content type, defaulting to JSON when none was declared.
     */
    public String effectiveContentType() {
        return contentType == null || contentType.isBlank() ? APPLICATION_JSON : contentType;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /** Copy handed to a consumer, with the delivery count advanced. */
    public Envelope delivered() {
        return new Envelope(messageId, correlationId, topic, contentType, headers, body, timestamp,
                deliveryCount + 1, redelivered, traceparent);
    }

    /** Copy returned to a queue for another delivery attempt. */
    public Envelope requeued() {
        return new Envelope(messageId, correlationId, topic, contentType, headers, body, timestamp,
                deliveryCount, true, traceparent);
    }

    /** Copy returned to a queue without counting the attempt that was made. */
    public Envelope released() {
        return new Envelope(messageId, correlationId, topic, contentType, headers, body, timestamp,
                Math.max(0, deliveryCount - 1), true, traceparent);
    }

    public Envelope withTopic(String newTopic) {
        return new Envelope(messageId, correlationId, newTopic, contentType, headers, body, timestamp,
                deliveryCount, redelivered, traceparent);
    }

    public Envelope withHeaders(Map<String, String> newHeaders) {
        return new Envelope(messageId, correlationId, topic, contentType, newHeaders, body, timestamp,
                deliveryCount, redelivered, traceparent);
    }

    public Envelope withContentType(String newContentType) {
        return new Envelope(messageId, correlationId, topic, newContentType, headers, body, timestamp,
                deliveryCount, redelivered, traceparent);
    }

    public Envelope withTraceparent(String newTraceparent) {
        return new Envelope(messageId, correlationId, topic, contentType, headers, body, timestamp,
                deliveryCount, redelivered, newTraceparent);
    }
}
