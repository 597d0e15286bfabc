package com.p14n.shadowsync.data;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A delivered envelope together with its decoded payload, as handed to a
 * subscriber.
 */
public record RoutedMessage(Envelope envelope, JsonNode payload) {

    public String topic() {
        return envelope.topic();
    }

    public long timestamp() {
        return envelope.timestamp();
    }
}
