package com.p14n.shadowsync.data;

/**
 * A message that carries enough identity to be traced across the broker.
 */
public interface Traceable {

    /**
     * Returns the unique identifier of the message.
     *
     * @return the message id
     */
    String id();

    /**
     * Returns the topic the message was published on.
     *
     * @return the topic string
     */
    String topic();

    /**
     * Returns the correlation identifier linking the message to a request, if
     * any.
     *
     * @return the correlation id or null
     */
    String correlationId();

    /**
     * Returns the W3C trace parent of the publishing span.
     *
     * @return the trace parent string or null
     */
    String traceparent();
}
