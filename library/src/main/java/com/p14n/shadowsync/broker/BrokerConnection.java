package com.p14n.shadowsync.broker;

import java.util.Map;

import com.p14n.shadowsync.data.Envelope;

/**
 * A handle on one logical connection to a topic exchange. Instances are
 * created and owned by the caller; nothing is shared process-wide.
 */
public interface BrokerConnection extends AutoCloseable {

    /**
     * Establishes the session and declares the exchange. Idempotent while
     * connected.
     */
    void connect();

    boolean isConnected();

    /**
     * Publishes a message. During an outage the message is buffered until the
     * connection is restored, unless retry is disabled.
     *
     * @throws NotConnectedException if the connection was never established,
     *                               is closed, or is down with retry disabled
     */
    void publish(Envelope envelope);

    default void publish(String topic, byte[] payload, Map<String, String> headers) {
        publish(Envelope.create(topic, payload, headers));
    }

    /**
     * Declares a queue bound with the pattern and consumes from it. The
     * declaration survives reconnection.
     *
     * @return the consumer id used to cancel
     * @throws NotConnectedException if the connection was never established
     */
    String declareConsumer(String queueName, String pattern, DeliveryHandler handler, ConsumerOptions options);

    default String declareConsumer(String queueName, String pattern, DeliveryHandler handler) {
        return declareConsumer(queueName, pattern, handler, ConsumerOptions.DURABLE);
    }

    /**
     * @return true if a consumer with the id was cancelled
     */
    boolean cancel(String consumerId);

    void addConnectionListener(ConnectionListener listener);

    @Override
    void close();
}
