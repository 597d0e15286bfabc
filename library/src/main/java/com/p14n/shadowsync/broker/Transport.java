package com.p14n.shadowsync.broker;

import com.p14n.shadowsync.data.Envelope;
import com.p14n.shadowsync.topic.TopicPattern;

/**
 * The physical side of a broker connection: a topic exchange with queues
 * bound by pattern. Implementations report failures with
 * {@link TransportException} and signal an unexpected loss of the session
 * through the listener given to {@link #onConnectionLost(Runnable)}.
 */
public interface Transport extends AutoCloseable {

    /**
     * Opens the session and declares the exchange. Calling it on an open
     * transport has no effect.
     */
    void open(String exchangeName);

    boolean isOpen();

    void publish(Envelope envelope);

    /**
     * Declares a queue (or reuses an existing one with the same name), binds it
     * to the exchange with the pattern and attaches the handler as its only
     * consumer.
     */
    TransportBinding bind(String queueName, TopicPattern pattern, ConsumerOptions options, DeliveryHandler handler);

    void onConnectionLost(Runnable listener);

    @Override
    void close();
}
