package com.p14n.shadowsync.broker;

import com.p14n.shadowsync.data.Envelope;

/**
 * A message handed to a consumer. Exactly one of {@link #ack()},
 * {@link #nack(boolean)} or {@link #release()} should be called; later calls
 * are ignored.
 */
public interface Delivery {

    Envelope envelope();

    void ack();

    /**
     * @param requeue return the message to its queue for redelivery, otherwise
     *                discard it
     */
    void nack(boolean requeue);

    /**
     * Returns the message to its queue without counting this attempt against
     * its delivery count. For consumers that could not take the message yet.
     */
    default void release() {
        nack(true);
    }
}
