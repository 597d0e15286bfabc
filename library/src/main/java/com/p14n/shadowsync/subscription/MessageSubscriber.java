package com.p14n.shadowsync.subscription;

/**
 * Interface for message subscribers that can receive messages and error
 * notifications.
 *
 * @param <T> The type of messages this subscriber handles
 */
public interface MessageSubscriber<T> {

    /**
     * Called when a new message is available for processing. Throwing marks
     * the delivery as failed and the message will be redelivered.
     *
     * @param message The message to process
     */
    void onMessage(T message);

    /**
     * Called after {@link #onMessage} failed for a message.
     *
     * @param error The error that occurred
     */
    default void onError(Throwable error) {
    }
}
