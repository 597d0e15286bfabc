package com.p14n.shadowsync.broker;

/**
 * Queue declaration flags.
 *
 * @param exclusive  the queue belongs to this connection and is deleted when
 *                   the connection is lost
 * @param autoDelete the queue is deleted when its consumer is cancelled
 * @param prefetch   most unacknowledged deliveries the consumer holds at once,
 *                   0 for no limit
 */
public record ConsumerOptions(boolean exclusive, boolean autoDelete, int prefetch) {

    public static final ConsumerOptions DURABLE = new ConsumerOptions(false, false, 0);
    public static final ConsumerOptions EXCLUSIVE = new ConsumerOptions(true, true, 0);

    public ConsumerOptions {
        if (prefetch < 0) {
            throw new IllegalArgumentException("Prefetch cannot be negative");
        }
    }

    public ConsumerOptions(boolean exclusive, boolean autoDelete) {
        this(exclusive, autoDelete, 0);
    }

    public ConsumerOptions withPrefetch(int prefetch) {
        return new ConsumerOptions(exclusive, autoDelete, prefetch);
    }

    boolean limited() {
        return prefetch > 0;
    }
}
