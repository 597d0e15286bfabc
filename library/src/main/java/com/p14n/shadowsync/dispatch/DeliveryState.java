package com.p14n.shadowsync.dispatch;

/**
 * Where an inbound message ended up. {@code RECEIVED} and {@code ROUTED} are
 * transient; the dispatcher reports one of the others once the message has
 * been settled with the broker.
 */
public enum DeliveryState {
    RECEIVED,
    ROUTED,
    /** every matched subscriber handled it; acknowledged */
    DELIVERED,
    /** a subscriber failed; negatively acknowledged and requeued */
    FAILED,
    /** nothing matched or the payload could not be decoded; acknowledged */
    UNROUTABLE,
    /** failed on its final permitted delivery; moved to the dead-letter topic */
    DEAD_LETTERED,
    /**
     * a subscription channel had no room; returned to the queue without
     * counting the attempt
     */
    DEFERRED,
    /** nothing matched a topic registered as ignorable; acknowledged */
    IGNORED
}
