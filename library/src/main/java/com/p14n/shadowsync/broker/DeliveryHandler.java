package com.p14n.shadowsync.broker;

@FunctionalInterface
public interface DeliveryHandler {

    /**
     * Called on a transport thread for every message routed to the consumer.
     * Implementations should hand work off rather than block.
     */
    void onDelivery(Delivery delivery);
}
