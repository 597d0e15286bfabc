package com.p14n.shadowsync.broker;

/**
 * Observes connection state changes of a {@link BrokerConnection}.
 */
public interface ConnectionListener {

    void onConnectionLost();

    default void onReconnected() {
    }
}
