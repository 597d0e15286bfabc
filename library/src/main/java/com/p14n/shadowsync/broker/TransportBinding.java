package com.p14n.shadowsync.broker;

/**
 * A consumer attached to a queue by a {@link Transport}.
 */
@FunctionalInterface
public interface TransportBinding {

    void cancel();
}
