package com.p14n.shadowsync.subscription;

import java.util.concurrent.RejectedExecutionException;

/**
 * A subscription channel had no room for another message. The message was
 * never handed to the subscriber.
 */
public class ChannelFullException extends RejectedExecutionException {

    private final String subscriptionId;

    public ChannelFullException(String subscriptionId) {
        super("Channel for subscription " + subscriptionId + " is full");
        this.subscriptionId = subscriptionId;
    }

    public String subscriptionId() {
        return subscriptionId;
    }
}
