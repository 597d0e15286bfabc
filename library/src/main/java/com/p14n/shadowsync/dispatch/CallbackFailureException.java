package com.p14n.shadowsync.dispatch;

/**
 * A matched subscriber failed to handle a message. Passed to the
 * subscriber's {@code onError}; the message is requeued.
 */
public class CallbackFailureException extends RuntimeException {

    private final String subscriptionId;
    private final String topic;

    public CallbackFailureException(String subscriptionId, String topic, Throwable cause) {
        super("Subscription " + subscriptionId + " failed handling " + topic, cause);
        this.subscriptionId = subscriptionId;
        this.topic = topic;
    }

    public String subscriptionId() {
        return subscriptionId;
    }

    public String topic() {
        return topic;
    }
}
