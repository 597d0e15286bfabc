package com.p14n.shadowsync.subscription;

import java.util.function.Function;

import com.p14n.shadowsync.data.RoutedMessage;

/**
 * @param exclusive   the subscription is dropped when the broker connection is
 *                    lost
 * @param oneShot     the subscription is removed after its first successful
 *                    delivery
 * @param lanes       number of independent queues in front of the subscriber;
 *                    messages in different lanes are handled concurrently
 * @param orderingKey picks the lane of a message; messages with the same key
 *                    stay in offer order. Null when there is a single lane
 */
public record SubscriptionOptions(boolean exclusive, boolean oneShot, int lanes,
        Function<RoutedMessage, String> orderingKey) {

    public static final SubscriptionOptions DEFAULT = new SubscriptionOptions(false, false);
    public static final SubscriptionOptions EXCLUSIVE = new SubscriptionOptions(true, false);
    public static final SubscriptionOptions ONE_SHOT = new SubscriptionOptions(false, true);

    public SubscriptionOptions {
        if (lanes < 1) {
            throw new IllegalArgumentException("Lanes must be at least 1");
        }
        if (lanes > 1 && orderingKey == null) {
            throw new IllegalArgumentException("Several lanes need an ordering key");
        }
    }

    public SubscriptionOptions(boolean exclusive, boolean oneShot) {
        this(exclusive, oneShot, 1, null);
    }

    /**
     * Spreads messages over {@code lanes} queues by key, so a slow message
     * only holds up others with the same key.
     */
    public static SubscriptionOptions ordered(int lanes, Function<RoutedMessage, String> orderingKey) {
        return DEFAULT.withLanes(lanes, orderingKey);
    }

    public SubscriptionOptions withLanes(int lanes, Function<RoutedMessage, String> orderingKey) {
        return new SubscriptionOptions(exclusive, oneShot, lanes, orderingKey);
    }
}
