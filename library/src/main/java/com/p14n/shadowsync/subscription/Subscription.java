package com.p14n.shadowsync.subscription;

import com.p14n.shadowsync.data.RoutedMessage;
import com.p14n.shadowsync.topic.TopicPattern;

public record Subscription(String id,
        TopicPattern pattern,
        MessageSubscriber<RoutedMessage> subscriber,
        SubscriptionOptions options,
        SubscriptionChannel channel) {

    public boolean exclusive() {
        return options.exclusive();
    }

    public boolean oneShot() {
        return options.oneShot();
    }
}
