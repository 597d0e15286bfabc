package com.p14n.shadowsync.subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.shadowsync.broker.AsyncExecutor;
import com.p14n.shadowsync.data.RoutedMessage;
import com.p14n.shadowsync.telemetry.BrokerMetrics;
import com.p14n.shadowsync.topic.TopicPattern;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Active subscriptions keyed by id.
 *
 * <p>
 * Readers work on an immutable snapshot list that writers replace on every
 * change, so {@link #resolve(String)} never blocks and never sees a
 * half-applied registration. Writers serialize among themselves only.
 * </p>
 */
public class SubscriptionRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final AsyncExecutor executor;
    private final int channelCapacity;
    private final BrokerMetrics metrics;
    private final Object writeLock = new Object();
    private final AtomicLong sequence = new AtomicLong();
    private volatile List<Subscription> snapshot = List.of();

    public SubscriptionRegistry(AsyncExecutor executor, int channelCapacity, OpenTelemetry ot) {
        if (channelCapacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be at least 1");
        }
        this.executor = executor;
        this.channelCapacity = channelCapacity;
        this.metrics = new BrokerMetrics(ot.getMeter("shadowsync-subscriptions"));
    }

    public String register(String pattern, MessageSubscriber<RoutedMessage> subscriber) {
        return register(pattern, subscriber, SubscriptionOptions.DEFAULT);
    }

    /**
     * Registers a subscriber for every topic matching the pattern.
     *
     * @return the subscription id
     * @throws IllegalArgumentException if the pattern is invalid or the
     *                                  subscriber is null
     */
    public String register(String pattern, MessageSubscriber<RoutedMessage> subscriber,
            SubscriptionOptions options) {
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        TopicPattern topicPattern = TopicPattern.of(pattern);
        String id = "sub-" + sequence.incrementAndGet();
        SubscriptionOptions opts = options == null ? SubscriptionOptions.DEFAULT : options;
        Subscription subscription = new Subscription(id, topicPattern, subscriber, opts,
                new SubscriptionChannel(id, subscriber, executor, channelCapacity, opts.lanes(),
                        opts.orderingKey()));
        synchronized (writeLock) {
            List<Subscription> next = new ArrayList<>(snapshot);
            next.add(subscription);
            snapshot = List.copyOf(next);
        }
        metrics.recordSubscriptionAdded(topicPattern.raw());
        logger.atDebug().addArgument(id).addArgument(topicPattern).log("Registered subscription {} on {}");
        return id;
    }

    /**
     * @return true if a subscription was removed
     */
    public boolean unregister(String subscriptionId) {
        return removeWhere(s -> s.id().equals(subscriptionId)) > 0;
    }

    /**
     * Removes the subscriptions that do not survive a connection loss.
     *
     * @return the number removed
     */
    public int removeExclusive() {
        int removed = removeWhere(Subscription::exclusive);
        if (removed > 0) {
            logger.atInfo().addArgument(removed).log("Removed {} exclusive subscriptions after connection loss");
        }
        return removed;
    }

    /**
     * Matching subscriptions in registration order.
     */
    public List<Subscription> resolve(String topic) {
        List<Subscription> current = snapshot;
        List<Subscription> matched = new ArrayList<>();
        for (Subscription subscription : current) {
            if (subscription.pattern().matches(topic)) {
                matched.add(subscription);
            }
        }
        return matched;
    }

    public Optional<Subscription> get(String subscriptionId) {
        return snapshot.stream().filter(s -> s.id().equals(subscriptionId)).findFirst();
    }

    public int size() {
        return snapshot.size();
    }

    private int removeWhere(Predicate<Subscription> predicate) {
        List<Subscription> removed = new ArrayList<>();
        synchronized (writeLock) {
            List<Subscription> next = new ArrayList<>(snapshot.size());
            for (Subscription subscription : snapshot) {
                if (predicate.test(subscription)) {
                    removed.add(subscription);
                } else {
                    next.add(subscription);
                }
            }
            if (removed.isEmpty()) {
                return 0;
            }
            snapshot = List.copyOf(next);
        }
        for (Subscription subscription : removed) {
            subscription.channel().close();
            metrics.recordSubscriptionRemoved(subscription.pattern().raw());
            logger.atDebug().addArgument(subscription.id()).log("Removed subscription {}");
        }
        return removed.size();
    }

    @Override
    public void close() {
        removeWhere(s -> true);
    }
}
