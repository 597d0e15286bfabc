package com.p14n.shadowsync.subscription;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.shadowsync.broker.AsyncExecutor;
import com.p14n.shadowsync.data.RoutedMessage;

/**
 * Bounded task queues in front of one subscriber. Messages are handed to the
 * subscriber on the executor; the transport thread that offered them never
 * runs subscriber code.
 *
 * <p>
 * With one lane every message is handled one at a time in offer order. With
 * several, a message goes to the lane its ordering key hashes to; each lane
 * drains on its own, in order, so messages with different keys do not wait
 * for each other.
 * </p>
 */
public class SubscriptionChannel {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionChannel.class);

    private record Work(RoutedMessage message, CompletableFuture<Void> result) {
    }

    private final String subscriptionId;
    private final MessageSubscriber<RoutedMessage> subscriber;
    private final AsyncExecutor executor;
    private final Function<RoutedMessage, String> orderingKey;
    private final Lane[] lanes;
    private volatile boolean closed;

    /**
     * @param capacity    messages each lane can hold
     * @param lanes       number of lanes
     * @param orderingKey lane selector, may be null with one lane
     */
    public SubscriptionChannel(String subscriptionId, MessageSubscriber<RoutedMessage> subscriber,
            AsyncExecutor executor, int capacity, int lanes, Function<RoutedMessage, String> orderingKey) {
        if (lanes < 1) {
            throw new IllegalArgumentException("Lanes must be at least 1");
        }
        this.subscriptionId = subscriptionId;
        this.subscriber = subscriber;
        this.executor = executor;
        this.orderingKey = orderingKey;
        this.lanes = new Lane[lanes];
        for (int i = 0; i < lanes; i++) {
            this.lanes[i] = new Lane(i, capacity);
        }
    }

    /**
     * Queues a message for the subscriber.
     *
     * @return completes when the subscriber has handled the message, or
     *         exceptionally with what it threw; fails immediately with
     *         {@link ChannelFullException} when the message's lane is full or
     *         {@link RejectedExecutionException} when the channel is closed
     */
    public CompletableFuture<Void> offer(RoutedMessage message) {
        if (closed) {
            return CompletableFuture.failedFuture(
                    new RejectedExecutionException("Subscription " + subscriptionId + " is closed"));
        }
        Lane lane = laneFor(message);
        Work work = new Work(message, new CompletableFuture<>());
        if (!lane.queue.offer(work)) {
            return CompletableFuture.failedFuture(new ChannelFullException(subscriptionId));
        }
        lane.scheduleDrain();
        return work.result();
    }

    public int pending() {
        int pending = 0;
        for (Lane lane : lanes) {
            pending += lane.queue.size();
        }
        return pending;
    }

    public int lanes() {
        return lanes.length;
    }

    private Lane laneFor(RoutedMessage message) {
        if (lanes.length == 1) {
            return lanes[0];
        }
        String key = orderingKey.apply(message);
        return lanes[Math.floorMod(key == null ? 0 : key.hashCode(), lanes.length)];
    }

    void close() {
        closed = true;
        RejectedExecutionException cause = new RejectedExecutionException(
                "Subscription " + subscriptionId + " is closed");
        for (Lane lane : lanes) {
            lane.failPending(cause);
        }
    }

    private final class Lane {
        final int index;
        final BlockingQueue<Work> queue;
        final AtomicBoolean draining = new AtomicBoolean();

        Lane(int index, int capacity) {
            this.index = index;
            this.queue = new ArrayBlockingQueue<>(capacity);
        }

        void scheduleDrain() {
            if (draining.compareAndSet(false, true)) {
                try {
                    executor.submit(() -> {
                        drain();
                        return null;
                    });
                } catch (RejectedExecutionException e) {
                    draining.set(false);
                    logger.atError().setCause(e).addArgument(index).addArgument(subscriptionId)
                            .log("Executor rejected drain of lane {} for subscription {}");
                    failPending(e);
                }
            }
        }

        void drain() {
            try {
                Work work;
                while (!closed && (work = queue.poll()) != null) {
                    run(work);
                }
            } finally {
                draining.set(false);
            }
            if (!closed && !queue.isEmpty()) {
                scheduleDrain();
            }
        }

        void failPending(Exception cause) {
            Work work;
            while ((work = queue.poll()) != null) {
                work.result().completeExceptionally(cause);
            }
        }
    }

    private void run(Work work) {
        try {
            subscriber.onMessage(work.message());
            work.result().complete(null);
        } catch (RuntimeException e) {
            work.result().completeExceptionally(e);
        } finally {
            if (!work.result().isDone()) {
                work.result().completeExceptionally(
                        new IllegalStateException("Subscriber " + subscriptionId + " failed abnormally"));
            }
        }
    }
}
