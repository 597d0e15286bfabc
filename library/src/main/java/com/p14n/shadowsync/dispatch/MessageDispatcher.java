package com.p14n.shadowsync.dispatch;

import static com.p14n.shadowsync.telemetry.OpenTelemetryFunctions.processWithTelemetry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.shadowsync.broker.BrokerConnection;
import com.p14n.shadowsync.broker.Delivery;
import com.p14n.shadowsync.broker.DeliveryHandler;
import com.p14n.shadowsync.broker.NotConnectedException;
import com.p14n.shadowsync.data.Envelope;
import com.p14n.shadowsync.data.RoutedMessage;
import com.p14n.shadowsync.data.ShadowSyncConfig;
import com.p14n.shadowsync.subscription.ChannelFullException;
import com.p14n.shadowsync.subscription.Subscription;
import com.p14n.shadowsync.subscription.SubscriptionRegistry;
import com.p14n.shadowsync.telemetry.BrokerMetrics;
import com.p14n.shadowsync.topic.TopicPattern;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * Routes inbound deliveries to matching subscriptions and settles them with
 * the broker.
 *
 * <ul>
 * <li>undecodable payloads and messages no subscription matches are acked
 * and dropped ({@link DeliveryState#UNROUTABLE}); unmatched topics covered by
 * {@link #ignoreUnmatched(String)} are acked quietly
 * ({@link DeliveryState#IGNORED})</li>
 * <li>a message is acked once every matched subscriber handled it
 * ({@link DeliveryState#DELIVERED})</li>
 * <li>if any subscriber failed it is nacked and requeued
 * ({@link DeliveryState#FAILED}), unless this was its last permitted delivery,
 * in which case it is republished to the dead-letter topic and acked
 * ({@link DeliveryState#DEAD_LETTERED})</li>
 * <li>if the only failures were full subscription channels it is released
 * back to the queue without counting the attempt
 * ({@link DeliveryState#DEFERRED}); the subscriber never saw it</li>
 * </ul>
 */
public class MessageDispatcher implements DeliveryHandler {

    private static final Logger logger = LoggerFactory.getLogger(MessageDispatcher.class);

    public static final String ORIGINAL_TOPIC_HEADER = "x-original-topic";
    public static final String DELIVERY_COUNT_HEADER = "x-delivery-count";
    public static final String FAILURE_HEADER = "x-failure";

    private final SubscriptionRegistry registry;
    private final BrokerConnection connection;
    private final PayloadDecoder decoder = new PayloadDecoder();
    private final int maxDeliveries;
    private final String deadLetterPrefix;
    private final BrokerMetrics metrics;
    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final List<TopicPattern> ignoredWhenUnmatched = new CopyOnWriteArrayList<>();

    public MessageDispatcher(SubscriptionRegistry registry, BrokerConnection connection, ShadowSyncConfig config,
            OpenTelemetry ot) {
        this(registry, connection, config.maxDeliveries(), config.deadLetterPrefix(), ot);
    }

    public MessageDispatcher(SubscriptionRegistry registry, BrokerConnection connection, int maxDeliveries,
            String deadLetterPrefix, OpenTelemetry ot) {
        if (maxDeliveries < 1) {
            throw new IllegalArgumentException("Max deliveries must be at least 1");
        }
        this.registry = registry;
        this.connection = connection;
        this.maxDeliveries = maxDeliveries;
        this.deadLetterPrefix = deadLetterPrefix;
        this.metrics = new BrokerMetrics(ot.getMeter("shadowsync-dispatch"));
        this.tracer = ot.getTracer("shadowsync-dispatch");
        this.openTelemetry = ot;
    }

    /**
     * Acks messages on matching topics quietly when no subscription wants
     * them, for traffic the consumer sees by design such as its own
     * publications.
     */
    public void ignoreUnmatched(String pattern) {
        ignoredWhenUnmatched.add(TopicPattern.of(pattern));
    }

    @Override
    public void onDelivery(Delivery delivery) {
        dispatch(delivery);
    }

    /**
     * Dispatches one delivery.
     *
     * @return the final state, completed once the delivery has been settled
     */
    public CompletableFuture<DeliveryState> dispatch(Delivery delivery) {
        Envelope envelope = delivery.envelope();
        return processWithTelemetry(openTelemetry, tracer, envelope, "dispatch_message", () -> {
            JsonNode payload;
            try {
                payload = decoder.decode(envelope);
            } catch (MalformedMessageException e) {
                logger.atWarn().addArgument(envelope.topic()).addArgument(envelope.messageId())
                        .addArgument(e.getMessage())
                        .log("Discarding malformed message on {} id {}: {}");
                return CompletableFuture.completedFuture(unroutable(delivery));
            }

            List<Subscription> matched = registry.resolve(envelope.topic());
            if (matched.isEmpty() && ignored(envelope.topic())) {
                logger.atDebug().addArgument(envelope.topic()).addArgument(envelope.messageId())
                        .log("Nothing subscribed to {}, acking id {}");
                delivery.ack();
                metrics.recordAcked(envelope.topic());
                return CompletableFuture.completedFuture(DeliveryState.IGNORED);
            }
            if (matched.isEmpty()) {
                logger.atWarn().addArgument(envelope.topic()).addArgument(envelope.messageId())
                        .log("No subscription matches {}, discarding id {}");
                return CompletableFuture.completedFuture(unroutable(delivery));
            }

            logger.atDebug().addArgument(envelope.topic()).addArgument(matched.size())
                    .addArgument(envelope.deliveryCount())
                    .log("Routing {} to {} subscriptions (delivery {})");
            RoutedMessage routed = new RoutedMessage(envelope, payload);
            List<CompletableFuture<Void>> results = new ArrayList<>(matched.size());
            for (Subscription subscription : matched) {
                results.add(deliver(subscription, routed));
            }
            return CompletableFuture.allOf(results.toArray(new CompletableFuture[0]))
                    .handle((ignored, error) -> settle(delivery, results));
        });
    }

    private boolean ignored(String topic) {
        for (TopicPattern pattern : ignoredWhenUnmatched) {
            if (pattern.matches(topic)) {
                return true;
            }
        }
        return false;
    }

    private DeliveryState unroutable(Delivery delivery) {
        String topic = delivery.envelope().topic();
        metrics.recordUnroutable(topic);
        delivery.ack();
        metrics.recordAcked(topic);
        return DeliveryState.UNROUTABLE;
    }

    private CompletableFuture<Void> deliver(Subscription subscription, RoutedMessage routed) {
        metrics.recordDelivered(routed.topic());
        return subscription.channel().offer(routed).whenComplete((ignored, error) -> {
            if (error == null) {
                if (subscription.oneShot()) {
                    registry.unregister(subscription.id());
                }
                return;
            }
            if (unwrap(error) instanceof ChannelFullException) {
                logger.atDebug().addArgument(subscription.id()).addArgument(routed.topic())
                        .log("Subscription {} is full, deferring {}");
                return;
            }
            CallbackFailureException failure = new CallbackFailureException(subscription.id(), routed.topic(),
                    unwrap(error));
            logger.atError().setCause(failure.getCause()).addArgument(subscription.id())
                    .addArgument(routed.topic())
                    .log("Subscription {} failed handling {}");
            try {
                subscription.subscriber().onError(failure);
            } catch (RuntimeException e) {
                logger.atError().setCause(e).addArgument(subscription.id())
                        .log("Error handler of subscription {} failed");
            }
        });
    }

    private DeliveryState settle(Delivery delivery, List<CompletableFuture<Void>> results) {
        Envelope envelope = delivery.envelope();
        Throwable firstFailure = null;
        boolean deferred = false;
        for (CompletableFuture<Void> result : results) {
            if (result.isCompletedExceptionally()) {
                Throwable failure = unwrap(result.handle((v, e) -> e).join());
                if (failure instanceof ChannelFullException) {
                    deferred = true;
                } else if (firstFailure == null) {
                    firstFailure = failure;
                }
            }
        }
        if (firstFailure == null && !deferred) {
            delivery.ack();
            metrics.recordAcked(envelope.topic());
            return DeliveryState.DELIVERED;
        }
        if (firstFailure == null) {
            delivery.release();
            metrics.recordDeferred(envelope.topic());
            logger.atDebug().addArgument(envelope.messageId()).addArgument(envelope.topic())
                    .log("Released {} on {} until its subscriptions have room");
            return DeliveryState.DEFERRED;
        }
        if (envelope.deliveryCount() >= maxDeliveries) {
            return deadLetter(delivery, firstFailure);
        }
        delivery.nack(true);
        metrics.recordNacked(envelope.topic());
        logger.atDebug().addArgument(envelope.messageId()).addArgument(envelope.deliveryCount())
                .log("Requeued {} after delivery {}");
        return DeliveryState.FAILED;
    }

    private DeliveryState deadLetter(Delivery delivery, Throwable failure) {
        Envelope envelope = delivery.envelope();
        String target = deadLetterPrefix + "." + envelope.topic();
        Map<String, String> headers = new HashMap<>(envelope.headers());
        headers.put(ORIGINAL_TOPIC_HEADER, envelope.topic());
        headers.put(DELIVERY_COUNT_HEADER, Integer.toString(envelope.deliveryCount()));
        headers.put(FAILURE_HEADER, String.valueOf(failure.getMessage()));
        Envelope deadLetter = new Envelope(envelope.messageId(), envelope.correlationId(), target,
                envelope.contentType(), headers, envelope.body(), envelope.timestamp(), 0, false,
                envelope.traceparent());
        try {
            connection.publish(deadLetter);
        } catch (NotConnectedException e) {
            logger.atError().setCause(e).addArgument(envelope.messageId())
                    .log("Unable to dead-letter {}, requeueing");
            delivery.nack(true);
            metrics.recordNacked(envelope.topic());
            return DeliveryState.FAILED;
        }
        delivery.ack();
        metrics.recordAcked(envelope.topic());
        metrics.recordDeadLettered(envelope.topic());
        logger.atError().addArgument(envelope.messageId()).addArgument(envelope.topic())
                .addArgument(envelope.deliveryCount()).addArgument(target)
                .log("Message {} on {} failed {} deliveries, moved to {}");
        return DeliveryState.DEAD_LETTERED;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
