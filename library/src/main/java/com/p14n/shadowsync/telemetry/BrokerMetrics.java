package com.p14n.shadowsync.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetry instruments for the broker connection and the dispatcher.
 *
 * <ul>
 * <li>messages_published: messages handed to the transport, per topic</li>
 * <li>messages_delivered: messages handed to a subscriber, per topic</li>
 * <li>messages_acked / messages_nacked: dispatch outcomes, per topic</li>
 * <li>messages_unroutable: messages no subscription matched, per topic</li>
 * <li>messages_dead_lettered: messages moved to the dead-letter topic</li>
 * <li>messages_deferred: messages returned to the queue because a
 * subscription channel was full, per topic</li>
 * <li>active_subscriptions: registered subscriptions, per pattern</li>
 * <li>reconnect_attempts: failed and successful reconnect attempts</li>
 * </ul>
 */
public class BrokerMetrics {

        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");
        private static final AttributeKey<String> PATTERN = AttributeKey.stringKey("pattern");
        private static final AttributeKey<String> OUTCOME = AttributeKey.stringKey("outcome");

        private final LongCounter publishedMessages;
        private final LongCounter deliveredMessages;
        private final LongCounter ackedMessages;
        private final LongCounter nackedMessages;
        private final LongCounter unroutableMessages;
        private final LongCounter deadLetteredMessages;
        private final LongCounter deferredMessages;
        private final LongUpDownCounter activeSubscriptions;
        private final LongCounter reconnectAttempts;

        public BrokerMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages published")
                                .build();

                deliveredMessages = meter.counterBuilder("messages_delivered")
                                .setDescription("Number of messages delivered to subscribers")
                                .build();

                ackedMessages = meter.counterBuilder("messages_acked")
                                .setDescription("Number of messages acknowledged")
                                .build();

                nackedMessages = meter.counterBuilder("messages_nacked")
                                .setDescription("Number of messages negatively acknowledged")
                                .build();

                unroutableMessages = meter.counterBuilder("messages_unroutable")
                                .setDescription("Number of messages with no matching subscription")
                                .build();

                deadLetteredMessages = meter.counterBuilder("messages_dead_lettered")
                                .setDescription("Number of messages moved to a dead-letter topic")
                                .build();

                deferredMessages = meter.counterBuilder("messages_deferred")
                                .setDescription("Number of messages requeued because a subscription channel was full")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of active subscriptions")
                                .build();

                reconnectAttempts = meter.counterBuilder("reconnect_attempts")
                                .setDescription("Number of broker reconnect attempts")
                                .build();
        }

        public void recordPublished(String topic) {
                publishedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDelivered(String topic) {
                deliveredMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordAcked(String topic) {
                ackedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordNacked(String topic) {
                nackedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordUnroutable(String topic) {
                unroutableMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDeadLettered(String topic) {
                deadLetteredMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDeferred(String topic) {
                deferredMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriptionAdded(String pattern) {
                activeSubscriptions.add(1, Attributes.of(PATTERN, pattern));
        }

        public void recordSubscriptionRemoved(String pattern) {
                activeSubscriptions.add(-1, Attributes.of(PATTERN, pattern));
        }

        /**
         * Records a reconnect attempt.
         *
         * @param succeeded whether the transport was reopened
         */
        public void recordReconnectAttempt(boolean succeeded) {
                reconnectAttempts.add(1, Attributes.of(OUTCOME, succeeded ? "success" : "failure"));
        }
}
