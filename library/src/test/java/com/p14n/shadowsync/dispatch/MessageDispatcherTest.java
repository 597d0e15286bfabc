package com.p14n.shadowsync.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.p14n.shadowsync.broker.Delivery;
import com.p14n.shadowsync.broker.RecordingBrokerConnection;
import com.p14n.shadowsync.broker.TestAsyncExecutor;
import com.p14n.shadowsync.data.Envelope;
import com.p14n.shadowsync.data.RoutedMessage;
import com.p14n.shadowsync.subscription.MessageSubscriber;
import com.p14n.shadowsync.subscription.SubscriptionOptions;
import com.p14n.shadowsync.subscription.SubscriptionRegistry;

import io.opentelemetry.api.OpenTelemetry;

class MessageDispatcherTest {

    private static final String TOPIC = "devices.wh-1.shadow.reported";

    private final Random random = new Random(11);
    private TestAsyncExecutor executor;
    private SubscriptionRegistry registry;
    private RecordingBrokerConnection connection;
    private MessageDispatcher dispatcher;

    private static class FakeDelivery implements Delivery {
        private final Envelope envelope;
        int acks;
        int nacks;
        int releases;
        Boolean requeued;

        FakeDelivery(Envelope envelope) {
            this.envelope = envelope;
        }

        @Override
        public Envelope envelope() {
            return envelope;
        }

        @Override
        public void ack() {
            acks++;
        }

        @Override
        public void nack(boolean requeue) {
            nacks++;
            requeued = requeue;
        }

        @Override
        public void release() {
            releases++;
        }
    }

    @BeforeEach
    void setUp() {
        executor = new TestAsyncExecutor();
        registry = new SubscriptionRegistry(executor, 8, OpenTelemetry.noop());
        connection = new RecordingBrokerConnection();
        dispatcher = new MessageDispatcher(registry, connection, 3, "deadletter", OpenTelemetry.noop());
    }

    private static FakeDelivery delivery(String topic, String contentType, String body, int deliveryCount) {
        return new FakeDelivery(new Envelope("m-1", null, topic, contentType, Map.of("h", "v"),
                body.getBytes(StandardCharsets.UTF_8), 100L, deliveryCount, deliveryCount > 1, null));
    }

    private DeliveryState run(FakeDelivery delivery) throws Exception {
        CompletableFuture<DeliveryState> result = dispatcher.dispatch(delivery);
        executor.runPending(random);
        assertTrue(result.isDone());
        return result.get();
    }

    @Test
    void deliversToEveryMatchingSubscriptionThenAcks() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        registry.register("devices.#", m -> seen.add("all:" + m.payload().get("temperature").asInt()));
        registry.register("devices.*.shadow.reported", m -> seen.add("reported:" + m.topic()));
        registry.register("devices.*.shadow.desired", m -> seen.add("desired"));

        FakeDelivery delivery = delivery(TOPIC, Envelope.APPLICATION_JSON, "{\"temperature\":125}", 1);

        assertEquals(DeliveryState.DELIVERED, run(delivery));
        assertEquals(1, delivery.acks);
        assertEquals(0, delivery.nacks);
        assertEquals(2, seen.size());
        assertTrue(seen.contains("all:125"));
        assertTrue(seen.contains("reported:" + TOPIC));
    }

    @Test
    void unmatchedMessageIsAckedAsUnroutable() throws Exception {
        registry.register("other.#", m -> fail("should not be called"));
        FakeDelivery delivery = delivery(TOPIC, Envelope.APPLICATION_JSON, "{}", 1);

        assertEquals(DeliveryState.UNROUTABLE, run(delivery));
        assertEquals(1, delivery.acks);
    }

    @Test
    void malformedJsonIsDiscarded() throws Exception {
        registry.register("#", m -> fail("should not be called"));
        FakeDelivery broken = delivery(TOPIC, Envelope.APPLICATION_JSON, "{\"temperature\":", 1);
        FakeDelivery trailing = delivery(TOPIC, Envelope.APPLICATION_JSON, "{} {}", 1);
        FakeDelivery empty = delivery(TOPIC, Envelope.APPLICATION_JSON, "", 1);

        assertEquals(DeliveryState.UNROUTABLE, run(broken));
        assertEquals(DeliveryState.UNROUTABLE, run(trailing));
        assertEquals(DeliveryState.UNROUTABLE, run(empty));
        assertEquals(1, broken.acks);
        assertEquals(0, broken.nacks);
    }

    @Test
    void unsupportedContentTypeIsDiscarded() throws Exception {
        registry.register("#", m -> fail("should not be called"));
        FakeDelivery delivery = delivery(TOPIC, "application/octet-stream", "abc", 1);

        assertEquals(DeliveryState.UNROUTABLE, run(delivery));
        assertEquals(1, delivery.acks);
    }

    @Test
    void plainTextAndJsonVariantsAreDecoded() throws Exception {
        List<RoutedMessage> seen = new CopyOnWriteArrayList<>();
        registry.register("#", seen::add);

        assertEquals(DeliveryState.DELIVERED, run(delivery(TOPIC, "text/plain; charset=utf-8", "hello", 1)));
        assertEquals(DeliveryState.DELIVERED, run(delivery(TOPIC, "application/vnd.shadow+json", "[1,2]", 1)));
        assertEquals(DeliveryState.DELIVERED, run(delivery(TOPIC, null, "true", 1)));

        assertEquals("hello", seen.get(0).payload().asText());
        assertTrue(seen.get(1).payload().isArray());
        assertTrue(seen.get(2).payload().asBoolean());
    }

    @Test
    void failureNacksForRedeliveryAndReportsTheError() throws Exception {
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        List<String> succeeded = new CopyOnWriteArrayList<>();
        registry.register("#", new MessageSubscriber<RoutedMessage>() {
            @Override
            public void onMessage(RoutedMessage message) {
                throw new IllegalStateException("store unavailable");
            }

            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }
        });
        registry.register("#", m -> succeeded.add(m.topic()));

        FakeDelivery delivery = delivery(TOPIC, Envelope.APPLICATION_JSON, "{}", 1);

        assertEquals(DeliveryState.FAILED, run(delivery));
        assertEquals(0, delivery.acks);
        assertEquals(1, delivery.nacks);
        assertTrue(delivery.requeued);
        assertEquals(List.of(TOPIC), succeeded);

        assertEquals(1, errors.size());
        CallbackFailureException failure = assertInstanceOf(CallbackFailureException.class, errors.get(0));
        assertEquals(TOPIC, failure.topic());
        assertEquals("store unavailable", failure.getCause().getMessage());
        assertTrue(connection.published.isEmpty());
    }

    @Test
    void lastPermittedDeliveryIsDeadLettered() throws Exception {
        registry.register("#", m -> {
            throw new IllegalStateException("poison");
        });
        FakeDelivery delivery = delivery(TOPIC, Envelope.APPLICATION_JSON, "{\"a\":1}", 3);

        assertEquals(DeliveryState.DEAD_LETTERED, run(delivery));
        assertEquals(1, delivery.acks);
        assertEquals(0, delivery.nacks);

        assertEquals(1, connection.published.size());
        Envelope deadLetter = connection.published.get(0);
        assertEquals("deadletter." + TOPIC, deadLetter.topic());
        assertEquals(TOPIC, deadLetter.header(MessageDispatcher.ORIGINAL_TOPIC_HEADER));
        assertEquals("3", deadLetter.header(MessageDispatcher.DELIVERY_COUNT_HEADER));
        assertEquals("poison", deadLetter.header(MessageDispatcher.FAILURE_HEADER));
        assertEquals("v", deadLetter.header("h"));
        assertEquals("{\"a\":1}", deadLetter.bodyAsString());
        assertEquals(0, deadLetter.deliveryCount());
    }

    @Test
    void deadLetterFailureFallsBackToRequeue() throws Exception {
        registry.register("#", m -> {
            throw new IllegalStateException("poison");
        });
        connection.failPublishes = true;
        FakeDelivery delivery = delivery(TOPIC, Envelope.APPLICATION_JSON, "{}", 3);

        assertEquals(DeliveryState.FAILED, run(delivery));
        assertEquals(0, delivery.acks);
        assertTrue(delivery.requeued);
    }

    @Test
    void oneShotSubscriptionIsRemovedAfterSuccess() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        registry.register("#", m -> seen.add(m.topic()), SubscriptionOptions.ONE_SHOT);

        assertEquals(DeliveryState.DELIVERED, run(delivery(TOPIC, Envelope.APPLICATION_JSON, "{}", 1)));
        assertEquals(0, registry.size());
        assertEquals(DeliveryState.UNROUTABLE, run(delivery(TOPIC, Envelope.APPLICATION_JSON, "{}", 1)));
        assertEquals(1, seen.size());
    }

    @Test
    void oneShotSubscriptionSurvivesFailure() throws Exception {
        registry.register("#", m -> {
            throw new IllegalStateException("not yet");
        }, SubscriptionOptions.ONE_SHOT);

        assertEquals(DeliveryState.FAILED, run(delivery(TOPIC, Envelope.APPLICATION_JSON, "{}", 1)));
        assertEquals(1, registry.size());
    }

    @Test
    void fullChannelDefersWithoutCountingTheAttempt() throws Exception {
        SubscriptionRegistry small = new SubscriptionRegistry(executor, 1, OpenTelemetry.noop());
        MessageDispatcher smallDispatcher = new MessageDispatcher(small, connection, 3, "deadletter",
                OpenTelemetry.noop());
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        List<String> seen = new CopyOnWriteArrayList<>();
        String id = small.register("#", new MessageSubscriber<RoutedMessage>() {
            @Override
            public void onMessage(RoutedMessage message) {
                seen.add(message.envelope().messageId());
            }

            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }
        });
        small.get(id).orElseThrow().channel()
                .offer(new RoutedMessage(Envelope.json(TOPIC, "{}", 1L), null));

        FakeDelivery lastAttempt = delivery(TOPIC, Envelope.APPLICATION_JSON, "{}", 3);
        CompletableFuture<DeliveryState> result = smallDispatcher.dispatch(lastAttempt);
        executor.runPending(random);

        assertEquals(DeliveryState.DEFERRED, result.get());
        assertEquals(1, lastAttempt.releases);
        assertEquals(0, lastAttempt.acks);
        assertEquals(0, lastAttempt.nacks);
        assertTrue(errors.isEmpty());
        assertTrue(connection.published.isEmpty());
        assertEquals(1, seen.size());
    }

    @Test
    void realFailureWinsOverFullChannel() throws Exception {
        SubscriptionRegistry small = new SubscriptionRegistry(executor, 1, OpenTelemetry.noop());
        MessageDispatcher smallDispatcher = new MessageDispatcher(small, connection, 3, "deadletter",
                OpenTelemetry.noop());
        String full = small.register("#", m -> {
        });
        small.register("#", m -> {
            throw new IllegalStateException("broken");
        });
        small.get(full).orElseThrow().channel()
                .offer(new RoutedMessage(Envelope.json(TOPIC, "{}", 1L), null));

        CompletableFuture<DeliveryState> result = smallDispatcher
                .dispatch(delivery(TOPIC, Envelope.APPLICATION_JSON, "{}", 1));
        executor.runPending(random);

        assertEquals(DeliveryState.FAILED, result.get());
    }

    @Test
    void ignoredTopicWithoutSubscriberIsAckedQuietly() throws Exception {
        dispatcher.ignoreUnmatched("devices.*.shadow.update");
        registry.register("devices.*.shadow.reported", m -> {
        });

        FakeDelivery echo = delivery("devices.wh-1.shadow.update", Envelope.APPLICATION_JSON, "{}", 1);
        FakeDelivery stray = delivery("devices.wh-1.other", Envelope.APPLICATION_JSON, "{}", 1);

        assertEquals(DeliveryState.IGNORED, run(echo));
        assertEquals(1, echo.acks);
        assertEquals(DeliveryState.UNROUTABLE, run(stray));
    }

    @Test
    void ignoredTopicStillReachesItsSubscribers() throws Exception {
        dispatcher.ignoreUnmatched("devices.*.shadow.update");
        List<String> seen = new CopyOnWriteArrayList<>();
        registry.register("devices.#", m -> seen.add(m.topic()));

        assertEquals(DeliveryState.DELIVERED,
                run(delivery("devices.wh-1.shadow.update", Envelope.APPLICATION_JSON, "{}", 1)));
        assertEquals(List.of("devices.wh-1.shadow.update"), seen);
    }

    @Test
    void rejectsZeroMaxDeliveries() {
        assertThrows(IllegalArgumentException.class,
                () -> new MessageDispatcher(registry, connection, 0, "deadletter", OpenTelemetry.noop()));
    }
}
