package com.p14n.shadowsync.subscription;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.fasterxml.jackson.databind.node.IntNode;
import com.p14n.shadowsync.broker.DefaultExecutor;
import com.p14n.shadowsync.broker.TestAsyncExecutor;
import com.p14n.shadowsync.data.Envelope;
import com.p14n.shadowsync.data.RoutedMessage;

import io.opentelemetry.api.OpenTelemetry;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class SubscriptionRegistryTest {

    private final Random random = new Random(3);
    private TestAsyncExecutor executor;
    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        executor = new TestAsyncExecutor();
        registry = new SubscriptionRegistry(executor, 4, OpenTelemetry.noop());
    }

    private static RoutedMessage message(String topic, int value) {
        return new RoutedMessage(Envelope.json(topic, Integer.toString(value), 1L), IntNode.valueOf(value));
    }

    @Test
    void resolvesMatchingSubscriptionsInRegistrationOrder() {
        String all = registry.register("devices.#", m -> {
        });
        String reported = registry.register("devices.*.shadow.reported", m -> {
        });
        registry.register("devices.*.shadow.desired", m -> {
        });
        String exact = registry.register("devices.wh-1.shadow.reported", m -> {
        });

        List<String> ids = registry.resolve("devices.wh-1.shadow.reported").stream().map(Subscription::id)
                .toList();

        assertEquals(List.of(all, reported, exact), ids);
        assertTrue(registry.resolve("unrelated").isEmpty());
    }

    @Test
    void unregisterRemovesAndClosesTheChannel() throws Exception {
        String id = registry.register("#", m -> {
        });
        Subscription subscription = registry.get(id).orElseThrow();

        assertTrue(registry.unregister(id));
        assertFalse(registry.unregister(id));
        assertEquals(0, registry.size());

        CompletableFuture<Void> result = subscription.channel().offer(message("a", 1));
        ExecutionException error = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(RejectedExecutionException.class, error.getCause());
    }

    @Test
    void removeExclusiveKeepsDurableSubscriptions() {
        String durable = registry.register("#", m -> {
        });
        registry.register("#", m -> {
        }, SubscriptionOptions.EXCLUSIVE);
        registry.register("a.#", m -> {
        }, SubscriptionOptions.EXCLUSIVE);

        assertEquals(2, registry.removeExclusive());
        assertEquals(1, registry.size());
        assertTrue(registry.get(durable).isPresent());
    }

    @Test
    void invalidPatternIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("a.#.b", m -> {
        }));
        assertThrows(IllegalArgumentException.class, () -> registry.register("a", null));
        assertEquals(0, registry.size());
    }

    @Test
    void channelDeliversInOfferOrder() {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        String id = registry.register("#", m -> seen.add(m.payload().asInt()));
        SubscriptionChannel channel = registry.get(id).orElseThrow().channel();

        List<CompletableFuture<Void>> results = List.of(
                channel.offer(message("a", 1)),
                channel.offer(message("a", 2)),
                channel.offer(message("a", 3)));
        executor.runPending(random);

        assertEquals(List.of(1, 2, 3), seen);
        results.forEach(r -> assertTrue(r.isDone() && !r.isCompletedExceptionally()));
    }

    @Test
    void subscriberFailureCompletesExceptionally() {
        String id = registry.register("#", m -> {
            throw new IllegalStateException("bad message");
        });
        CompletableFuture<Void> result = registry.get(id).orElseThrow().channel().offer(message("a", 1));
        executor.runPending(random);

        ExecutionException error = assertThrows(ExecutionException.class, result::get);
        assertEquals("bad message", error.getCause().getMessage());
    }

    @Test
    void fullChannelRejectsImmediately() {
        SubscriptionRegistry small = new SubscriptionRegistry(executor, 1, OpenTelemetry.noop());
        String id = small.register("#", m -> {
        });
        SubscriptionChannel channel = small.get(id).orElseThrow().channel();

        CompletableFuture<Void> first = channel.offer(message("a", 1));
        CompletableFuture<Void> second = channel.offer(message("a", 2));

        assertTrue(second.isCompletedExceptionally());
        ExecutionException error = assertThrows(ExecutionException.class, second::get);
        assertInstanceOf(ChannelFullException.class, error.getCause());
        assertEquals(id, ((ChannelFullException) error.getCause()).subscriptionId());
        executor.runPending(random);
        assertTrue(first.isDone() && !first.isCompletedExceptionally());
    }

    @Test
    void slowKeyDoesNotHoldUpOtherLanes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<String> handled = new CopyOnWriteArrayList<>();
        try (DefaultExecutor pool = new DefaultExecutor(1, 4)) {
            SubscriptionRegistry laned = new SubscriptionRegistry(pool, 4, OpenTelemetry.noop());
            String id = laned.register("#", m -> {
                if (m.topic().equals("wh-1")) {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                handled.add(m.topic() + ":" + m.payload().asInt());
            }, SubscriptionOptions.ordered(8, RoutedMessage::topic));
            SubscriptionChannel channel = laned.get(id).orElseThrow().channel();

            CompletableFuture<Void> slow = channel.offer(message("wh-1", 1));
            CompletableFuture<Void> queuedBehindSlow = channel.offer(message("wh-1", 2));
            CompletableFuture<Void> other = channel.offer(message("wh-2", 1));

            other.get(2, TimeUnit.SECONDS);
            assertFalse(slow.isDone());
            assertFalse(queuedBehindSlow.isDone());

            release.countDown();
            CompletableFuture.allOf(slow, queuedBehindSlow).get(2, TimeUnit.SECONDS);
            assertEquals(List.of("wh-2:1", "wh-1:1", "wh-1:2"), handled);
            assertEquals(8, channel.lanes());
            laned.close();
        }
    }

    @Test
    void severalLanesNeedAnOrderingKey() {
        assertThrows(IllegalArgumentException.class, () -> SubscriptionOptions.ordered(4, null));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionOptions.ordered(0, RoutedMessage::topic));
        assertEquals(1, SubscriptionOptions.DEFAULT.lanes());
    }

    @Test
    void concurrentRegistrationAndResolution() throws Exception {
        try (DefaultExecutor pool = new DefaultExecutor(1, 8)) {
            SubscriptionRegistry shared = new SubscriptionRegistry(pool, 4, OpenTelemetry.noop());
            int threads = 8;
            int perThread = 50;
            Set<String> ids = ConcurrentHashMap.newKeySet();
            CountDownLatch done = new CountDownLatch(threads * 2);
            List<Throwable> errors = new CopyOnWriteArrayList<>();

            for (int t = 0; t < threads; t++) {
                int thread = t;
                pool.submit(() -> {
                    try {
                        for (int i = 0; i < perThread; i++) {
                            String id = shared.register("devices.d" + thread + "-" + i + ".#", m -> {
                            });
                            ids.add(id);
                            if (i % 2 == 0) {
                                shared.unregister(id);
                            }
                        }
                    } catch (Throwable e) {
                        errors.add(e);
                    } finally {
                        done.countDown();
                    }
                    return null;
                });
                pool.submit(() -> {
                    try {
                        for (int i = 0; i < perThread; i++) {
                            for (Subscription s : shared.resolve("devices.d" + thread + "-" + i + ".x")) {
                                assertNotNull(s.channel());
                            }
                        }
                    } catch (Throwable e) {
                        errors.add(e);
                    } finally {
                        done.countDown();
                    }
                    return null;
                });
            }

            assertTrue(done.await(4, TimeUnit.SECONDS));
            assertTrue(errors.isEmpty(), () -> "Errors: " + errors);
            assertEquals(threads * perThread, ids.size());
            assertEquals(threads * perThread / 2, shared.size());
        }
    }

    @Test
    void closeRemovesEverything() {
        registry.register("#", m -> {
        });
        registry.register("a", m -> {
        }, SubscriptionOptions.ONE_SHOT);
        registry.close();
        assertEquals(0, registry.size());
        assertTrue(registry.resolve("a").isEmpty());
    }
}
