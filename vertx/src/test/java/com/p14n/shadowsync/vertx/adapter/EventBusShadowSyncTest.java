package com.p14n.shadowsync.vertx.adapter;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.shadowsync.ShadowSyncEngine;
import com.p14n.shadowsync.broker.DefaultExecutor;
import com.p14n.shadowsync.codec.JsonUtil;
import com.p14n.shadowsync.data.ConfigData;
import com.p14n.shadowsync.data.Envelope;
import com.p14n.shadowsync.shadow.DeltaKind;
import com.p14n.shadowsync.shadow.InMemoryDeviceRegistry;
import com.p14n.shadowsync.shadow.InMemoryShadowRepository;
import com.p14n.shadowsync.shadow.ShadowDelta;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class EventBusShadowSyncTest {

    private Vertx vertx;
    private DefaultExecutor executor;
    private ShadowSyncEngine engine;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        executor = new DefaultExecutor(1, 4);
        engine = new ShadowSyncEngine(ConfigData.defaults(), new EventBusTransport(vertx.eventBus()), executor,
                new InMemoryShadowRepository(), new InMemoryDeviceRegistry(List.of("wh-1")),
                new VertxSessionGateway(vertx.eventBus()), OpenTelemetry.noop()).start();
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.close();
        executor.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    @Test
    void reportedStateFlowsToSubscribersAndSessions() throws Exception {
        List<ShadowDelta> deltas = new CopyOnWriteArrayList<>();
        List<JsonNode> pushed = new CopyOnWriteArrayList<>();
        CountDownLatch deltaLatch = new CountDownLatch(1);
        CountDownLatch sessionLatch = new CountDownLatch(1);

        engine.subscribeDeltas("devices.*.shadow.update", delta -> {
            deltas.add(delta);
            deltaLatch.countDown();
        });
        engine.registerSession("ui-1", "devices.wh-1.#");
        vertx.eventBus().<String>consumer(VertxSessionGateway.addressOf("ui-1"), message -> {
            try {
                pushed.add(JsonUtil.parse(message.body()));
            } catch (Exception e) {
                fail(e);
            }
            sessionLatch.countDown();
        });

        engine.connection().publish(Envelope.json(engine.topics().reported("wh-1"), "{\"temperature\":125}", 100));

        assertTrue(deltaLatch.await(5, TimeUnit.SECONDS));
        assertTrue(sessionLatch.await(5, TimeUnit.SECONDS));

        ShadowDelta delta = deltas.get(0);
        assertEquals(DeltaKind.REPORTED_CHANGED, delta.kind());
        assertEquals(1, delta.toVersion());
        assertEquals(125, pushed.get(0).at("/state/reported/temperature").asInt());
        assertEquals(1, engine.getShadow("wh-1").version());
    }
}
