package com.p14n.shadowsync;

import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.shadowsync.broker.DefaultExecutor;
import com.p14n.shadowsync.data.ConfigData;
import com.p14n.shadowsync.db.DatabaseSetup;
import com.p14n.shadowsync.db.JdbcShadowRepository;
import com.p14n.shadowsync.db.PoolSetup;
import com.p14n.shadowsync.shadow.InMemoryDeviceRegistry;
import com.p14n.shadowsync.shadow.InMemoryShadowRepository;
import com.p14n.shadowsync.shadow.ShadowRepository;
import com.p14n.shadowsync.vertx.adapter.EventBusTransport;
import com.p14n.shadowsync.vertx.adapter.VertxSessionGateway;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;

/**
 * Runs the engine over a Vert.x event bus with a simulated fleet of water
 * heaters, logging every delta. Configured from {@code SHADOWSYNC_*}
 * variables plus {@code APP_DEVICES}, {@code APP_TICK_MS} and
 * {@code APP_OTLP_ENDPOINT}.
 */
public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static String[] envVals(String name, String... fallback) {
        var e = System.getenv(name);
        if (e != null && !e.isBlank()) {
            return e.split(",");
        }
        return fallback;
    }

    public static void main(String[] args) throws Exception {
        var cfg = ConfigData.fromEnv(System.getenv());
        var devices = List.of(envVals("APP_DEVICES", "wh-1", "wh-2", "wh-3"));
        var tickMillis = Long.parseLong(envVals("APP_TICK_MS", "1000")[0]);
        var ot = Opentelemetry.create("shadowsync", envVals("APP_OTLP_ENDPOINT", Opentelemetry.DEFAULT_ENDPOINT)[0]);

        run(cfg, devices, tickMillis, ot);
    }

    static ShadowRepository repository(ConfigData cfg) {
        if (!cfg.hasDatabase()) {
            logger.atInfo().log("No database configured, shadows are kept in memory");
            return new InMemoryShadowRepository();
        }
        new DatabaseSetup(cfg).setupAll();
        logger.atInfo().addArgument(cfg::jdbcUrl).log("Persisting shadows to {}");
        return new JdbcShadowRepository(PoolSetup.createPool(cfg));
    }

    private static void run(ConfigData cfg, List<String> devices, long tickMillis, OpenTelemetry ot)
            throws Exception {
        Vertx vertx = Vertx.vertx();
        try (DefaultExecutor executor = new DefaultExecutor(2, 8);
                ShadowSyncEngine engine = new ShadowSyncEngine(cfg, new EventBusTransport(vertx.eventBus()),
                        executor, repository(cfg), new InMemoryDeviceRegistry(devices),
                        new VertxSessionGateway(vertx.eventBus()), ot).start()) {

            engine.subscribeDeltas(engine.topics().updatePattern(), delta -> logger.atInfo()
                    .addArgument(delta::deviceId)
                    .addArgument(delta::fromVersion)
                    .addArgument(delta::toVersion)
                    .addArgument(delta::changes)
                    .log("Shadow {} {} -> {}: {}"));

            var fleet = new WaterHeaterFleet(engine, devices, new Random());
            vertx.setPeriodic(tickMillis, id -> fleet.tick());
            logger.atInfo().addArgument(devices.size()).addArgument(tickMillis)
                    .log("Simulating {} water heaters every {}ms");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> logger.atInfo().log("Shutting down")));
            Thread.currentThread().join();
        } finally {
            vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        }
    }
}
