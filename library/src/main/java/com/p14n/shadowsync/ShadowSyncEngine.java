package com.p14n.shadowsync;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.shadowsync.broker.AsyncExecutor;
import com.p14n.shadowsync.broker.BrokerConnection;
import com.p14n.shadowsync.broker.ConnectionListener;
import com.p14n.shadowsync.broker.ConsumerOptions;
import com.p14n.shadowsync.broker.DefaultBrokerConnection;
import com.p14n.shadowsync.broker.Transport;
import com.p14n.shadowsync.codec.ShadowDeltaCodec;
import com.p14n.shadowsync.data.RoutedMessage;
import com.p14n.shadowsync.data.ShadowSyncConfig;
import com.p14n.shadowsync.dispatch.MessageDispatcher;
import com.p14n.shadowsync.notify.SessionGateway;
import com.p14n.shadowsync.notify.ShadowChangeNotifier;
import com.p14n.shadowsync.shadow.DeviceRegistry;
import com.p14n.shadowsync.shadow.Section;
import com.p14n.shadowsync.shadow.ShadowDelta;
import com.p14n.shadowsync.shadow.ShadowDocument;
import com.p14n.shadowsync.shadow.ShadowDocumentStore;
import com.p14n.shadowsync.shadow.ShadowRepository;
import com.p14n.shadowsync.shadow.ShadowUpdateSubscriber;
import com.p14n.shadowsync.subscription.MessageSubscriber;
import com.p14n.shadowsync.subscription.SubscriptionOptions;
import com.p14n.shadowsync.subscription.SubscriptionRegistry;
import com.p14n.shadowsync.topic.ShadowTopics;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Wires the broker connection, subscription registry, dispatcher, shadow
 * store and notifier into one engine.
 *
 * <p>
 * Devices publish on {@code <prefix>.<id>.shadow.reported}; operators either
 * publish on {@code <prefix>.<id>.shadow.desired} or call
 * {@link #patchDesired(String, Map)}. Every accepted change is published as a
 * delta on {@code <prefix>.<id>.shadow.update}, which comes back through the
 * ingress queue to subscribers registered with
 * {@link #subscribeDeltas(String, MessageSubscriber)}.
 * </p>
 *
 * <p>
 * The executor is owned by the caller and is not shut down by
 * {@link #close()}.
 * </p>
 */
public class ShadowSyncEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ShadowSyncEngine.class);

    private final ShadowSyncConfig config;
    private final BrokerConnection connection;
    private final SubscriptionRegistry registry;
    private final MessageDispatcher dispatcher;
    private final ShadowDocumentStore store;
    private final ShadowChangeNotifier notifier;
    private final ShadowTopics topics;
    private final LongSupplier clock;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile String ingressConsumerId;

    public ShadowSyncEngine(ShadowSyncConfig config, Transport transport, AsyncExecutor executor,
            ShadowRepository repository, DeviceRegistry devices, SessionGateway gateway, OpenTelemetry ot) {
        this(config, new DefaultBrokerConnection(transport, executor, config, ot), executor, repository, devices,
                gateway, System::currentTimeMillis, ot);
    }

    public ShadowSyncEngine(ShadowSyncConfig config, BrokerConnection connection, AsyncExecutor executor,
            ShadowRepository repository, DeviceRegistry devices, SessionGateway gateway, LongSupplier clock,
            OpenTelemetry ot) {
        this.config = config;
        this.connection = connection;
        this.clock = clock;
        this.topics = new ShadowTopics(config.topicPrefix());
        this.registry = new SubscriptionRegistry(executor, config.channelCapacity(), ot);
        this.dispatcher = new MessageDispatcher(registry, connection, config, ot);
        this.store = new ShadowDocumentStore(repository, devices, config.pruneAppliedDesired(), clock, ot);
        this.notifier = new ShadowChangeNotifier(connection, topics, gateway, executor);
        store.addDeltaListener(notifier);
    }

    /**
     * Connects to the broker, registers the reported and desired handlers and
     * starts consuming the ingress queue.
     */
    public ShadowSyncEngine start() {
        if (closed.get()) {
            throw new IllegalStateException("Engine is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return this;
        }
        connection.connect();
        connection.addConnectionListener(new ConnectionListener() {
            @Override
            public void onConnectionLost() {
                registry.removeExclusive();
            }
        });
        SubscriptionOptions perDevice = SubscriptionOptions.ordered(config.ingestLanes(), this::deviceKey);
        registry.register(topics.reportedPattern(),
                new ShadowUpdateSubscriber(store, topics, Section.REPORTED, clock), perDevice);
        registry.register(topics.desiredPattern(),
                new ShadowUpdateSubscriber(store, topics, Section.DESIRED, clock), perDevice);
        // published deltas come back through the ingress queue
        dispatcher.ignoreUnmatched(topics.updatePattern());
        ingressConsumerId = connection.declareConsumer(config.ingressQueue(), config.ingressPattern(), dispatcher,
                ConsumerOptions.DURABLE.withPrefetch(config.channelCapacity()));
        logger.atInfo().addArgument(config.ingressQueue()).addArgument(config.ingressPattern())
                .log("Shadow sync engine started, consuming {} bound to {}");
        return this;
    }

    public ShadowDocument getShadow(String deviceId) {
        return store.get(deviceId);
    }

    /**
     * Requests new values for the device, stamped with the current time.
     *
     * @throws com.p14n.shadowsync.shadow.DeviceNotFoundException if the device
     *                                                             is unknown
     */
    public ShadowDelta patchDesired(String deviceId, Map<String, ?> properties) {
        return store.applyDesired(deviceId, properties, clock.getAsLong());
    }

    /**
     * Requests new values only if the shadow is still at
     * {@code expectedVersion}.
     *
     * @throws com.p14n.shadowsync.shadow.ShadowVersionConflictException if it
     *                                                                    is not
     */
    public ShadowDelta patchDesired(String deviceId, Map<String, ?> properties, long expectedVersion) {
        return store.applyDesired(deviceId, properties, clock.getAsLong(), expectedVersion);
    }

    /**
     * The device's most recent saved shadow versions, newest first.
     */
    public List<ShadowDocument> history(String deviceId, int limit) {
        return store.history(deviceId, limit);
    }

    public ShadowDelta clearDesired(String deviceId, Collection<String> propertyNames) {
        return store.clearDesired(deviceId, propertyNames);
    }

    public void markApplied(String deviceId, Collection<String> propertyNames) {
        store.markApplied(deviceId, propertyNames);
    }

    public Map<String, JsonNode> pendingDelta(String deviceId) {
        return store.pendingDelta(deviceId);
    }

    public ShadowDocument registerDevice(String deviceId) {
        return store.register(ShadowTopics.validDeviceId(deviceId));
    }

    public void deactivateDevice(String deviceId) {
        store.deactivate(deviceId);
    }

    /**
     * Subscribes to deltas published on update topics matching the pattern,
     * {@code devices.*.shadow.update} for every device. Broader patterns such
     * as {@code devices.#} are allowed; messages on other topics they match are
     * skipped.
     *
     * @return the subscription id
     */
    public String subscribeDeltas(String pattern, MessageSubscriber<ShadowDelta> subscriber) {
        return subscribeDeltas(pattern, subscriber, SubscriptionOptions.DEFAULT);
    }

    public String subscribeDeltas(String pattern, MessageSubscriber<ShadowDelta> subscriber,
            SubscriptionOptions options) {
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        return registry.register(pattern, new MessageSubscriber<RoutedMessage>() {
            @Override
            public void onMessage(RoutedMessage message) {
                if (!topics.kindOf(message.topic()).filter(ShadowTopics.UPDATE::equals).isPresent()) {
                    return;
                }
                subscriber.onMessage(ShadowDeltaCodec.fromJson(message.payload()));
            }

            @Override
            public void onError(Throwable error) {
                subscriber.onError(error);
            }
        }, options);
    }

    private String deviceKey(RoutedMessage message) {
        return topics.deviceIdOf(message.topic()).orElse(message.topic());
    }

    public boolean unsubscribe(String subscriptionId) {
        return registry.unregister(subscriptionId);
    }

    public void registerSession(String sessionId, String pattern) {
        notifier.registerSession(sessionId, pattern);
    }

    public boolean unregisterSession(String sessionId) {
        return notifier.unregisterSession(sessionId);
    }

    public ShadowTopics topics() {
        return topics;
    }

    public BrokerConnection connection() {
        return connection;
    }

    public SubscriptionRegistry registry() {
        return registry;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        String consumerId = ingressConsumerId;
        if (consumerId != null) {
            connection.cancel(consumerId);
        }
        registry.close();
        connection.close();
        logger.atInfo().log("Shadow sync engine closed");
    }
}
