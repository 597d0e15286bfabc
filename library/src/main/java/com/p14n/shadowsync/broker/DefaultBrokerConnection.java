package com.p14n.shadowsync.broker;

import static com.p14n.shadowsync.telemetry.OpenTelemetryFunctions.processWithTelemetry;
import static com.p14n.shadowsync.telemetry.OpenTelemetryFunctions.serializeTraceContext;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.shadowsync.data.Envelope;
import com.p14n.shadowsync.data.ShadowSyncConfig;
import com.p14n.shadowsync.telemetry.BrokerMetrics;
import com.p14n.shadowsync.topic.TopicPattern;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * {@link BrokerConnection} over a {@link Transport}, reconnecting with
 * exponential backoff after a loss.
 *
 * <p>
 * Consumer declarations are remembered and re-bound after every reconnect.
 * Messages published while the connection is down are held in a bounded
 * buffer (oldest dropped first) and flushed in order once it is back, unless
 * retry is disabled.
 * </p>
 */
public class DefaultBrokerConnection implements BrokerConnection {

    private static final Logger logger = LoggerFactory.getLogger(DefaultBrokerConnection.class);

    private enum State {
        NEW, CONNECTED, RECONNECTING, CLOSED
    }

    private static final class Consumer {
        final String id;
        final String queueName;
        final TopicPattern pattern;
        final ConsumerOptions options;
        final DeliveryHandler handler;
        TransportBinding binding;

        Consumer(String id, String queueName, TopicPattern pattern, ConsumerOptions options,
                DeliveryHandler handler) {
            this.id = id;
            this.queueName = queueName;
            this.pattern = pattern;
            this.options = options;
            this.handler = handler;
        }
    }

    private final Transport transport;
    private final AsyncExecutor executor;
    private final String exchangeName;
    private final Backoff backoff;
    private final boolean retryEnabled;
    private final int outboundBufferSize;
    private final BrokerMetrics metrics;
    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;

    private final Object lock = new Object();
    private final Map<String, Consumer> consumers = new LinkedHashMap<>();
    private final Deque<Envelope> outbound = new ArrayDeque<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong consumerSequence = new AtomicLong();

    private volatile State state = State.NEW;
    private boolean everConnected;
    private int attempt;

    public DefaultBrokerConnection(Transport transport, AsyncExecutor executor, ShadowSyncConfig config,
            OpenTelemetry ot) {
        this(transport, executor, config.exchangeName(),
                new Backoff(config.reconnectInitialDelayMillis(), config.reconnectMaxDelayMillis()),
                config.retryEnabled(), config.outboundBufferSize(), ot);
    }

    public DefaultBrokerConnection(Transport transport, AsyncExecutor executor, String exchangeName,
            Backoff backoff, boolean retryEnabled, int outboundBufferSize, OpenTelemetry ot) {
        if (transport == null) {
            throw new IllegalArgumentException("Transport cannot be null");
        }
        if (exchangeName == null || exchangeName.isBlank()) {
            throw new IllegalArgumentException("Exchange name cannot be null or empty");
        }
        this.transport = transport;
        this.executor = executor;
        this.exchangeName = exchangeName;
        this.backoff = backoff;
        this.retryEnabled = retryEnabled;
        this.outboundBufferSize = outboundBufferSize;
        this.metrics = new BrokerMetrics(ot.getMeter("shadowsync-broker"));
        this.tracer = ot.getTracer("shadowsync-broker");
        this.openTelemetry = ot;
        transport.onConnectionLost(this::onTransportLost);
    }

    @Override
    public void connect() {
        synchronized (lock) {
            if (state == State.CLOSED) {
                throw new IllegalStateException("Connection is closed");
            }
            if (state != State.NEW) {
                return;
            }
            try {
                openAndRebind();
                logger.atInfo().addArgument(exchangeName).log("Connected to exchange {}");
                return;
            } catch (TransportException e) {
                logger.atWarn().setCause(e).addArgument(exchangeName)
                        .log("Unable to connect to exchange {}, retrying in background");
                state = State.RECONNECTING;
                attempt = 0;
                scheduleReconnect();
            }
        }
    }

    @Override
    public boolean isConnected() {
        return state == State.CONNECTED;
    }

    @Override
    public void publish(Envelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("Envelope cannot be null");
        }
        processWithTelemetry(openTelemetry, tracer, envelope, "publish_message", () -> {
            Envelope outgoing = envelope.traceparent() == null
                    ? envelope.withTraceparent(serializeTraceContext(openTelemetry))
                    : envelope;
            doPublish(outgoing);
            return null;
        });
    }

    private void doPublish(Envelope envelope) {
        boolean lost = false;
        try {
            synchronized (lock) {
                if (state == State.NEW) {
                    throw new NotConnectedException("connect() has not been called");
                }
                if (state == State.CLOSED) {
                    throw new NotConnectedException("Connection is closed");
                }
                if (!everConnected) {
                    throw new NotConnectedException("Connection has not been established yet");
                }
                if (state == State.RECONNECTING) {
                    buffer(envelope);
                    return;
                }
                try {
                    transport.publish(envelope);
                    metrics.recordPublished(envelope.topic());
                    logger.atDebug().addArgument(envelope::topic).addArgument(envelope::messageId)
                            .log("Published to {} id {}");
                } catch (TransportException e) {
                    lost = markLost(e);
                    buffer(envelope);
                }
            }
        } finally {
            if (lost) {
                notifyLost();
            }
        }
    }

    private void buffer(Envelope envelope) {
        if (!retryEnabled) {
            throw new NotConnectedException("Connection is down and publish retry is disabled");
        }
        if (outboundBufferSize == 0) {
            logger.atWarn().addArgument(envelope.topic()).log("Outbound buffer disabled, dropping message for {}");
            return;
        }
        if (outbound.size() >= outboundBufferSize) {
            Envelope dropped = outbound.pollFirst();
            logger.atWarn().addArgument(outboundBufferSize).addArgument(dropped.topic())
                    .addArgument(dropped.messageId())
                    .log("Outbound buffer full ({}), dropping oldest message for {} id {}");
        }
        outbound.addLast(envelope);
    }

    @Override
    public String declareConsumer(String queueName, String pattern, DeliveryHandler handler,
            ConsumerOptions options) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("Queue name cannot be null or empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        TopicPattern topicPattern = TopicPattern.of(pattern);
        ConsumerOptions opts = options == null ? ConsumerOptions.DURABLE : options;
        boolean lost = false;
        String id;
        try {
            synchronized (lock) {
                if (state == State.NEW) {
                    throw new NotConnectedException("connect() has not been called");
                }
                if (state == State.CLOSED) {
                    throw new NotConnectedException("Connection is closed");
                }
                for (Consumer existing : consumers.values()) {
                    if (existing.queueName.equals(queueName)) {
                        throw new IllegalArgumentException("A consumer is already declared on queue " + queueName);
                    }
                }
                id = "consumer-" + consumerSequence.incrementAndGet();
                Consumer consumer = new Consumer(id, queueName, topicPattern, opts, handler);
                consumers.put(id, consumer);
                if (state == State.CONNECTED) {
                    try {
                        consumer.binding = transport.bind(queueName, topicPattern, opts, handler);
                    } catch (TransportException e) {
                        lost = markLost(e);
                    }
                }
                logger.atInfo().addArgument(queueName).addArgument(topicPattern).addArgument(id)
                        .log("Declared queue {} bound to {} as {}");
            }
        } finally {
            if (lost) {
                notifyLost();
            }
        }
        return id;
    }

    @Override
    public boolean cancel(String consumerId) {
        Consumer consumer;
        synchronized (lock) {
            consumer = consumers.remove(consumerId);
            if (consumer == null) {
                return false;
            }
            cancelBinding(consumer);
        }
        logger.atInfo().addArgument(consumerId).log("Cancelled consumer {}");
        return true;
    }

    private void cancelBinding(Consumer consumer) {
        if (consumer.binding == null) {
            return;
        }
        try {
            consumer.binding.cancel();
        } catch (TransportException e) {
            logger.atWarn().setCause(e).addArgument(consumer.queueName).log("Error cancelling consumer on {}");
        }
        consumer.binding = null;
    }

    @Override
    public void addConnectionListener(ConnectionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
    }

    /**
     * Number of messages waiting for the connection to come back.
     */
    public int pendingOutbound() {
        synchronized (lock) {
            return outbound.size();
        }
    }

    private void onTransportLost() {
        boolean lost;
        synchronized (lock) {
            lost = markLost(null);
        }
        if (lost) {
            notifyLost();
        }
    }

    /**
     * Moves a connected connection into reconnecting. Caller holds the lock.
     */
    private boolean markLost(Throwable cause) {
        if (state != State.CONNECTED) {
            return false;
        }
        state = State.RECONNECTING;
        attempt = 0;
        consumers.values().forEach(c -> c.binding = null);
        if (cause == null) {
            logger.atWarn().addArgument(exchangeName).log("Connection to {} lost, reconnecting");
        } else {
            logger.atWarn().setCause(cause).addArgument(exchangeName).log("Connection to {} failed, reconnecting");
        }
        scheduleReconnect();
        return true;
    }

    private void notifyLost() {
        for (ConnectionListener listener : listeners) {
            try {
                listener.onConnectionLost();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Connection listener failed");
            }
        }
    }

    private void scheduleReconnect() {
        long delay = backoff.delayFor(attempt);
        logger.atDebug().addArgument(attempt + 1).addArgument(delay).log("Reconnect attempt {} in {}ms");
        executor.schedule(this::attemptReconnect, delay, TimeUnit.MILLISECONDS);
    }

    void attemptReconnect() {
        synchronized (lock) {
            if (state != State.RECONNECTING) {
                return;
            }
            try {
                openAndRebind();
            } catch (TransportException e) {
                attempt++;
                metrics.recordReconnectAttempt(false);
                logger.atWarn().addArgument(exchangeName).addArgument(attempt).addArgument(e.getMessage())
                        .log("Reconnect to {} failed (attempt {}): {}");
                scheduleReconnect();
                return;
            }
            metrics.recordReconnectAttempt(true);
            logger.atInfo().addArgument(exchangeName).addArgument(consumers.size())
                    .log("Reconnected to {}, re-declared {} consumers");
        }
        flushOutbound();
        for (ConnectionListener listener : listeners) {
            try {
                listener.onReconnected();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Connection listener failed");
            }
        }
    }

    private void openAndRebind() {
        transport.open(exchangeName);
        for (Consumer consumer : consumers.values()) {
            consumer.binding = transport.bind(consumer.queueName, consumer.pattern, consumer.options,
                    consumer.handler);
        }
        state = State.CONNECTED;
        everConnected = true;
        attempt = 0;
    }

    private void flushOutbound() {
        boolean lost = false;
        int flushed = 0;
        synchronized (lock) {
            while (state == State.CONNECTED && !outbound.isEmpty()) {
                Envelope next = outbound.peekFirst();
                try {
                    transport.publish(next);
                } catch (TransportException e) {
                    lost = markLost(e);
                    break;
                }
                outbound.pollFirst();
                metrics.recordPublished(next.topic());
                flushed++;
            }
        }
        if (flushed > 0) {
            logger.atInfo().addArgument(flushed).log("Flushed {} buffered messages");
        }
        if (lost) {
            notifyLost();
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            consumers.values().forEach(this::cancelBinding);
            consumers.clear();
            if (!outbound.isEmpty()) {
                logger.atWarn().addArgument(outbound.size()).log("Closing with {} unsent buffered messages");
                outbound.clear();
            }
        }
        try {
            transport.close();
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Error closing transport");
        }
        logger.atInfo().addArgument(exchangeName).log("Connection to {} closed");
    }
}
