package com.p14n.shadowsync.vertx.adapter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.shadowsync.broker.ConsumerOptions;
import com.p14n.shadowsync.broker.Delivery;
import com.p14n.shadowsync.broker.DeliveryHandler;
import com.p14n.shadowsync.broker.Transport;
import com.p14n.shadowsync.broker.TransportBinding;
import com.p14n.shadowsync.broker.TransportException;
import com.p14n.shadowsync.data.Envelope;
import com.p14n.shadowsync.topic.TopicPattern;
import com.p14n.shadowsync.vertx.codec.EnvelopeCodec;

import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.MessageConsumer;

/**
 * A {@link Transport} over the Vert.x EventBus.
 *
 * <p>
 * Every message is published to one address named after the exchange. Each
 * bound queue is a consumer on that address that keeps the messages its
 * pattern matches, plus a consumer on {@code <exchange>.queue.<name>} that
 * receives its own redeliveries after a nack. A queue declared with a
 * prefetch holds back matching messages while that many deliveries are
 * unsettled and hands them over, in arrival order, as deliveries settle.
 * </p>
 *
 * <p>
 * The EventBus does not store messages: anything published while a queue
 * has no consumer is not seen by it. A local event bus has no session that can
 * drop, so connection loss listeners are never invoked. One transport should
 * be opened per EventBus because it installs the default codec for
 * {@link Envelope}.
 * </p>
 */
public class EventBusTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(EventBusTransport.class);

    private final EventBus eventBus;
    private final Map<String, BusQueue> queues = new ConcurrentHashMap<>();
    private volatile boolean open;
    private volatile String address;

    public EventBusTransport(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public synchronized void open(String exchangeName) {
        if (open) {
            return;
        }
        try {
            eventBus.registerDefaultCodec(Envelope.class, new EnvelopeCodec());
        } catch (IllegalStateException e) {
            throw new TransportException("Envelope codec already registered on this event bus", e);
        }
        address = exchangeName;
        open = true;
        logger.atInfo().addArgument(exchangeName).log("EventBus transport opened on address {}");
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void publish(Envelope envelope) {
        requireOpen();
        eventBus.publish(address, envelope);
        logger.atDebug().addArgument(envelope::topic).addArgument(envelope::messageId)
                .log("Published {} id {} to the event bus");
    }

    @Override
    public TransportBinding bind(String queueName, TopicPattern pattern, ConsumerOptions options,
            DeliveryHandler handler) {
        requireOpen();
        BusQueue queue = new BusQueue(queueName, pattern, options == null ? 0 : options.prefetch(), handler);
        BusQueue previous = queues.put(queueName, queue);
        if (previous != null) {
            previous.unregister();
        }
        logger.atInfo().addArgument(queueName).addArgument(pattern).log("Bound event bus queue {} to {}");
        return () -> {
            queues.remove(queueName, queue);
            queue.unregister();
        };
    }

    /**
     * Matching messages a prefetch-limited queue is holding back.
     */
    public int backlog(String queueName) {
        BusQueue queue = queues.get(queueName);
        return queue == null ? 0 : queue.backlog();
    }

    @Override
    public void onConnectionLost(Runnable listener) {
        // nothing to lose on a local event bus
    }

    @Override
    public synchronized void close() {
        if (!open) {
            return;
        }
        open = false;
        queues.values().forEach(BusQueue::unregister);
        queues.clear();
        eventBus.unregisterDefaultCodec(Envelope.class);
        logger.atInfo().addArgument(address).log("EventBus transport on {} closed");
    }

    private void requireOpen() {
        if (!open) {
            throw new TransportException("EventBus transport is not open");
        }
    }

    private final class BusQueue {
        private final String name;
        private final TopicPattern pattern;
        private final int prefetch;
        private final DeliveryHandler handler;
        private final String redeliveryAddress;
        private final Deque<Envelope> backlog = new ArrayDeque<>();
        private final MessageConsumer<Envelope> consumer;
        private final MessageConsumer<Envelope> redeliveries;
        private int inFlight;

        BusQueue(String name, TopicPattern pattern, int prefetch, DeliveryHandler handler) {
            this.name = name;
            this.pattern = pattern;
            this.prefetch = prefetch;
            this.handler = handler;
            this.redeliveryAddress = address + ".queue." + name;
            this.consumer = eventBus.consumer(address, message -> receive(message.body()));
            this.redeliveries = eventBus.consumer(redeliveryAddress, message -> receive(message.body()));
        }

        void receive(Envelope envelope) {
            if (!pattern.matches(envelope.topic())) {
                return;
            }
            synchronized (this) {
                if (prefetch > 0 && inFlight >= prefetch) {
                    backlog.addLast(envelope);
                    return;
                }
                inFlight++;
            }
            deliver(envelope);
        }

        private void deliver(Envelope envelope) {
            BusDelivery delivery = new BusDelivery(this, envelope.delivered());
            try {
                handler.onDelivery(delivery);
            } catch (RuntimeException e) {
                logger.atError().setCause(e).addArgument(name).log("Consumer on {} failed, requeueing");
                delivery.nack(true);
            }
        }

        void settled() {
            Envelope next;
            synchronized (this) {
                inFlight--;
                next = backlog.pollFirst();
                if (next != null) {
                    inFlight++;
                }
            }
            if (next != null) {
                deliver(next);
            }
        }

        synchronized int backlog() {
            return backlog.size();
        }

        void requeue(Envelope envelope) {
            if (!open) {
                logger.atWarn().addArgument(envelope.messageId()).addArgument(name)
                        .log("Transport closed, dropping requeued {} for {}");
                return;
            }
            eventBus.send(redeliveryAddress, envelope);
        }

        void unregister() {
            consumer.unregister();
            redeliveries.unregister();
        }
    }

    private static final class BusDelivery implements Delivery {
        private final BusQueue queue;
        private final Envelope envelope;
        private final AtomicBoolean settled = new AtomicBoolean();

        BusDelivery(BusQueue queue, Envelope envelope) {
            this.queue = queue;
            this.envelope = envelope;
        }

        @Override
        public Envelope envelope() {
            return envelope;
        }

        @Override
        public void ack() {
            if (settled.compareAndSet(false, true)) {
                queue.settled();
            }
        }

        @Override
        public void nack(boolean requeue) {
            if (settled.compareAndSet(false, true)) {
                if (requeue) {
                    queue.requeue(envelope.requeued());
                }
                queue.settled();
            }
        }

        @Override
        public void release() {
            if (settled.compareAndSet(false, true)) {
                queue.requeue(envelope.released());
                queue.settled();
            }
        }
    }
}
