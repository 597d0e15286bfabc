package com.p14n.shadowsync.broker;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.shadowsync.data.Envelope;
import com.p14n.shadowsync.topic.TopicPattern;

/**
 * An in-process topic exchange with AMQP-like queue semantics.
 *
 * <ul>
 * <li>each queue has one binding pattern and at most one consumer</li>
 * <li>deliveries stay unacknowledged until the consumer settles them; a
 * requeued message goes to the back of its queue</li>
 * <li>a queue declared with a prefetch hands its consumer no more than that
 * many unacknowledged deliveries at a time</li>
 * <li>on a connection loss exclusive queues are deleted and unacknowledged
 * messages of the remaining queues are returned to the front, flagged as
 * redelivered</li>
 * </ul>
 *
 * {@link #dropConnection()} and {@link #failNextOpens(int)} simulate outages.
 */
public class InMemoryTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTransport.class);

    private final AsyncExecutor executor;
    private final Map<String, Queue> queues = new ConcurrentHashMap<>();
    private final List<Runnable> lossListeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger failingOpens = new AtomicInteger();
    private volatile boolean open;
    private volatile String exchangeName;

    public InMemoryTransport(AsyncExecutor executor) {
        this.executor = executor;
    }

    @Override
    public synchronized void open(String exchangeName) {
        if (open) {
            return;
        }
        if (failingOpens.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransportException("Exchange " + exchangeName + " unavailable");
        }
        this.exchangeName = exchangeName;
        this.open = true;
        logger.atDebug().addArgument(exchangeName).log("Opened in-memory exchange {}");
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void publish(Envelope envelope) {
        requireOpen();
        for (Queue queue : queues.values()) {
            if (queue.pattern.matches(envelope.topic())) {
                queue.enqueue(envelope);
            }
        }
    }

    @Override
    public TransportBinding bind(String queueName, TopicPattern pattern, ConsumerOptions options,
            DeliveryHandler handler) {
        requireOpen();
        Queue queue = queues.computeIfAbsent(queueName, name -> new Queue(name, options, pattern));
        queue.attach(pattern, options, handler);
        return () -> {
            queue.detach(handler);
            if (queue.options.autoDelete()) {
                queues.remove(queueName, queue);
            }
        };
    }

    @Override
    public void onConnectionLost(Runnable listener) {
        lossListeners.add(listener);
    }

    /**
     * Simulates the broker dropping the session.
     */
    public void dropConnection() {
        synchronized (this) {
            if (!open) {
                return;
            }
            open = false;
            queues.values().removeIf(q -> q.options.exclusive());
            queues.values().forEach(Queue::connectionLost);
        }
        logger.atDebug().addArgument(exchangeName).log("Dropped in-memory exchange {}");
        lossListeners.forEach(Runnable::run);
    }

    /**
     * Makes the next {@code count} calls to {@link #open(String)} fail.
     */
    public void failNextOpens(int count) {
        failingOpens.set(count);
    }

    public boolean hasQueue(String queueName) {
        return queues.containsKey(queueName);
    }

    /**
     * Messages waiting in a queue, not counting unacknowledged deliveries.
     */
    public int queueDepth(String queueName) {
        Queue queue = queues.get(queueName);
        return queue == null ? 0 : queue.depth();
    }

    public int unacknowledged(String queueName) {
        Queue queue = queues.get(queueName);
        return queue == null ? 0 : queue.unackedCount();
    }

    @Override
    public synchronized void close() {
        open = false;
        queues.values().forEach(q -> q.detach(null));
        queues.clear();
    }

    private void requireOpen() {
        if (!open) {
            throw new TransportException("Transport is not open");
        }
    }

    private final class Queue {
        final String name;
        volatile ConsumerOptions options;
        volatile TopicPattern pattern;
        volatile DeliveryHandler handler;
        final Deque<Envelope> pending = new ArrayDeque<>();
        final NavigableMap<Long, Envelope> unacked = new TreeMap<>();
        final AtomicBoolean draining = new AtomicBoolean();
        long nextTag;

        Queue(String name, ConsumerOptions options, TopicPattern pattern) {
            this.name = name;
            this.options = options;
            this.pattern = pattern;
        }

        void attach(TopicPattern pattern, ConsumerOptions options, DeliveryHandler handler) {
            this.pattern = pattern;
            this.options = options;
            this.handler = handler;
            scheduleDrain();
        }

        /**
         * Detaches the given handler, or any handler when null.
         */
        synchronized void detach(DeliveryHandler expected) {
            if (expected == null || handler == expected) {
                handler = null;
            }
        }

        void enqueue(Envelope envelope) {
            synchronized (this) {
                pending.addLast(envelope);
            }
            scheduleDrain();
        }

        synchronized int depth() {
            return pending.size();
        }

        synchronized int unackedCount() {
            return unacked.size();
        }

        synchronized void connectionLost() {
            handler = null;
            for (Envelope envelope : unacked.descendingMap().values()) {
                pending.addFirst(envelope.requeued());
            }
            unacked.clear();
        }

        void scheduleDrain() {
            if (handler != null && open && draining.compareAndSet(false, true)) {
                executor.submit(() -> {
                    drain();
                    return null;
                });
            }
        }

        void drain() {
            try {
                while (true) {
                    DeliveryHandler target;
                    Envelope next;
                    long tag;
                    synchronized (this) {
                        target = handler;
                        if (target == null || !open || pending.isEmpty() || saturated()) {
                            break;
                        }
                        next = pending.pollFirst().delivered();
                        tag = nextTag++;
                        unacked.put(tag, next);
                    }
                    try {
                        target.onDelivery(new QueueDelivery(this, tag, next));
                    } catch (RuntimeException e) {
                        logger.atError().setCause(e).addArgument(name).log("Consumer on {} failed, requeueing");
                        settle(tag, true);
                    }
                }
            } finally {
                draining.set(false);
            }
            boolean more;
            synchronized (this) {
                more = handler != null && !pending.isEmpty() && !saturated();
            }
            if (more) {
                scheduleDrain();
            }
        }

        synchronized boolean saturated() {
            return options.limited() && unacked.size() >= options.prefetch();
        }

        void settle(long tag, boolean requeue) {
            settle(tag, requeue, false);
        }

        void settle(long tag, boolean requeue, boolean release) {
            boolean more;
            synchronized (this) {
                Envelope envelope = unacked.remove(tag);
                if (envelope != null && requeue) {
                    pending.addLast(release ? envelope.released() : envelope.requeued());
                }
                more = envelope != null && !pending.isEmpty();
            }
            if (more) {
                scheduleDrain();
            }
        }
    }

    private static final class QueueDelivery implements Delivery {
        private final Queue queue;
        private final long tag;
        private final Envelope envelope;
        private final AtomicBoolean settled = new AtomicBoolean();

        QueueDelivery(Queue queue, long tag, Envelope envelope) {
            this.queue = queue;
            this.tag = tag;
            this.envelope = envelope;
        }

        @Override
        public Envelope envelope() {
            return envelope;
        }

        @Override
        public void ack() {
            if (settled.compareAndSet(false, true)) {
                queue.settle(tag, false);
            }
        }

        @Override
        public void nack(boolean requeue) {
            if (settled.compareAndSet(false, true)) {
                queue.settle(tag, requeue);
            }
        }

        @Override
        public void release() {
            if (settled.compareAndSet(false, true)) {
                queue.settle(tag, true, true);
            }
        }
    }
}
