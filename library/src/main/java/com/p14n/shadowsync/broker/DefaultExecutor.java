package com.p14n.shadowsync.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * {@link AsyncExecutor} backed by a scheduled pool for reconnect timers and a
 * worker pool for deliveries and subscription channels. Threads are named
 * {@code shadowsync-*} so they can be picked out of a thread dump.
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ScheduledExecutorService se;
        private final ExecutorService es;

        /**
         * Creates an executor with a cached worker pool.
         *
         * @param scheduledSize the size of the scheduled thread pool
         */
        public DefaultExecutor(int scheduledSize) {
                this.se = createScheduledExecutorService(scheduledSize);
                this.es = createCachedExecutorService();
        }

        /**
         * Creates an executor with a fixed-size worker pool.
         *
         * @param scheduledSize the size of the scheduled thread pool
         * @param fixedSize     the size of the worker pool
         */
        public DefaultExecutor(int scheduledSize, int fixedSize) {
                this.se = createScheduledExecutorService(scheduledSize);
                this.es = createFixedExecutorService(fixedSize);
        }

        protected ExecutorService createFixedExecutorService(int size) {
                return Executors.newFixedThreadPool(size,
                                new ThreadFactoryBuilder().setNameFormat("shadowsync-worker-%d").setDaemon(true).build());
        }

        protected ExecutorService createCachedExecutorService() {
                return Executors.newCachedThreadPool(
                                new ThreadFactoryBuilder().setNameFormat("shadowsync-worker-%d").setDaemon(true).build());
        }

        protected ScheduledExecutorService createScheduledExecutorService(int size) {
                return Executors.newScheduledThreadPool(size,
                                new ThreadFactoryBuilder().setNameFormat("shadowsync-scheduled-%d").setDaemon(true).build());
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
                return se.scheduleAtFixedRate(command, initialDelay, period, unit);
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
                return se.schedule(command, delay, unit);
        }

        @Override
        public List<Runnable> shutdownNow() {
                var x = new ArrayList<Runnable>();
                x.addAll(es.shutdownNow());
                x.addAll(se.shutdownNow());
                return x;
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public void close() {
                shutdownNow();
        }
}
