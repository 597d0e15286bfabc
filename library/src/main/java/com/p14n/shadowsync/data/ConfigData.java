package com.p14n.shadowsync.data;

import java.util.Map;
import java.util.function.Function;

public record ConfigData(String exchangeName,
        String ingressQueue,
        String topicPrefix,
        long reconnectInitialDelayMillis,
        long reconnectMaxDelayMillis,
        boolean retryEnabled,
        int outboundBufferSize,
        int maxDeliveries,
        String deadLetterPrefix,
        int channelCapacity,
        boolean pruneAppliedDesired,
        String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName) implements ShadowSyncConfig {

    public ConfigData {
        if (reconnectInitialDelayMillis <= 0 || reconnectMaxDelayMillis < reconnectInitialDelayMillis) {
            throw new IllegalArgumentException("Reconnect delays must be positive and max >= initial");
        }
        if (outboundBufferSize < 0) {
            throw new IllegalArgumentException("Outbound buffer size cannot be negative");
        }
        if (maxDeliveries < 1) {
            throw new IllegalArgumentException("Max deliveries must be at least 1");
        }
        if (channelCapacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be at least 1");
        }
    }

    /**
     * In-memory configuration with every broker and store default and no
     * database.
     */
    public static ConfigData defaults() {
        return fromEnv(Map.of());
    }

    public ConfigData withDatabase(String host, int port, String user, String password, String name) {
        return new ConfigData(exchangeName, ingressQueue, topicPrefix, reconnectInitialDelayMillis,
                reconnectMaxDelayMillis, retryEnabled, outboundBufferSize, maxDeliveries, deadLetterPrefix,
                channelCapacity, pruneAppliedDesired, host, port, user, password, name);
    }

    public ConfigData withReconnectDelays(long initialMillis, long maxMillis) {
        return new ConfigData(exchangeName, ingressQueue, topicPrefix, initialMillis, maxMillis, retryEnabled,
                outboundBufferSize, maxDeliveries, deadLetterPrefix, channelCapacity, pruneAppliedDesired,
                dbHost, dbPort, dbUser, dbPassword, dbName);
    }

    public ConfigData withRetryEnabled(boolean enabled) {
        return new ConfigData(exchangeName, ingressQueue, topicPrefix, reconnectInitialDelayMillis,
                reconnectMaxDelayMillis, enabled, outboundBufferSize, maxDeliveries, deadLetterPrefix,
                channelCapacity, pruneAppliedDesired, dbHost, dbPort, dbUser, dbPassword, dbName);
    }

    public ConfigData withOutboundBufferSize(int size) {
        return new ConfigData(exchangeName, ingressQueue, topicPrefix, reconnectInitialDelayMillis,
                reconnectMaxDelayMillis, retryEnabled, size, maxDeliveries, deadLetterPrefix,
                channelCapacity, pruneAppliedDesired, dbHost, dbPort, dbUser, dbPassword, dbName);
    }

    public ConfigData withMaxDeliveries(int deliveries) {
        return new ConfigData(exchangeName, ingressQueue, topicPrefix, reconnectInitialDelayMillis,
                reconnectMaxDelayMillis, retryEnabled, outboundBufferSize, deliveries, deadLetterPrefix,
                channelCapacity, pruneAppliedDesired, dbHost, dbPort, dbUser, dbPassword, dbName);
    }

    public ConfigData withChannelCapacity(int capacity) {
        return new ConfigData(exchangeName, ingressQueue, topicPrefix, reconnectInitialDelayMillis,
                reconnectMaxDelayMillis, retryEnabled, outboundBufferSize, maxDeliveries, deadLetterPrefix,
                capacity, pruneAppliedDesired, dbHost, dbPort, dbUser, dbPassword, dbName);
    }

    public ConfigData withPruneAppliedDesired(boolean prune) {
        return new ConfigData(exchangeName, ingressQueue, topicPrefix, reconnectInitialDelayMillis,
                reconnectMaxDelayMillis, retryEnabled, outboundBufferSize, maxDeliveries, deadLetterPrefix,
                channelCapacity, prune, dbHost, dbPort, dbUser, dbPassword, dbName);
    }

    /**
     * Reads {@code SHADOWSYNC_*} variables, falling back to the interface
     * defaults for anything missing.
     *
     * @param env usually {@code System.getenv()}
     * @return the configuration
     */
    public static ConfigData fromEnv(Map<String, String> env) {
        ShadowSyncConfig d = new ShadowSyncConfig() {
            @Override
            public String dbHost() {
                return null;
            }

            @Override
            public int dbPort() {
                return 5432;
            }

            @Override
            public String dbUser() {
                return null;
            }

            @Override
            public String dbPassword() {
                return null;
            }

            @Override
            public String dbName() {
                return null;
            }
        };
        return new ConfigData(
                env.getOrDefault("SHADOWSYNC_EXCHANGE", d.exchangeName()),
                env.getOrDefault("SHADOWSYNC_INGRESS_QUEUE", d.ingressQueue()),
                env.getOrDefault("SHADOWSYNC_TOPIC_PREFIX", d.topicPrefix()),
                value(env, "SHADOWSYNC_RECONNECT_INITIAL_MS", Long::parseLong, d.reconnectInitialDelayMillis()),
                value(env, "SHADOWSYNC_RECONNECT_MAX_MS", Long::parseLong, d.reconnectMaxDelayMillis()),
                value(env, "SHADOWSYNC_RETRY_ENABLED", Boolean::parseBoolean, d.retryEnabled()),
                value(env, "SHADOWSYNC_OUTBOUND_BUFFER", Integer::parseInt, d.outboundBufferSize()),
                value(env, "SHADOWSYNC_MAX_DELIVERIES", Integer::parseInt, d.maxDeliveries()),
                env.getOrDefault("SHADOWSYNC_DEADLETTER_PREFIX", d.deadLetterPrefix()),
                value(env, "SHADOWSYNC_CHANNEL_CAPACITY", Integer::parseInt, d.channelCapacity()),
                value(env, "SHADOWSYNC_PRUNE_APPLIED_DESIRED", Boolean::parseBoolean, d.pruneAppliedDesired()),
                env.get("SHADOWSYNC_DB_HOST"),
                value(env, "SHADOWSYNC_DB_PORT", Integer::parseInt, d.dbPort()),
                env.getOrDefault("SHADOWSYNC_DB_USER", "postgres"),
                env.getOrDefault("SHADOWSYNC_DB_PASSWORD", "postgres"),
                env.getOrDefault("SHADOWSYNC_DB_NAME", "postgres"));
    }

    private static <T> T value(Map<String, String> env, String key, Function<String, T> parse, T fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return parse.apply(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }
}
