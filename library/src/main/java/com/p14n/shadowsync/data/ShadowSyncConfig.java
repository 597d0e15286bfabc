package com.p14n.shadowsync.data;

/**
 * Configuration for the shadow synchronization engine. Only the database
 * settings have no default.
 */
public interface ShadowSyncConfig {

    /**
     * Name of the topic exchange all routing goes through.
     */
    default String exchangeName() {
        return "shadowsync.events";
    }

    /**
     * Queue the engine consumes device traffic from.
     */
    default String ingressQueue() {
        return "shadowsync.ingress";
    }

    /**
     * Pattern the ingress queue is bound with.
     */
    default String ingressPattern() {
        return topicPrefix() + ".#";
    }

    default String topicPrefix() {
        return "devices";
    }

    default long reconnectInitialDelayMillis() {
        return 100;
    }

    default long reconnectMaxDelayMillis() {
        return 30_000;
    }

    /**
     * When false, publishing during a connection outage fails instead of
     * buffering.
     */
    default boolean retryEnabled() {
        return true;
    }

    default int outboundBufferSize() {
        return 1000;
    }

    /**
     * Delivery attempts before a failing message is dead-lettered.
     */
    default int maxDeliveries() {
        return 5;
    }

    default String deadLetterPrefix() {
        return "deadletter";
    }

    /**
     * Capacity of each lane of a subscription's pending-message channel. Also
     * the prefetch of the ingress queue, so ingestion never overflows a lane.
     */
    default int channelCapacity() {
        return 256;
    }

    /**
     * Lanes the reported and desired handlers spread devices over. Updates to
     * one device are applied in order; a slow device only holds up devices
     * sharing its lane.
     */
    default int ingestLanes() {
        return 16;
    }

    /**
     * Whether desired properties are removed from stored state once the
     * device reports the requested value.
     */
    default boolean pruneAppliedDesired() {
        return false;
    }

    String dbHost();

    int dbPort();

    String dbUser();

    String dbPassword();

    String dbName();

    default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }

    /**
     * Whether a database has been configured for shadow persistence.
     */
    default boolean hasDatabase() {
        return dbHost() != null && !dbHost().isBlank();
    }
}
