package com.p14n.shadowsync.shadow;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.shadowsync.codec.JsonUtil;
import com.p14n.shadowsync.telemetry.ShadowMetrics;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Holds the authoritative shadow of every device and applies mutations to it
 * under a per-device lock.
 *
 * <p>
 * Every mutation loads the current document, reconciles the change with
 * {@link ShadowReconciler}, saves the result if anything changed and hands
 * non-empty deltas to the registered {@link ShadowDeltaListener}s. Listener
 * failures are logged and never fail the mutation. If the repository refuses
 * the save because it already holds a newer version, the mutation is
 * reconciled again against that version; listeners only ever see deltas that
 * were stored.
 * </p>
 */
public class ShadowDocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(ShadowDocumentStore.class);

    static final int SAVE_ATTEMPTS = 3;

    private final ShadowRepository repository;
    private final DeviceRegistry deviceRegistry;
    private final ShadowReconciler reconciler;
    private final DeviceLocks locks = new DeviceLocks();
    private final List<ShadowDeltaListener> listeners = new CopyOnWriteArrayList<>();
    private final LongSupplier clock;
    private final ShadowMetrics metrics;

    public ShadowDocumentStore(ShadowRepository repository, DeviceRegistry deviceRegistry,
            boolean pruneAppliedDesired, OpenTelemetry ot) {
        this(repository, deviceRegistry, pruneAppliedDesired, System::currentTimeMillis, ot);
    }

    public ShadowDocumentStore(ShadowRepository repository, DeviceRegistry deviceRegistry,
            boolean pruneAppliedDesired, LongSupplier clock, OpenTelemetry ot) {
        if (repository == null) {
            throw new IllegalArgumentException("Repository cannot be null");
        }
        if (deviceRegistry == null) {
            throw new IllegalArgumentException("Device registry cannot be null");
        }
        this.repository = repository;
        this.deviceRegistry = deviceRegistry;
        this.reconciler = new ShadowReconciler(pruneAppliedDesired);
        this.clock = clock;
        this.metrics = new ShadowMetrics(ot.getMeter("shadowsync-shadow"));
    }

    public void addDeltaListener(ShadowDeltaListener listener) {
        listeners.add(listener);
    }

    /**
     * Merges properties asserted by the device.
     *
     * @param properties property values; a null value removes the property
     * @param timestamp  when the device asserted them, epoch millis
     * @return the changes made, empty if nothing was newer than stored state
     * @throws DeviceNotFoundException if the device is not registered
     * @throws IllegalStateException   if the device has been deactivated
     */
    public ShadowDelta applyReported(String deviceId, Map<String, ?> properties, long timestamp) {
        Map<String, JsonNode> values = toNodes(properties);
        return mutate(deviceId, "reported",
                document -> reconciler.applyReported(document, values, timestamp, clock.getAsLong()));
    }

    /**
     * Merges values requested by an operator. Each changed property is stored
     * as pending until the device reports the same value.
     */
    public ShadowDelta applyDesired(String deviceId, Map<String, ?> properties, long timestamp) {
        Map<String, JsonNode> values = toNodes(properties);
        return mutate(deviceId, "desired",
                document -> reconciler.applyDesired(document, values, timestamp, clock.getAsLong()));
    }

    /**
     * As {@link #applyDesired(String, Map, long)}, but only if the shadow is
     * still at {@code expectedVersion}.
     *
     * @throws ShadowVersionConflictException if the shadow has moved on
     */
    public ShadowDelta applyDesired(String deviceId, Map<String, ?> properties, long timestamp,
            long expectedVersion) {
        Map<String, JsonNode> values = toNodes(properties);
        return mutate(deviceId, "desired", document -> {
            if (document.version() != expectedVersion) {
                metrics.recordConflict("desired");
                throw new ShadowVersionConflictException(deviceId, expectedVersion, document.version());
            }
            return reconciler.applyDesired(document, values, timestamp, clock.getAsLong());
        });
    }

    public void markApplied(String deviceId, Collection<String> propertyNames) {
        mutate(deviceId, "applied",
                document -> reconciler.markApplied(document, propertyNames, clock.getAsLong()));
    }

    public ShadowDelta clearDesired(String deviceId, Collection<String> propertyNames) {
        return mutate(deviceId, "clear-desired",
                document -> reconciler.clearDesired(document, propertyNames, clock.getAsLong()));
    }

    /**
     * Returns the device's shadow, or an empty version 0 document if nothing
     * has been stored for it yet.
     */
    public ShadowDocument get(String deviceId) {
        requireRegistered(deviceId);
        return repository.loadShadow(deviceId)
                .orElseGet(() -> ShadowDocument.create(deviceId, clock.getAsLong()));
    }

    /**
     * Previously saved versions of the device's shadow, newest first.
     */
    public List<ShadowDocument> history(String deviceId, int limit) {
        requireRegistered(deviceId);
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
        return repository.history(deviceId, limit);
    }

    /**
     * Desired values the device has not reported yet.
     */
    public Map<String, JsonNode> pendingDelta(String deviceId) {
        return get(deviceId).pendingDelta();
    }

    /**
     * Creates the version 0 document for a newly registered device. Does
     * nothing if one exists.
     */
    public ShadowDocument register(String deviceId) {
        requireRegistered(deviceId);
        return locks.withLock(deviceId, () -> repository.loadShadow(deviceId).orElseGet(() -> {
            ShadowDocument created = ShadowDocument.create(deviceId, clock.getAsLong());
            if (!repository.saveShadow(created)) {
                return load(deviceId);
            }
            logger.atInfo().addArgument(deviceId).log("Created shadow for {}");
            return created;
        }));
    }

    /**
     * Marks the shadow inactive. Its state is kept but further mutations are
     * rejected.
     */
    public void deactivate(String deviceId) {
        requireRegistered(deviceId);
        locks.withLock(deviceId, () -> {
            ShadowDocument current = null;
            for (int attempt = 0; attempt < SAVE_ATTEMPTS; attempt++) {
                current = load(deviceId);
                if (!current.active()) {
                    return null;
                }
                if (repository.saveShadow(current.deactivated(clock.getAsLong()))) {
                    logger.atInfo().addArgument(deviceId).log("Deactivated shadow for {}");
                    return null;
                }
            }
            throw new ShadowVersionConflictException(deviceId, current.version(), load(deviceId).version());
        });
    }

    private ShadowDelta mutate(String deviceId, String kind, Function<ShadowDocument, Reconciliation> change) {
        requireRegistered(deviceId);
        return locks.withLock(deviceId, () -> {
            Reconciliation result = null;
            ShadowDocument current = null;
            for (int attempt = 0; attempt < SAVE_ATTEMPTS && result == null; attempt++) {
                current = load(deviceId);
                if (!current.active()) {
                    throw new IllegalStateException("Shadow for device " + deviceId + " is inactive");
                }
                Reconciliation candidate = change.apply(current);
                if (!candidate.modified() || repository.saveShadow(candidate.document())) {
                    result = candidate;
                } else {
                    logger.atWarn().addArgument(deviceId).addArgument(current.version())
                            .log("Shadow for {} moved past version {} while saving, retrying");
                }
            }
            if (result == null) {
                metrics.recordConflict(kind);
                throw new ShadowVersionConflictException(deviceId, current.version(),
                        load(deviceId).version());
            }
            ShadowDelta delta = result.delta();
            if (delta.isEmpty()) {
                metrics.recordNoop(kind);
                logger.atDebug().addArgument(kind).addArgument(deviceId).addArgument(current.version())
                        .log("No {} change for {} at version {}");
            } else {
                metrics.recordMutation(kind);
                logger.atDebug().addArgument(deviceId).addArgument(delta.fromVersion())
                        .addArgument(delta.toVersion()).addArgument(delta.changes().size())
                        .log("Shadow {} {} -> {} with {} changes");
                notifyListeners(deviceId, delta);
            }
            return delta;
        });
    }

    private void notifyListeners(String deviceId, ShadowDelta delta) {
        for (ShadowDeltaListener listener : listeners) {
            try {
                listener.onDelta(deviceId, delta);
            } catch (RuntimeException e) {
                logger.atError().setCause(e).addArgument(deviceId).log("Delta listener failed for {}");
            }
        }
    }

    private ShadowDocument load(String deviceId) {
        return repository.loadShadow(deviceId)
                .orElseGet(() -> ShadowDocument.create(deviceId, clock.getAsLong()));
    }

    private void requireRegistered(String deviceId) {
        if (deviceId == null || deviceId.isEmpty()) {
            throw new IllegalArgumentException("Device id cannot be null or empty");
        }
        if (!deviceRegistry.exists(deviceId)) {
            throw new DeviceNotFoundException(deviceId);
        }
    }

    private static Map<String, JsonNode> toNodes(Map<String, ?> properties) {
        if (properties == null) {
            throw new IllegalArgumentException("Properties cannot be null");
        }
        Map<String, JsonNode> nodes = new LinkedHashMap<>();
        properties.forEach((name, value) -> nodes.put(name, value == null ? null : JsonUtil.toNode(value)));
        return nodes;
    }
}
