package com.p14n.shadowsync.shadow;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.shadowsync.data.RoutedMessage;
import com.p14n.shadowsync.subscription.MessageSubscriber;
import com.p14n.shadowsync.topic.ShadowTopics;

/**
 * Feeds reported or desired state messages into the store. The body is a JSON
 * object of property values; the envelope timestamp is the assertion time.
 *
 * <p>
 * Messages that can never succeed (a non-object body, an unknown or inactive
 * device, an invalid property name) are logged and consumed rather than
 * retried.
 * </p>
 */
public class ShadowUpdateSubscriber implements MessageSubscriber<RoutedMessage> {

    private static final Logger logger = LoggerFactory.getLogger(ShadowUpdateSubscriber.class);

    private final ShadowDocumentStore store;
    private final ShadowTopics topics;
    private final Section section;
    private final LongSupplier clock;

    public ShadowUpdateSubscriber(ShadowDocumentStore store, ShadowTopics topics, Section section,
            LongSupplier clock) {
        this.store = store;
        this.topics = topics;
        this.section = section;
        this.clock = clock;
    }

    @Override
    public void onMessage(RoutedMessage message) {
        Optional<String> deviceId = topics.deviceIdOf(message.topic());
        if (deviceId.isEmpty()) {
            logger.atWarn().addArgument(message.topic()).log("Ignoring {}: not a device shadow topic");
            return;
        }
        JsonNode payload = message.payload();
        if (!payload.isObject()) {
            logger.atWarn().addArgument(section.key()).addArgument(deviceId.get())
                    .log("Ignoring {} state for {}: body is not a JSON object");
            return;
        }
        long timestamp = message.timestamp() > 0 ? message.timestamp() : clock.getAsLong();
        Map<String, JsonNode> properties = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = payload.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> field = it.next();
            properties.put(field.getKey(), field.getValue());
        }
        try {
            ShadowDelta delta = section == Section.REPORTED
                    ? store.applyReported(deviceId.get(), properties, timestamp)
                    : store.applyDesired(deviceId.get(), properties, timestamp);
            logger.atDebug().addArgument(section.key()).addArgument(deviceId.get())
                    .addArgument(delta.toVersion())
                    .log("Applied {} state for {} at version {}");
        } catch (DeviceNotFoundException e) {
            logger.atWarn().addArgument(section.key()).addArgument(deviceId.get())
                    .log("Ignoring {} state for unknown device {}");
        } catch (IllegalStateException | IllegalArgumentException e) {
            logger.atWarn().addArgument(section.key()).addArgument(deviceId.get()).addArgument(e.getMessage())
                    .log("Rejected {} state for {}: {}");
        }
    }
}
