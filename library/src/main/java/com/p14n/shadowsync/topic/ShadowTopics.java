package com.p14n.shadowsync.topic;

import java.util.Optional;

/**
 * Builds and parses the shadow topic names
 * {@code <prefix>.<deviceId>.shadow.(reported|desired|update)}.
 */
public class ShadowTopics {

    public static final String DEFAULT_PREFIX = "devices";
    public static final String SHADOW = "shadow";
    public static final String REPORTED = "reported";
    public static final String DESIRED = "desired";
    public static final String UPDATE = "update";

    private final String prefix;

    public ShadowTopics() {
        this(DEFAULT_PREFIX);
    }

    public ShadowTopics(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Topic prefix cannot be null or empty");
        }
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String reported(String deviceId) {
        return topic(deviceId, REPORTED);
    }

    public String desired(String deviceId) {
        return topic(deviceId, DESIRED);
    }

    public String update(String deviceId) {
        return topic(deviceId, UPDATE);
    }

    public String reportedPattern() {
        return prefix + ".*." + SHADOW + "." + REPORTED;
    }

    public String desiredPattern() {
        return prefix + ".*." + SHADOW + "." + DESIRED;
    }

    public String updatePattern() {
        return prefix + ".*." + SHADOW + "." + UPDATE;
    }

    public String allDevicesPattern() {
        return prefix + "." + TopicPattern.MULTI_WILDCARD;
    }

    public String devicePattern(String deviceId) {
        return prefix + "." + validDeviceId(deviceId) + "." + TopicPattern.MULTI_WILDCARD;
    }

    /**
     * Extracts the device id from a shadow topic.
     *
     * @param topic a topic of the form {@code <prefix>.<deviceId>.shadow.<kind>}
     * @return the device id, or empty if the topic is not a shadow topic
     */
    public Optional<String> deviceIdOf(String topic) {
        return segmentsOf(topic).map(s -> s[prefixSegments()]);
    }

    /**
     * Extracts the trailing kind ({@code reported}, {@code desired},
     * {@code update}) from a shadow topic.
     */
    public Optional<String> kindOf(String topic) {
        return segmentsOf(topic).map(s -> s[s.length - 1]);
    }

    private Optional<String[]> segmentsOf(String topic) {
        if (topic == null || !topic.startsWith(prefix + ".")) {
            return Optional.empty();
        }
        String[] segments = topic.split("\\.", -1);
        int p = prefixSegments();
        if (segments.length != p + 3 || segments[p].isEmpty() || !SHADOW.equals(segments[p + 1])) {
            return Optional.empty();
        }
        return Optional.of(segments);
    }

    private int prefixSegments() {
        return prefix.split("\\.", -1).length;
    }

    private String topic(String deviceId, String kind) {
        return prefix + "." + validDeviceId(deviceId) + "." + SHADOW + "." + kind;
    }

    /**
     * Validates a device identifier for use as a single topic segment.
     *
     * @throws IllegalArgumentException if the id is empty or contains a
     *                                  separator or wildcard character
     */
    public static String validDeviceId(String deviceId) {
        if (deviceId == null || deviceId.isEmpty()) {
            throw new IllegalArgumentException("Device id cannot be null or empty");
        }
        if (deviceId.contains(TopicPattern.SEPARATOR)
                || deviceId.contains(TopicPattern.SINGLE_WILDCARD)
                || deviceId.contains(TopicPattern.MULTI_WILDCARD)) {
            throw new IllegalArgumentException("Device id cannot contain '.', '*' or '#': " + deviceId);
        }
        return deviceId;
    }
}
