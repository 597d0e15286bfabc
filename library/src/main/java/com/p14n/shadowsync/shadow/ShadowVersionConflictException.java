package com.p14n.shadowsync.shadow;

/**
 * The shadow's version was not the one the caller expected, or changed
 * underneath the write.
 */
public class ShadowVersionConflictException extends RuntimeException {

    private final String deviceId;
    private final long expectedVersion;
    private final long actualVersion;

    public ShadowVersionConflictException(String deviceId, long expectedVersion, long actualVersion) {
        super("Version conflict for " + deviceId + ": expected " + expectedVersion + ", found " + actualVersion);
        this.deviceId = deviceId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String deviceId() {
        return deviceId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
