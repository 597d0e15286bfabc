package com.p14n.shadowsync.shadow;

/**
 * A shadow operation targeted a device the registry does not know.
 */
public class DeviceNotFoundException extends RuntimeException {

    private final String deviceId;

    public DeviceNotFoundException(String deviceId) {
        super("Device " + deviceId + " is not registered");
        this.deviceId = deviceId;
    }

    public String deviceId() {
        return deviceId;
    }
}
