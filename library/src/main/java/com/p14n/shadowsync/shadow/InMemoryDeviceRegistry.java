package com.p14n.shadowsync.shadow;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDeviceRegistry implements DeviceRegistry {

    private final Set<String> devices = ConcurrentHashMap.newKeySet();

    public InMemoryDeviceRegistry() {
    }

    public InMemoryDeviceRegistry(Collection<String> deviceIds) {
        deviceIds.forEach(this::add);
    }

    /**
     * @return true if the device was not already registered
     */
    public boolean add(String deviceId) {
        if (deviceId == null || deviceId.isEmpty()) {
            throw new IllegalArgumentException("Device id cannot be null or empty");
        }
        return devices.add(deviceId);
    }

    public boolean remove(String deviceId) {
        return devices.remove(deviceId);
    }

    @Override
    public boolean exists(String deviceId) {
        return deviceId != null && devices.contains(deviceId);
    }
}
