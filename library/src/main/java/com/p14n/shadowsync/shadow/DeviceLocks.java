package com.p14n.shadowsync.shadow;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * One lock object per device id. Work for the same device is serialized;
 * different devices never contend.
 */
public class DeviceLocks {

    private final Map<String, Object> deviceLocks = new ConcurrentHashMap<>();

    public Object lockFor(String deviceId) {
        return deviceLocks.computeIfAbsent(deviceId, key -> new Object());
    }

    public <T> T withLock(String deviceId, Supplier<T> action) {
        synchronized (lockFor(deviceId)) {
            return action.get();
        }
    }
}
