package com.p14n.shadowsync.shadow;

public interface DeviceRegistry {

    boolean exists(String deviceId);
}
