package com.p14n.shadowsync.shadow;

/**
 * Receives every non-empty delta after the new document has been saved.
 * Called while the device is locked, so deltas of one device arrive in
 * version order; implementations must not block.
 */
@FunctionalInterface
public interface ShadowDeltaListener {

    void onDelta(String deviceId, ShadowDelta delta);
}
