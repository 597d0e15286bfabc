package com.p14n.shadowsync.notify;

import com.p14n.shadowsync.shadow.ShadowDelta;

/**
 * Pushes deltas to real-time client sessions, typically a WebSocket bridge.
 */
public interface SessionGateway {

    void pushToSession(String sessionId, ShadowDelta delta);
}
