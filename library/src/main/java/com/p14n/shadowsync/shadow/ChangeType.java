package com.p14n.shadowsync.shadow;

public enum ChangeType {
    ADDED,
    CHANGED,
    REMOVED
}
