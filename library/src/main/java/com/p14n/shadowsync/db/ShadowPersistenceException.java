package com.p14n.shadowsync.db;

public class ShadowPersistenceException extends RuntimeException {

    public ShadowPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
