package com.p14n.shadowsync.broker;

/**
 * Thrown by broker operations attempted without a live connection.
 */
public class NotConnectedException extends RuntimeException {

    public NotConnectedException(String message) {
        super(message);
    }
}
