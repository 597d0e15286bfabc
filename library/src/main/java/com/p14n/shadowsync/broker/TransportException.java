package com.p14n.shadowsync.broker;

/**
 * An I/O failure reported by a {@link Transport}. The connection treats it as
 * a connection loss.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
