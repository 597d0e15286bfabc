package com.p14n.shadowsync.dispatch;

/**
 * The payload of an inbound message could not be decoded. Such messages are
 * acknowledged and discarded.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
