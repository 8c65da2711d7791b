package com.matcast.server.exception;

/**
 * Raised when the message broker cannot be reached. Triggers a bridge reconnect,
 * never a process shutdown.
 */
public class BrokerTransportException extends RuntimeException {

    public BrokerTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
