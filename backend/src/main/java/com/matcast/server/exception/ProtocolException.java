package com.matcast.server.exception;

/**
 * Thrown when an inbound frame cannot be decoded into a known command.
 * Answered with an ERROR frame; the connection stays open.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
