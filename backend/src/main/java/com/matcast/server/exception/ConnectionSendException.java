package com.matcast.server.exception;

/**
 * A send to one specific client socket failed. Only that socket is disconnected.
 */
public class ConnectionSendException extends RuntimeException {
    private final String connectionId;

    public ConnectionSendException(String connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
