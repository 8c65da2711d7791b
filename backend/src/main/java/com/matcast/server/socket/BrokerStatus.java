package com.matcast.server.socket;

/**
 * States of the broker bridge's reconnect machine.
 * DISCONNECTED before start and after stop; otherwise CONNECTED or RECONNECTING.
 */
public enum BrokerStatus {
    DISCONNECTED,
    CONNECTED,
    RECONNECTING
}
