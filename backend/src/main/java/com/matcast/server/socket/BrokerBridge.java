package com.matcast.server.socket;

/**
 * Shared publish/subscribe bus connecting hub processes.
 *
 * Implementations never throw from {@link #publish}: delivery is best effort
 * and a failure only changes {@link #status()}. While the transport is down,
 * subscribe and unsubscribe are recorded and applied on reconnect.
 */
public interface BrokerBridge {

    void start(BrokerListener listener);

    void stop();

    void publish(Channel channel, String payload);

    void subscribe(Channel channel);

    void unsubscribe(Channel channel);

    BrokerStatus status();
}
