package com.matcast.server.socket;

import java.util.Set;

/**
 * Receiving side of a {@link BrokerBridge}; implemented by the hub.
 */
public interface BrokerListener {

    /** A message published by another process arrived for {@code channel}. */
    void onBrokerMessage(Channel channel, String payload);

    /** Channels with at least one local connection right now. */
    Set<Channel> activeChannels();
}
