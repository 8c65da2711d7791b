package com.matcast.server.dto;

/**
 * Local (this process only) membership of one channel. Also the payload of
 * CONNECTION_STATUS frames, with {@code connected} describing the receiver.
 */
public record ChannelStats(String channel, int clientCount, int refereeCount, int viewerCount) {
}
