package com.matcast.server.dto;

/**
 * Read-only view of the hub counters at one instant.
 */
public record HubMetricsSnapshot(
        int activeConnections,
        int activeChannels,
        long messagesPublished,
        long messagesBroadcast,
        double lastBroadcastLatencyMs,
        long brokerBacklog,
        long droppedPublishes,
        long evictedConnections,
        long brokerReconnects,
        String brokerStatus,
        long autoFinishedMatches,
        String timestamp
) {
}
