package com.matcast.server.socket;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.matcast.server.dto.ChannelStats;
import com.matcast.server.model.Role;

/**
 * In-memory membership for one hub: channel to connections, connection id to
 * connection, and connection id to last-activity time.
 *
 * Not thread-safe. Every call is made by {@link BroadcastHub} while holding its
 * registry lock; the three maps are only ever changed together. Read methods
 * return copies so callers can iterate after the lock is released.
 */
class ConnectionRegistry {

    private final Map<Channel, Set<HubConnection>> channels = new LinkedHashMap<>();
    private final Map<String, HubConnection> byId = new HashMap<>();
    private final Map<String, Long> lastActivity = new HashMap<>();

    /** @return false if a connection with the same id is already registered */
    boolean add(HubConnection connection, long nowMillis) {
        if (byId.putIfAbsent(connection.getId(), connection) != null) {
            return false;
        }
        channels.computeIfAbsent(connection.getChannel(), c -> new LinkedHashSet<>()).add(connection);
        lastActivity.put(connection.getId(), nowMillis);
        return true;
    }

    /** @return the removed connection, or null if it was not registered */
    HubConnection remove(String connectionId) {
        HubConnection connection = byId.remove(connectionId);
        if (connection == null) {
            return null;
        }
        lastActivity.remove(connectionId);
        Set<HubConnection> members = channels.get(connection.getChannel());
        if (members != null) {
            members.remove(connection);
            if (members.isEmpty()) {
                channels.remove(connection.getChannel());
            }
        }
        return connection;
    }

    boolean contains(String connectionId) {
        return byId.containsKey(connectionId);
    }

    boolean hasChannel(Channel channel) {
        return channels.containsKey(channel);
    }

    List<HubConnection> members(Channel channel) {
        Set<HubConnection> members = channels.get(channel);
        return members == null ? List.of() : new ArrayList<>(members);
    }

    List<HubConnection> all() {
        return new ArrayList<>(byId.values());
    }

    Set<Channel> channels() {
        return new LinkedHashSet<>(channels.keySet());
    }

    void touch(String connectionId, long nowMillis) {
        if (byId.containsKey(connectionId)) {
            lastActivity.put(connectionId, nowMillis);
        }
    }

    /** @return last activity in epoch millis, or null if unknown */
    Long lastActivity(String connectionId) {
        return lastActivity.get(connectionId);
    }

    int size() {
        return byId.size();
    }

    int channelCount() {
        return channels.size();
    }

    ChannelStats stats(Channel channel) {
        int referees = 0;
        int viewers = 0;
        for (HubConnection c : channels.getOrDefault(channel, Set.of())) {
            if (c.getRole() == Role.REFEREE) {
                referees++;
            } else {
                viewers++;
            }
        }
        return new ChannelStats(channel.toString(), referees + viewers, referees, viewers);
    }

    void clear() {
        channels.clear();
        byId.clear();
        lastActivity.clear();
    }
}
