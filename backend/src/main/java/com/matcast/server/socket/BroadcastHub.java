package com.matcast.server.socket;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matcast.server.dto.ChannelStats;
import com.matcast.server.dto.MessageType;
import com.matcast.server.dto.WireMessage;
import com.matcast.server.exception.BrokerTransportException;
import com.matcast.server.exception.ConnectionSendException;
import com.matcast.server.service.HubMetrics;
import com.matcast.server.util.HubLogger;

/**
 * Single coordination point for connection membership and fan-out.
 *
 * <h3>Locking</h3>
 * <ul>
 *   <li>{@code membershipLock} orders every membership change together with
 *       the broker subscribe/unsubscribe it implies, so a channel is subscribed
 *       at the broker iff it has at least one local connection.</li>
 *   <li>{@code registryLock} guards the {@link ConnectionRegistry} maps. Held
 *       only for map reads and writes, never across socket or broker I/O.</li>
 * </ul>
 * Lock order is always membership, then registry. Fan-out copies the targets
 * under the registry lock and sends after releasing it, so one slow socket
 * never stalls the hub.
 *
 * <h3>Failure isolation</h3>
 * A failed send never aborts a broadcast. Failing connections are collected
 * and disconnected after the loop. {@link #disconnect} is idempotent.
 */
@Component
public class BroadcastHub implements SmartLifecycle, BrokerListener {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    public static final CloseStatus IDLE_TIMEOUT = new CloseStatus(4000, "Idle timeout");

    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final ReentrantLock registryLock = new ReentrantLock();
    private final ReentrantLock membershipLock = new ReentrantLock();

    private final BrokerBridge broker;
    private final HubMetrics metrics;
    private final ObjectMapper objectMapper;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration pingInterval;
    private final Duration idleTimeout;

    private volatile boolean running;
    private ScheduledFuture<?> sweepTask;

    @Autowired
    public BroadcastHub(BrokerBridge broker,
                        HubMetrics metrics,
                        ObjectMapper objectMapper,
                        TaskScheduler taskScheduler,
                        Clock clock,
                        @Value("${matcast.ws.ping-interval-seconds:25}") long pingIntervalSeconds,
                        @Value("${matcast.ws.idle-timeout-seconds:90}") long idleTimeoutSeconds) {
        this(broker, metrics, objectMapper, taskScheduler, clock,
                Duration.ofSeconds(pingIntervalSeconds), Duration.ofSeconds(idleTimeoutSeconds));
    }

    public BroadcastHub(BrokerBridge broker, HubMetrics metrics, ObjectMapper objectMapper,
                        TaskScheduler scheduler, Clock clock, Duration pingInterval, Duration idleTimeout) {
        this.broker = broker;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.clock = clock;
        this.pingInterval = pingInterval;
        this.idleTimeout = idleTimeout;
    }

    // ==================== LIFECYCLE ====================

    @Override
    public void start() {
        broker.start(this);
        sweepTask = scheduler.scheduleAtFixedRate(this::sweep, pingInterval);
        running = true;
        log.info("[Hub] Started (ping every {}s, idle timeout {}s)",
                pingInterval.getSeconds(), idleTimeout.getSeconds());
    }

    /**
     * Stop the sweep and the bridge, then drop every connection. Pending
     * sends are abandoned.
     */
    @Override
    public void stop() {
        running = false;
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        broker.stop();

        List<HubConnection> all;
        membershipLock.lock();
        try {
            registryLock.lock();
            try {
                all = registry.all();
                registry.clear();
            } finally {
                registryLock.unlock();
            }
        } finally {
            membershipLock.unlock();
        }
        for (HubConnection c : all) {
            c.close(CloseStatus.GOING_AWAY);
        }
        metrics.setActiveConnections(0);
        metrics.setActiveChannels(0);
        log.info("[Hub] Stopped, closed {} connections", all.size());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ==================== MEMBERSHIP ====================

    /**
     * Register a connection. For the first local connection of a channel the
     * broker subscription is issued before the connection becomes visible, so
     * no message published after this returns can be missed.
     *
     * @return false if the connection was already registered
     */
    public boolean connect(HubConnection connection) {
        Channel channel = connection.getChannel();
        ChannelStats stats;

        membershipLock.lock();
        try {
            boolean first;
            registryLock.lock();
            try {
                if (registry.contains(connection.getId())) {
                    return false;
                }
                first = !registry.hasChannel(channel);
            } finally {
                registryLock.unlock();
            }

            if (first) {
                subscribeQuietly(channel);
            }

            registryLock.lock();
            try {
                registry.add(connection, clock.millis());
                stats = registry.stats(channel);
                publishGauges();
            } finally {
                registryLock.unlock();
            }
        } finally {
            membershipLock.unlock();
        }

        HubLogger.logConnected(log, connection.getId(), channel.toString(), connection.getRole().wireName(),
                connection.getIdentity() != null ? connection.getIdentity().userId() : null, stats.clientCount());
        broadcastLocal(channel, serialize(statusMessage(channel, stats)));
        return true;
    }

    /**
     * Remove and close a connection. Safe to call any number of times; only
     * the first call changes counts or notifies the channel.
     *
     * @return true if this call removed the connection
     */
    public boolean disconnect(HubConnection connection, CloseStatus status, String reason) {
        Channel channel = connection.getChannel();
        boolean removed;
        boolean emptied = false;
        ChannelStats stats = null;

        membershipLock.lock();
        try {
            registryLock.lock();
            try {
                removed = registry.remove(connection.getId()) != null;
                if (removed) {
                    emptied = !registry.hasChannel(channel);
                    stats = registry.stats(channel);
                    publishGauges();
                }
            } finally {
                registryLock.unlock();
            }
            if (emptied) {
                unsubscribeQuietly(channel);
            }
        } finally {
            membershipLock.unlock();
        }

        connection.close(status);
        if (!removed) {
            return false;
        }

        HubLogger.logDisconnected(log, connection.getId(), channel.toString(), reason, stats.clientCount());
        if (!emptied) {
            broadcastLocal(channel, serialize(statusMessage(channel, stats)));
        }
        return true;
    }

    public void markActivity(HubConnection connection) {
        registryLock.lock();
        try {
            registry.touch(connection.getId(), clock.millis());
        } finally {
            registryLock.unlock();
        }
    }

    // ==================== PUBLISH ====================

    /**
     * Send to every process: hand the message to the broker and fan it out
     * locally right away. Other processes skip their own echo, so local
     * sockets see it once; the payload is a full snapshot either way.
     */
    public void publish(Channel channel, WireMessage message) {
        String json = serialize(message);
        metrics.recordPublished();
        try {
            broker.publish(channel, json);
        } catch (RuntimeException e) {
            log.warn("[Hub] Broker publish to {} failed: {}", channel, e.getMessage());
        }
        broadcastLocal(channel, json);
    }

    /**
     * Deliver to this process's sockets on {@code channel}.
     *
     * @return number of sockets written
     */
    public int broadcastLocal(Channel channel, String json) {
        long start = System.nanoTime();
        List<HubConnection> targets;
        registryLock.lock();
        try {
            targets = registry.members(channel);
        } finally {
            registryLock.unlock();
        }

        int delivered = 0;
        List<HubConnection> failed = new ArrayList<>();
        for (HubConnection c : targets) {
            try {
                c.send(json);
                delivered++;
            } catch (ConnectionSendException e) {
                log.debug("[Hub] Send to {} failed: {}", e.getConnectionId(), e.getMessage());
                failed.add(c);
            }
        }
        metrics.recordBroadcast(delivered, System.nanoTime() - start);

        for (HubConnection c : failed) {
            disconnect(c, CloseStatus.SESSION_NOT_RELIABLE, "send failed");
        }
        return delivered;
    }

    /**
     * Send to one connection only (replies, errors, initial snapshot).
     *
     * @return false if the send failed; the connection has then been disconnected
     */
    public boolean sendTo(HubConnection connection, WireMessage message) {
        try {
            connection.send(serialize(message));
            return true;
        } catch (ConnectionSendException e) {
            log.debug("[Hub] Direct send to {} failed: {}", e.getConnectionId(), e.getMessage());
            disconnect(connection, CloseStatus.SESSION_NOT_RELIABLE, "send failed");
            return false;
        }
    }

    @Override
    public void onBrokerMessage(Channel channel, String payload) {
        metrics.brokerDeliveryStarted();
        try {
            broadcastLocal(channel, payload);
        } finally {
            metrics.brokerDeliveryFinished();
        }
    }

    @Override
    public Set<Channel> activeChannels() {
        registryLock.lock();
        try {
            return registry.channels();
        } finally {
            registryLock.unlock();
        }
    }

    // ==================== HEARTBEAT ====================

    /**
     * Evict connections idle longer than the timeout and PING the rest.
     * A failed PING counts as an eviction.
     */
    public void sweep() {
        long now = clock.millis();
        long idleMillis = idleTimeout.toMillis();
        Map<HubConnection, Long> idle = new LinkedHashMap<>();
        List<HubConnection> alive = new ArrayList<>();

        registryLock.lock();
        try {
            for (HubConnection c : registry.all()) {
                Long last = registry.lastActivity(c.getId());
                long silentFor = last == null ? Long.MAX_VALUE : now - last;
                if (silentFor > idleMillis) {
                    idle.put(c, silentFor);
                } else {
                    alive.add(c);
                }
            }
        } finally {
            registryLock.unlock();
        }

        idle.forEach((c, silentFor) -> {
            HubLogger.logEvicted(log, c.getId(), c.getChannel().toString(), silentFor);
            if (disconnect(c, IDLE_TIMEOUT, "idle timeout")) {
                metrics.recordEvicted();
            }
        });

        for (HubConnection c : alive) {
            String ping = serialize(c.getChannel().message(MessageType.PING, Map.of(), clock.instant()));
            try {
                c.send(ping);
            } catch (ConnectionSendException e) {
                if (disconnect(c, CloseStatus.SESSION_NOT_RELIABLE, "ping failed")) {
                    metrics.recordEvicted();
                }
            }
        }
    }

    // ==================== STATS ====================

    public ChannelStats stats(Channel channel) {
        registryLock.lock();
        try {
            return registry.stats(channel);
        } finally {
            registryLock.unlock();
        }
    }

    int connectionCount() {
        registryLock.lock();
        try {
            return registry.size();
        } finally {
            registryLock.unlock();
        }
    }

    public BrokerStatus brokerStatus() {
        return broker.status();
    }

    // ==================== INTERNALS ====================

    private WireMessage statusMessage(Channel channel, ChannelStats stats) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("connected", true);
        data.put("clientCount", stats.clientCount());
        data.put("refereeCount", stats.refereeCount());
        data.put("viewerCount", stats.viewerCount());
        return channel.message(MessageType.CONNECTION_STATUS, data, clock.instant());
    }

    private void subscribeQuietly(Channel channel) {
        try {
            broker.subscribe(channel);
            HubLogger.logChannelSubscribed(log, channel.toString());
        } catch (BrokerTransportException e) {
            // the bridge resubscribes every active channel once it is back
            log.warn("[Hub] Subscribe to {} deferred: {}", channel, e.getMessage());
        }
    }

    private void unsubscribeQuietly(Channel channel) {
        try {
            broker.unsubscribe(channel);
            HubLogger.logChannelUnsubscribed(log, channel.toString());
        } catch (BrokerTransportException e) {
            log.warn("[Hub] Unsubscribe from {} deferred: {}", channel, e.getMessage());
        }
    }

    /** Caller holds the registry lock. */
    private void publishGauges() {
        metrics.setActiveConnections(registry.size());
        metrics.setActiveChannels(registry.channelCount());
    }

    String serialize(WireMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unserializable " + message.type() + " message", e);
        }
    }
}
