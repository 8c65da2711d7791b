package com.matcast.server.service;

import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Service;

import com.matcast.server.dto.HubMetricsSnapshot;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer meters for the broadcast hub and the match state machine.
 *
 * Counters and timers are registered once in the constructor so the fan-out
 * path only does atomic increments. Gauges read plain atomics that the hub
 * and the broker bridge keep current; this class never calls back into them.
 *
 * Thread-safe: every field is an atomic or a Micrometer meter.
 *
 * Exposed via: /actuator/prometheus, /api/health, /api/metrics
 */
@Service
public class HubMetrics {

    // ===================== COUNTERS =====================

    private final Counter messagesPublished;
    private final Counter messagesBroadcast;
    private final Counter connectionsEvicted;
    private final Counter brokerReconnects;
    private final Counter matchesAutoFinished;
    private final Counter droppedPublishes;

    // ===================== TIMERS =====================

    private final Timer broadcastLatency;

    // ===================== GAUGE STATE =====================

    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicInteger activeChannels = new AtomicInteger();
    private final AtomicLong brokerInFlight = new AtomicLong();
    private final AtomicLong outageDrops = new AtomicLong();
    private final AtomicLong lastBroadcastLatencyNanos = new AtomicLong();
    private volatile String brokerStatus = "DISCONNECTED";

    // ===================== CONSTRUCTION =====================

    public HubMetrics(MeterRegistry registry) {

        this.messagesPublished = Counter.builder("hub.messages.published")
                .description("Messages handed to Hub.publish (local fan-out plus broker)")
                .register(registry);

        this.messagesBroadcast = Counter.builder("hub.messages.broadcast")
                .description("Individual socket deliveries performed by local fan-out")
                .register(registry);

        this.connectionsEvicted = Counter.builder("hub.connections.evicted")
                .description("Connections removed by the heartbeat sweep (idle or failed ping)")
                .register(registry);

        this.brokerReconnects = Counter.builder("hub.broker.reconnects")
                .description("Successful broker reconnects after a transport failure")
                .register(registry);

        this.matchesAutoFinished = Counter.builder("match.auto_finished")
                .description("Matches finished by the system rather than a referee")
                .register(registry);

        this.droppedPublishes = Counter.builder("hub.broker.dropped_publishes")
                .description("Publishes the broker did not accept")
                .register(registry);

        this.broadcastLatency = Timer.builder("hub.broadcast.latency")
                .description("Time to fan one message out to a channel's local connections")
                .publishPercentileHistogram()
                .register(registry);

        registry.gauge("hub.connections.current", activeConnections);
        registry.gauge("hub.channels.current", activeChannels);
        registry.gauge("hub.broker.backlog", this, HubMetrics::brokerBacklog);
        registry.gauge("hub.broadcast.latency.last.ms", this, HubMetrics::lastBroadcastLatencyMs);
        registry.gauge("hub.broker.connected", this, m -> "CONNECTED".equals(m.brokerStatus) ? 1 : 0);
    }

    // ===================== RECORDING API =====================

    public void recordPublished()      { messagesPublished.increment(); }
    public void recordEvicted()        { connectionsEvicted.increment(); }
    public void recordBrokerReconnect() { brokerReconnects.increment(); }
    public void recordAutoFinished()   { matchesAutoFinished.increment(); }

    /** A publish the broker did not take. Counts towards the backlog until the broker recovers. */
    public void recordDroppedPublish() {
        droppedPublishes.increment();
        outageDrops.incrementAndGet();
    }

    /** The broker is back; drops of the finished outage no longer count as backlog. */
    public void brokerRecovered() {
        outageDrops.set(0);
    }

    /**
     * Record one completed local fan-out.
     *
     * @param deliveries sockets the message was written to
     * @param nanos      wall time of the whole fan-out
     */
    public void recordBroadcast(int deliveries, long nanos) {
        if (deliveries > 0) {
            messagesBroadcast.increment(deliveries);
        }
        broadcastLatency.record(nanos, TimeUnit.NANOSECONDS);
        lastBroadcastLatencyNanos.set(nanos);
    }

    public void setActiveConnections(int count) { activeConnections.set(count); }
    public void setActiveChannels(int count)    { activeChannels.set(count); }
    public void setBrokerStatus(String status)  { this.brokerStatus = status; }

    // ── Broker deliveries received but not yet fanned out ──

    public void brokerDeliveryStarted()  { brokerInFlight.incrementAndGet(); }
    public void brokerDeliveryFinished() { brokerInFlight.decrementAndGet(); }

    // ===================== READ API =====================

    /** Deliveries in flight plus publishes dropped during the current outage. */
    public long brokerBacklog() {
        return brokerInFlight.get() + outageDrops.get();
    }

    public double lastBroadcastLatencyMs() {
        return lastBroadcastLatencyNanos.get() / 1_000_000.0;
    }

    public HubMetricsSnapshot snapshot() {
        return new HubMetricsSnapshot(
                activeConnections.get(),
                activeChannels.get(),
                (long) messagesPublished.count(),
                (long) messagesBroadcast.count(),
                lastBroadcastLatencyMs(),
                brokerBacklog(),
                (long) droppedPublishes.count(),
                (long) connectionsEvicted.count(),
                (long) brokerReconnects.count(),
                brokerStatus,
                (long) matchesAutoFinished.count(),
                Instant.now().toString());
    }
}
