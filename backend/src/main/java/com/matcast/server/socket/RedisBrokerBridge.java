package com.matcast.server.socket;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matcast.server.service.HubMetrics;

/**
 * Redis pub/sub implementation of {@link BrokerBridge}.
 *
 * One Redis channel per hub channel ({@code <prefix>match:42}). Every message
 * is wrapped as {@code {sourceInstance, channel, payload}}, signed with
 * HMAC-SHA256 and sent as {@code {payload, signature}}. Inbound messages with
 * a bad signature are dropped; messages this instance published are skipped,
 * since the hub already delivered them locally.
 *
 * <h3>Reconnect state machine</h3>
 * <pre>
 *   DISCONNECTED --start--> CONNECTED --transport failure--> RECONNECTING
 *   RECONNECTING --ping ok + resubscribe--> CONNECTED
 *   RECONNECTING --attempt failed--> RECONNECTING (next attempt after backoff)
 * </pre>
 * A failure is any {@link DataAccessException} (connection failure, Redis
 * system error) from publish, subscribe, or the periodic liveness check.
 * While RECONNECTING, publishes are dropped and counted, and subscription
 * changes are only recorded. On reconnect the listener is
 * re-registered for the channels the hub reports as active at that moment.
 */
@Component
public class RedisBrokerBridge implements BrokerBridge, MessageListener {

    private static final Logger log = LoggerFactory.getLogger(RedisBrokerBridge.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final RedisConnectionFactory connectionFactory;
    private final ObjectMapper objectMapper;
    private final TaskScheduler scheduler;
    private final HubMetrics metrics;
    private final BrokerReconnectPolicy reconnectPolicy;
    private final SecretKeySpec hmacKey;
    private final String channelPrefix;
    private final Duration livenessInterval;

    private final AtomicReference<BrokerStatus> status = new AtomicReference<>(BrokerStatus.DISCONNECTED);
    private final Set<Channel> subscribed = ConcurrentHashMap.newKeySet();
    private final Object subscriptionMonitor = new Object();

    private volatile BrokerListener listener;
    private volatile ScheduledFuture<?> livenessTask;
    private volatile ScheduledFuture<?> reconnectTask;

    @Autowired
    public RedisBrokerBridge(StringRedisTemplate redisTemplate,
                             RedisMessageListenerContainer listenerContainer,
                             RedisConnectionFactory connectionFactory,
                             ObjectMapper objectMapper,
                             TaskScheduler taskScheduler,
                             HubMetrics metrics,
                             @Value("${matcast.jwt.secret}") String signingSecret,
                             @Value("${matcast.broker.channel-prefix:matcast:ws:}") String channelPrefix,
                             @Value("${matcast.broker.liveness-interval-ms:5000}") long livenessIntervalMs,
                             @Value("${matcast.broker.reconnect.initial-delay-ms:500}") long initialDelayMs,
                             @Value("${matcast.broker.reconnect.max-delay-ms:30000}") long maxDelayMs,
                             @Value("${matcast.broker.reconnect.multiplier:2.0}") double multiplier) {
        this(redisTemplate, listenerContainer, connectionFactory, objectMapper, taskScheduler, metrics,
                signingSecret, channelPrefix, Duration.ofMillis(livenessIntervalMs),
                BrokerReconnectPolicy.builder()
                        .initialDelay(Duration.ofMillis(initialDelayMs))
                        .maxDelay(Duration.ofMillis(maxDelayMs))
                        .multiplier(multiplier)
                        .build());
    }

    public RedisBrokerBridge(StringRedisTemplate redisTemplate,
                             RedisMessageListenerContainer listenerContainer,
                             RedisConnectionFactory connectionFactory,
                             ObjectMapper objectMapper,
                             TaskScheduler scheduler,
                             HubMetrics metrics,
                             String signingSecret,
                             String channelPrefix,
                             Duration livenessInterval,
                             BrokerReconnectPolicy reconnectPolicy) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.connectionFactory = connectionFactory;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.channelPrefix = channelPrefix;
        this.livenessInterval = livenessInterval;
        this.reconnectPolicy = reconnectPolicy;
        // Derive HMAC key from the token secret (distinct usage context)
        this.hmacKey = new SecretKeySpec(signingSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    // ==================== LIFECYCLE ====================

    @Override
    public void start(BrokerListener listener) {
        this.listener = listener;
        setStatus(BrokerStatus.CONNECTED);
        livenessTask = scheduler.scheduleWithFixedDelay(this::checkLiveness, livenessInterval);
        log.info("[Broker] Instance {} started (prefix '{}')", instanceId, channelPrefix);
    }

    @Override
    public void stop() {
        setStatus(BrokerStatus.DISCONNECTED);
        cancel(livenessTask);
        cancel(reconnectTask);
        synchronized (subscriptionMonitor) {
            subscribed.clear();
            try {
                listenerContainer.removeMessageListener(this);
            } catch (DataAccessException | IllegalStateException e) {
                log.debug("[Broker] Unsubscribe on stop failed: {}", e.getMessage());
            }
        }
        log.info("[Broker] Instance {} stopped", instanceId);
    }

    @Override
    public BrokerStatus status() {
        return status.get();
    }

    // ==================== PUBLISH ====================

    @Override
    public void publish(Channel channel, String payload) {
        if (status.get() == BrokerStatus.DISCONNECTED) {
            metrics.recordDroppedPublish();
            log.debug("[Broker] {} is stopped, dropped publish to {}", instanceId, channel);
            return;
        }
        // Attempted while RECONNECTING too: the transport may already be back.
        String envelope;
        try {
            envelope = seal(channel, payload);
        } catch (JsonProcessingException e) {
            log.error("[Broker] Failed to serialize envelope for {}: {}", channel, e.getMessage());
            metrics.recordDroppedPublish();
            return;
        }
        try {
            redisTemplate.convertAndSend(redisChannel(channel), envelope);
        } catch (DataAccessException e) {
            metrics.recordDroppedPublish();
            markDown("publish to " + channel, e);
        }
    }

    // ==================== SUBSCRIPTIONS ====================

    @Override
    public void subscribe(Channel channel) {
        synchronized (subscriptionMonitor) {
            subscribed.add(channel);
            if (status.get() != BrokerStatus.CONNECTED) {
                return;
            }
            try {
                listenerContainer.addMessageListener(this, topic(channel));
            } catch (DataAccessException | IllegalStateException e) {
                markDown("subscribe to " + channel, e);
            }
        }
    }

    @Override
    public void unsubscribe(Channel channel) {
        synchronized (subscriptionMonitor) {
            subscribed.remove(channel);
            if (status.get() != BrokerStatus.CONNECTED) {
                return;
            }
            try {
                listenerContainer.removeMessageListener(this, topic(channel));
            } catch (DataAccessException | IllegalStateException e) {
                markDown("unsubscribe from " + channel, e);
            }
        }
    }

    /** Channels this bridge currently wants delivered. */
    Set<Channel> subscriptions() {
        return new LinkedHashSet<>(subscribed);
    }

    // ==================== RECEIVE ====================

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String raw = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            SignedRelayEnvelope envelope = objectMapper.readValue(raw, SignedRelayEnvelope.class);
            if (envelope.payload == null || !constantTimeEquals(computeHmac(envelope.payload), envelope.signature)) {
                log.warn("[Broker] Dropping message with invalid signature on {}",
                        new String(message.getChannel(), StandardCharsets.UTF_8));
                return;
            }
            RelayMessage msg = objectMapper.readValue(envelope.payload, RelayMessage.class);

            // Already delivered locally by the publishing hub
            if (instanceId.equals(msg.sourceInstance)) {
                return;
            }

            BrokerListener target = listener;
            if (target != null) {
                target.onBrokerMessage(Channel.parse(msg.channel), msg.payload);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[Broker] Dropping malformed message: {}", e.getMessage());
        }
    }

    // ==================== RECONNECT ====================

    /**
     * Periodic liveness check while CONNECTED. Catches a dead connection even
     * when no one publishes.
     */
    void checkLiveness() {
        if (status.get() != BrokerStatus.CONNECTED) {
            return;
        }
        try {
            ping();
        } catch (DataAccessException e) {
            markDown("liveness check", e);
        }
    }

    void markDown(String operation, RuntimeException cause) {
        if (status.compareAndSet(BrokerStatus.CONNECTED, BrokerStatus.RECONNECTING)) {
            metrics.setBrokerStatus(BrokerStatus.RECONNECTING.name());
            log.warn("[Broker] Transport failure during {}: {}. Reconnecting.", operation, cause.getMessage());
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        Duration delay = reconnectPolicy.getNextDelay();
        reconnectTask = scheduler.schedule(this::attemptReconnect, Instant.now().plus(delay));
    }

    /**
     * One reconnect attempt: ping, then rebuild the subscriptions from the
     * hub's live channel set. Reschedules itself with backoff on failure.
     */
    void attemptReconnect() {
        if (status.get() != BrokerStatus.RECONNECTING) {
            return;
        }
        try {
            ping();
            int channels = resubscribeAll();
            int attempts = reconnectPolicy.getAttemptCount();
            reconnectPolicy.recordSuccess();
            if (status.compareAndSet(BrokerStatus.RECONNECTING, BrokerStatus.CONNECTED)) {
                metrics.setBrokerStatus(BrokerStatus.CONNECTED.name());
                metrics.recordBrokerReconnect();
                metrics.brokerRecovered();
                log.info("[Broker] Reconnected after {} failed attempts, resubscribed {} channels",
                        attempts, channels);
            }
        } catch (DataAccessException | IllegalStateException e) {
            reconnectPolicy.recordFailure();
            log.warn("[Broker] Reconnect attempt {} failed: {}. Next in {} ms",
                    reconnectPolicy.getAttemptCount(), e.getMessage(), reconnectPolicy.getNextDelay().toMillis());
            if (status.get() == BrokerStatus.RECONNECTING) {
                scheduleReconnect();
            }
        }
    }

    private int resubscribeAll() {
        synchronized (subscriptionMonitor) {
            Set<Channel> target = new LinkedHashSet<>(subscribed);
            BrokerListener current = listener;
            if (current != null) {
                target.addAll(current.activeChannels());
            }
            listenerContainer.removeMessageListener(this);
            for (Channel channel : target) {
                listenerContainer.addMessageListener(this, topic(channel));
            }
            subscribed.clear();
            subscribed.addAll(target);
            return target.size();
        }
    }

    private void ping() {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            connection.ping();
        }
    }

    // ==================== ENVELOPE ====================

    /**
     * Message as published by one hub instance.
     */
    public static class RelayMessage {
        public String sourceInstance;
        public String channel;
        public String payload;  // serialized WireMessage

        public RelayMessage() {}

        public RelayMessage(String sourceInstance, String channel, String payload) {
            this.sourceInstance = sourceInstance;
            this.channel = channel;
            this.payload = payload;
        }
    }

    /**
     * RelayMessage JSON plus its HMAC-SHA256 hex digest.
     */
    public static class SignedRelayEnvelope {
        public String payload;
        public String signature;

        public SignedRelayEnvelope() {}

        public SignedRelayEnvelope(String payload, String signature) {
            this.payload = payload;
            this.signature = signature;
        }
    }

    String seal(Channel channel, String payload) throws JsonProcessingException {
        String json = objectMapper.writeValueAsString(new RelayMessage(instanceId, channel.toString(), payload));
        return objectMapper.writeValueAsString(new SignedRelayEnvelope(json, computeHmac(json)));
    }

    String redisChannel(Channel channel) {
        return channelPrefix + channel;
    }

    private ChannelTopic topic(Channel channel) {
        return new ChannelTopic(redisChannel(channel));
    }

    private String computeHmac(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(hmacKey);
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC computation failed", e);
        }
    }

    private static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    private void setStatus(BrokerStatus next) {
        status.set(next);
        metrics.setBrokerStatus(next.name());
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }
}
