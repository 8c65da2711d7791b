package com.matcast.server.socket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;
import org.springframework.scheduling.TaskScheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matcast.server.service.HubMetrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class RedisBrokerBridgeTest {

    private static final String SECRET = "test-signing-secret-of-at-least-32-bytes!";
    private static final Channel M1 = Channel.match("m1");

    private StringRedisTemplate redis;
    private RedisMessageListenerContainer container;
    private RedisConnectionFactory connectionFactory;
    private RedisConnection connection;
    private TaskScheduler scheduler;
    private HubMetrics metrics;
    private BrokerReconnectPolicy policy;
    private FakeListener listener;
    private RedisBrokerBridge bridge;

    /** Records broker deliveries; its active channel set is set by the test. */
    static final class FakeListener implements BrokerListener {
        final List<String> delivered = new ArrayList<>();
        final Set<Channel> active = new LinkedHashSet<>();

        @Override
        public void onBrokerMessage(Channel channel, String payload) {
            delivered.add(channel + " " + payload);
        }

        @Override
        public Set<Channel> activeChannels() {
            return new LinkedHashSet<>(active);
        }
    }

    @BeforeEach
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        container = mock(RedisMessageListenerContainer.class);
        connectionFactory = mock(RedisConnectionFactory.class);
        connection = mock(RedisConnection.class);
        when(connectionFactory.getConnection()).thenReturn(connection);
        scheduler = mock(TaskScheduler.class);
        metrics = new HubMetrics(new SimpleMeterRegistry());
        policy = BrokerReconnectPolicy.builder()
                .initialDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(2))
                .multiplier(2.0)
                .build();
        listener = new FakeListener();
        bridge = newBridge(SECRET);
        bridge.start(listener);
    }

    private RedisBrokerBridge newBridge(String secret) {
        return new RedisBrokerBridge(redis, container, connectionFactory, new ObjectMapper(), scheduler, metrics,
                secret, "matcast:ws:", Duration.ofSeconds(5), policy);
    }

    private static DefaultMessage redisMessage(String body) {
        return new DefaultMessage("matcast:ws:match:m1".getBytes(StandardCharsets.UTF_8),
                body.getBytes(StandardCharsets.UTF_8));
    }

    private void failPublishes() {
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(redis).convertAndSend(anyString(), anyString());
    }

    // ==================== PUBLISH / SUBSCRIBE ====================

    @Test
    void startIsConnectedAndSchedulesLivenessCheck() {
        assertThat(bridge.status()).isEqualTo(BrokerStatus.CONNECTED);
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(5)));
    }

    @Test
    void publishSendsSignedEnvelopeToPrefixedChannel() {
        bridge.publish(M1, "{\"type\":\"MATCH_UPDATE\"}");

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(redis).convertAndSend(eq("matcast:ws:match:m1"), body.capture());
        assertThat(body.getValue()).contains("\"signature\"").contains("\"payload\"");
    }

    @Test
    void subscribeRegistersTopicForTheChannel() {
        bridge.subscribe(M1);

        ArgumentCaptor<Topic> topic = ArgumentCaptor.forClass(Topic.class);
        verify(container).addMessageListener(eq(bridge), topic.capture());
        assertThat(topic.getValue().getTopic()).isEqualTo("matcast:ws:match:m1");
        assertThat(bridge.subscriptions()).containsExactly(M1);
    }

    // ==================== RECEIVE ====================

    @Test
    @DisplayName("Messages from another instance are handed to the hub")
    void deliversForeignMessages() throws Exception {
        RedisBrokerBridge other = newBridge(SECRET);
        String envelope = other.seal(M1, "{\"n\":1}");

        bridge.onMessage(redisMessage(envelope), null);

        assertThat(listener.delivered).containsExactly("match:m1 {\"n\":1}");
    }

    @Test
    @DisplayName("A message this instance published is not delivered twice")
    void skipsOwnEcho() throws Exception {
        String envelope = bridge.seal(M1, "{\"n\":1}");

        bridge.onMessage(redisMessage(envelope), null);

        assertThat(listener.delivered).isEmpty();
    }

    @Test
    void dropsMessagesWithBadSignature() throws Exception {
        RedisBrokerBridge forger = newBridge("some-other-secret-that-is-32-bytes-long");
        String envelope = forger.seal(M1, "{\"n\":1}");

        bridge.onMessage(redisMessage(envelope), null);

        assertThat(listener.delivered).isEmpty();
    }

    @Test
    void dropsMalformedMessages() {
        bridge.onMessage(redisMessage("not json at all"), null);

        assertThat(listener.delivered).isEmpty();
    }

    // ==================== RECONNECT ====================

    @Test
    @DisplayName("A publish failure enters RECONNECTING and schedules a reconnect")
    void publishFailureStartsReconnect() {
        failPublishes();

        bridge.publish(M1, "{}");

        assertThat(bridge.status()).isEqualTo(BrokerStatus.RECONNECTING);
        assertThat(metrics.snapshot().brokerStatus()).isEqualTo("RECONNECTING");
        assertThat(metrics.snapshot().droppedPublishes()).isEqualTo(1);
        verify(scheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void publishesWhileReconnectingAreStillAttempted() {
        failPublishes();
        bridge.publish(M1, "{}");

        bridge.publish(M1, "{}");
        bridge.publish(M1, "{}");

        verify(redis, times(3)).convertAndSend(anyString(), anyString());
        verify(scheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
        assertThat(metrics.snapshot().droppedPublishes()).isEqualTo(3);
        assertThat(metrics.snapshot().brokerBacklog()).isEqualTo(3);
    }

    @Test
    void publishGoesThroughAsSoonAsRedisAcceptsAgain() {
        failPublishes();
        bridge.publish(M1, "{}");
        doReturn(1L).when(redis).convertAndSend(anyString(), anyString());

        bridge.publish(M1, "{\"type\":\"MATCH_UPDATE\"}");

        verify(redis, times(2)).convertAndSend(anyString(), anyString());
        assertThat(metrics.snapshot().droppedPublishes()).isEqualTo(1);
    }

    @Test
    @DisplayName("Drops of an outage stop counting as backlog once the broker is back")
    void backlogDrainsAfterReconnect() {
        failPublishes();
        for (int i = 0; i < 6; i++) {
            bridge.publish(M1, "{}");
        }
        assertThat(metrics.snapshot().brokerBacklog()).isEqualTo(6);

        bridge.attemptReconnect();

        assertThat(bridge.status()).isEqualTo(BrokerStatus.CONNECTED);
        assertThat(metrics.snapshot().brokerBacklog()).isZero();
        assertThat(metrics.snapshot().droppedPublishes()).isEqualTo(6);
    }

    @Test
    void subscriptionsWhileReconnectingAreOnlyRecorded() {
        failPublishes();
        bridge.publish(M1, "{}");

        bridge.subscribe(Channel.match("m2"));

        verify(container, never()).addMessageListener(eq(bridge), any(Topic.class));
        assertThat(bridge.subscriptions()).containsExactly(Channel.match("m2"));
    }

    @Test
    @DisplayName("A successful attempt resubscribes the hub's live channels and reconnects")
    void reconnectResubscribesActiveChannels() {
        bridge.subscribe(M1);
        failPublishes();
        bridge.publish(M1, "{}");
        listener.active.add(M1);
        listener.active.add(Channel.tournament("t1"));

        bridge.attemptReconnect();

        assertThat(bridge.status()).isEqualTo(BrokerStatus.CONNECTED);
        verify(container).removeMessageListener(bridge);
        ArgumentCaptor<Topic> topics = ArgumentCaptor.forClass(Topic.class);
        verify(container, times(3)).addMessageListener(eq(bridge), topics.capture());
        assertThat(topics.getAllValues()).extracting(Topic::getTopic)
                .containsExactly("matcast:ws:match:m1", "matcast:ws:match:m1", "matcast:ws:tournament:t1");
        assertThat(bridge.subscriptions()).containsExactlyInAnyOrder(M1, Channel.tournament("t1"));
        assertThat(metrics.snapshot().brokerReconnects()).isEqualTo(1);
        assertThat(policy.getAttemptCount()).isZero();
    }

    @Test
    @DisplayName("A failed attempt backs off and tries again")
    void failedAttemptReschedules() {
        failPublishes();
        bridge.publish(M1, "{}");
        when(connection.ping()).thenThrow(new RedisConnectionFailureException("still down"));

        bridge.attemptReconnect();

        assertThat(bridge.status()).isEqualTo(BrokerStatus.RECONNECTING);
        assertThat(policy.getAttemptCount()).isEqualTo(1);
        verify(scheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void failedLivenessCheckEntersReconnecting() {
        when(connection.ping()).thenThrow(new RedisConnectionFailureException("timeout"));

        bridge.checkLiveness();

        assertThat(bridge.status()).isEqualTo(BrokerStatus.RECONNECTING);
    }

    @Test
    void stopIsDisconnected() {
        bridge.subscribe(M1);

        bridge.stop();

        assertThat(bridge.status()).isEqualTo(BrokerStatus.DISCONNECTED);
        assertThat(bridge.subscriptions()).isEmpty();
        bridge.publish(M1, "{}");
        verify(redis, never()).convertAndSend(anyString(), anyString());
    }
}
