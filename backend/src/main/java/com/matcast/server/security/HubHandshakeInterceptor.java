package com.matcast.server.security;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import com.matcast.server.model.Role;
import com.matcast.server.socket.Channel;
import com.matcast.server.socket.ChannelKind;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.jsonwebtoken.JwtException;

/**
 * Gatekeeper for {@code /ws/match/{id}} and {@code /ws/tournament/{id}}.
 *
 * Rejects with 429 when the client IP exceeds the connect rate, 401 without a
 * valid token, 400 for an unknown path. On success the session attributes
 * carry the {@link HubIdentity}, the {@link Channel} and the effective
 * {@link Role}: REFEREE only when {@code ?role=referee} is asked for AND the
 * token's role claim is {@code referee}.
 *
 * The token can be provided as:
 *   1. Query parameter: /ws/match/42?token=eyJ...
 *   2. Authorization header: Bearer eyJ...
 */
@Component
public class HubHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(HubHandshakeInterceptor.class);

    public static final String ATTR_IDENTITY = "matcast.identity";
    public static final String ATTR_CHANNEL = "matcast.channel";
    public static final String ATTR_ROLE = "matcast.role";

    private final JwtUtil jwtUtil;
    private final int connectAttemptsPerMinute;
    private final ConcurrentHashMap<String, Bucket> connectBuckets = new ConcurrentHashMap<>();

    public HubHandshakeInterceptor(
            JwtUtil jwtUtil,
            @Value("${matcast.ws.connect-rate-limit:20}") int connectAttemptsPerMinute) {
        this.jwtUtil = jwtUtil;
        this.connectAttemptsPerMinute = connectAttemptsPerMinute;
    }

    @Override
    public boolean beforeHandshake(
            @NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @NonNull Map<String, Object> attributes
    ) {
        String clientIp = extractClientIp(request);
        if (!tryConsumeConnectToken(clientIp)) {
            log.warn("[WS Auth] Connect rate limited for IP: {}", clientIp);
            response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
            return false;
        }

        Channel channel = channelFromPath(request.getURI().getPath());
        if (channel == null) {
            log.warn("[WS Auth] Unknown channel path: {}", request.getURI().getPath());
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams();

        String token = extractToken(request, query);
        if (token == null || token.isBlank()) {
            log.warn("[WS Auth] No token in handshake for {}", channel);
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        HubIdentity identity;
        try {
            identity = jwtUtil.toIdentity(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("[WS Auth] Handshake auth failed for {}: {}", channel, e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        Role role = Role.resolve(query.getFirst("role"), identity.role());
        attributes.put(ATTR_IDENTITY, identity);
        attributes.put(ATTR_CHANNEL, channel);
        attributes.put(ATTR_ROLE, role);

        log.debug("[WS Auth] Handshake authenticated: userId={}, channel={}, role={}",
                identity.userId(), channel, role);
        return true;
    }

    @Override
    public void afterHandshake(
            @NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @Nullable Exception exception
    ) {
        // No-op
    }

    /**
     * {@code .../ws/match/42} to {@code match:42}; null if the path is not a channel endpoint.
     */
    static Channel channelFromPath(String path) {
        if (path == null) {
            return null;
        }
        String[] parts = path.split("/");
        if (parts.length < 2) {
            return null;
        }
        String kind = parts[parts.length - 2];
        String id = parts[parts.length - 1];
        try {
            for (ChannelKind k : ChannelKind.values()) {
                if (k.prefix().equals(kind)) {
                    return new Channel(k, id);
                }
            }
        } catch (IllegalArgumentException e) {
            return null;
        }
        return null;
    }

    private String extractToken(ServerHttpRequest request, MultiValueMap<String, String> query) {
        String fromQuery = query.getFirst("token");
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        List<String> authHeaders = request.getHeaders().get("Authorization");
        if (authHeaders != null && !authHeaders.isEmpty()) {
            String authHeader = authHeaders.get(0);
            if (authHeader.startsWith("Bearer ")) {
                return authHeader.substring(7);
            }
        }
        return null;
    }

    // ==================== CONNECT RATE LIMITING ====================

    private boolean tryConsumeConnectToken(String clientIp) {
        Bucket bucket = connectBuckets.computeIfAbsent(clientIp, k -> {
            Bandwidth limit = Bandwidth.builder()
                    .capacity(connectAttemptsPerMinute)
                    .refillGreedy(connectAttemptsPerMinute, Duration.ofMinutes(1))
                    .build();
            return Bucket.builder().addLimit(limit).build();
        });
        return bucket.tryConsume(1);
    }

    /**
     * Client IP, honouring X-Forwarded-For and X-Real-IP from a reverse proxy.
     */
    private String extractClientIp(ServerHttpRequest request) {
        List<String> forwarded = request.getHeaders().get("X-Forwarded-For");
        if (forwarded != null && !forwarded.isEmpty()) {
            String first = forwarded.get(0).split(",")[0].trim();
            if (!first.isBlank()) return first;
        }

        List<String> realIp = request.getHeaders().get("X-Real-IP");
        if (realIp != null && !realIp.isEmpty()) {
            return realIp.get(0).trim();
        }

        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }

        return "unknown";
    }
}
