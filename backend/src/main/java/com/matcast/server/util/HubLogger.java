package com.matcast.server.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging for hub and match lifecycle events.
 *
 * Every entry is one line: UTC timestamp, event name, then key=value pairs
 * in insertion order. Null values are skipped.
 *
 * Usage:
 *   HubLogger.logConnected(log, connectionId, "match:42", "viewer", userId, 3);
 *   HubLogger.logStateTransition(log, matchId, "SCHEDULED", "IN_PROGRESS", actorId);
 */
public final class HubLogger {

    public static final String MDC_MATCH_ID = "matchId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_SESSION_ID = "sessionId";

    private static final DateTimeFormatter formatter = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneId.of("UTC"));

    private HubLogger() {
    }

    // ==================== STRUCTURED LOG BUILDERS ====================

    static final class LogEntry {
        private final String timestamp;
        private final String event;
        private final Map<String, Object> data = new LinkedHashMap<>();

        LogEntry(String event) {
            this.timestamp = formatter.format(Instant.now());
            this.event = event;
        }

        LogEntry add(String key, Object value) {
            if (value != null) {
                data.put(key, value);
            }
            return this;
        }

        String toReadable() {
            StringBuilder sb = new StringBuilder();
            sb.append(timestamp).append(" | ").append(event).append(" |");
            data.forEach((key, value) -> sb.append(' ').append(key).append('=').append(value));
            return sb.toString();
        }
    }

    // ==================== CONNECTIONS ====================

    public static void logConnected(Logger log, String connectionId, String channel, String role,
                                    String userId, int clientCount) {
        LogEntry entry = new LogEntry("CONNECTED")
                .add("connectionId", connectionId)
                .add("channel", channel)
                .add("role", role)
                .add("userId", userId)
                .add("clientCount", clientCount);
        log.info("[WS] {}", entry.toReadable());
    }

    public static void logDisconnected(Logger log, String connectionId, String channel, String reason,
                                       int clientCount) {
        LogEntry entry = new LogEntry("DISCONNECTED")
                .add("connectionId", connectionId)
                .add("channel", channel)
                .add("reason", reason)
                .add("clientCount", clientCount);
        log.info("[WS] {}", entry.toReadable());
    }

    public static void logEvicted(Logger log, String connectionId, String channel, long idleMillis) {
        LogEntry entry = new LogEntry("IDLE_EVICTED")
                .add("connectionId", connectionId)
                .add("channel", channel)
                .add("idleMs", idleMillis);
        log.info("[Heartbeat] {}", entry.toReadable());
    }

    // ==================== CHANNELS ====================

    public static void logChannelSubscribed(Logger log, String channel) {
        log.info("[Broker] {}", new LogEntry("CHANNEL_SUBSCRIBED").add("channel", channel).toReadable());
    }

    public static void logChannelUnsubscribed(Logger log, String channel) {
        log.info("[Broker] {}", new LogEntry("CHANNEL_UNSUBSCRIBED").add("channel", channel).toReadable());
    }

    // ==================== MATCH LIFECYCLE ====================

    public static void logStateTransition(Logger log, String matchId, String from, String to, String actorId) {
        LogEntry entry = new LogEntry("STATE_TRANSITION")
                .add("matchId", matchId)
                .add("from", from)
                .add("to", to)
                .add("actor", actorId);
        log.info("[Match] {}", entry.toReadable());
    }

    public static void logAutoFinish(Logger log, String matchId, String reason, String winnerId) {
        LogEntry entry = new LogEntry("AUTO_FINISH")
                .add("matchId", matchId)
                .add("reason", reason)
                .add("winner", winnerId != null ? winnerId : "draw");
        log.info("[Match] {}", entry.toReadable());
    }

    public static void logScore(Logger log, String matchId, String participantId, String action, Object newScore) {
        LogEntry entry = new LogEntry("SCORE")
                .add("matchId", matchId)
                .add("participantId", participantId)
                .add("action", action)
                .add("score", newScore);
        log.debug("[Match] {}", entry.toReadable());
    }

    // ==================== ERRORS ====================

    public static void logError(Logger log, String context, String matchId, String message, Throwable t) {
        LogEntry entry = new LogEntry("ERROR")
                .add("context", context)
                .add("matchId", matchId)
                .add("message", message);
        if (t != null) {
            log.error("[ERROR] {}", entry.toReadable(), t);
        } else {
            log.error("[ERROR] {}", entry.toReadable());
        }
    }

    public static void logRejected(Logger log, String connectionId, String commandType, String reason) {
        LogEntry entry = new LogEntry("COMMAND_REJECTED")
                .add("connectionId", connectionId)
                .add("type", commandType)
                .add("reason", reason);
        log.debug("[WS] {}", entry.toReadable());
    }

    // ==================== MDC ====================

    public static void setContext(String matchId, String userId, String sessionId) {
        if (matchId != null) MDC.put(MDC_MATCH_ID, matchId);
        if (userId != null) MDC.put(MDC_USER_ID, userId);
        if (sessionId != null) MDC.put(MDC_SESSION_ID, sessionId);
    }

    public static void clearContext() {
        MDC.remove(MDC_MATCH_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_SESSION_ID);
    }
}
