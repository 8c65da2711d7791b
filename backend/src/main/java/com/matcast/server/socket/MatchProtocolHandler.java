package com.matcast.server.socket;

import java.time.Clock;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matcast.server.dto.MatchMutation;
import com.matcast.server.dto.MatchSnapshot;
import com.matcast.server.dto.MatchStateCommand;
import com.matcast.server.dto.MessageType;
import com.matcast.server.dto.ScoreUpdateCommand;
import com.matcast.server.dto.TimerUpdateCommand;
import com.matcast.server.exception.InsufficientPermissionException;
import com.matcast.server.exception.MatchDomainException;
import com.matcast.server.exception.ProtocolException;
import com.matcast.server.security.CommandAuthorizer;
import com.matcast.server.service.MatchService;
import com.matcast.server.util.HubLogger;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

/**
 * Per-connection protocol: decode, authorize, apply, publish.
 *
 * Frames of one connection arrive sequentially. Every failure while handling
 * a frame becomes an ERROR frame for that connection only; nothing here
 * closes a connection because of a bad frame, and nothing is broadcast unless
 * the match service committed a change.
 *
 * Inbound frame: {@code {"type": ..., "matchId": ..., "data": {...}}}.
 */
@Component
public class MatchProtocolHandler {

    private static final Logger log = LoggerFactory.getLogger(MatchProtocolHandler.class);

    public static final String ERR_INVALID_JSON = "Invalid JSON format";
    public static final String ERR_PERMISSION = "Insufficient permissions";
    public static final String ERR_INTERNAL = "Internal server error";
    public static final String ERR_MATCH_NOT_FOUND = "Match not found";

    public static final CloseStatus MATCH_NOT_FOUND = new CloseStatus(4404, ERR_MATCH_NOT_FOUND);

    private final BroadcastHub hub;
    private final MatchService matchService;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final Clock clock;

    public MatchProtocolHandler(BroadcastHub hub,
                                MatchService matchService,
                                ObjectMapper objectMapper,
                                Validator validator,
                                Clock clock) {
        this.hub = hub;
        this.matchService = matchService;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.clock = clock;
    }

    // ==================== CONNECTION LIFECYCLE ====================

    /**
     * Join the hub, then send the current snapshot. A match channel for an
     * unknown match gets an ERROR and is closed.
     */
    public void onOpen(HubConnection connection) {
        if (!hub.connect(connection)) {
            return;
        }
        Channel channel = connection.getChannel();
        if (!channel.isMatch()) {
            return;
        }
        MatchSnapshot snapshot = matchService.findMatch(channel.id()).orElse(null);
        if (snapshot == null) {
            hub.sendTo(connection, channel.message(MessageType.ERROR, Map.of("error", ERR_MATCH_NOT_FOUND),
                    clock.instant()));
            hub.disconnect(connection, MATCH_NOT_FOUND, "match not found");
            return;
        }
        hub.sendTo(connection, channel.message(MessageType.MATCH_UPDATE, snapshot, clock.instant()));
    }

    public void onClose(HubConnection connection, CloseStatus status) {
        hub.disconnect(connection, status, "closed (" + status.getCode() + ")");
    }

    // ==================== FRAMES ====================

    public void onFrame(HubConnection connection, String raw) {
        hub.markActivity(connection);
        Channel channel = connection.getChannel();
        HubLogger.setContext(channel.isMatch() ? channel.id() : null,
                connection.getIdentity() != null ? connection.getIdentity().userId() : null,
                connection.getId());
        try {
            handle(connection, raw);
        } catch (ProtocolException e) {
            HubLogger.logRejected(log, connection.getId(), null, e.getMessage());
            replyError(connection, e.getMessage());
        } catch (InsufficientPermissionException e) {
            HubLogger.logRejected(log, connection.getId(), e.getCommandType(), "role " + e.getRole());
            replyError(connection, ERR_PERMISSION);
        } catch (MatchDomainException e) {
            HubLogger.logRejected(log, connection.getId(), null, e.getMessage());
            replyError(connection, e.getMessage());
        } catch (RuntimeException e) {
            HubLogger.logError(log, "frame", channel.isMatch() ? channel.id() : null, e.getMessage(), e);
            replyError(connection, ERR_INTERNAL);
        } finally {
            HubLogger.clearContext();
        }
    }

    private void handle(HubConnection connection, String raw) {
        JsonNode root = parse(raw);
        String typeName = root.path("type").asText(null);
        MessageType type = MessageType.fromWire(typeName)
                .orElseThrow(() -> new ProtocolException("Unknown message type: " + typeName));

        switch (type) {
            case PING:
                hub.sendTo(connection, connection.getChannel().message(MessageType.PONG, Map.of(), clock.instant()));
                return;
            case PONG:
                return;
            default:
                break;
        }

        if (!type.isMutatingCommand()) {
            throw new ProtocolException("Unsupported message type: " + type);
        }
        CommandAuthorizer.authorize(connection.getRole(), type);

        Channel channel = connection.getChannel();
        if (!channel.isMatch()) {
            throw new ProtocolException("Commands are only accepted on match channels");
        }
        String frameMatchId = root.path("matchId").asText(null);
        if (frameMatchId != null && !frameMatchId.equals(channel.id())) {
            throw new ProtocolException("matchId does not match this channel");
        }

        String matchId = channel.id();
        String actorId = connection.getIdentity().userId();
        JsonNode data = root.get("data");

        switch (type) {
            case SCORE_UPDATE: {
                ScoreUpdateCommand cmd = decode(data, ScoreUpdateCommand.class, type);
                MatchMutation result = matchService.applyScoreAction(matchId, cmd.getAction(),
                        cmd.getParticipantId(), actorId);
                publishSnapshot(channel, result.snapshot());
                break;
            }
            case MATCH_STATE_UPDATE: {
                MatchStateCommand cmd = decode(data, MatchStateCommand.class, type);
                MatchMutation result = matchService.transitionState(matchId, cmd.getState(), actorId);
                publishSnapshot(channel, result.snapshot());
                break;
            }
            case TIMER_UPDATE: {
                TimerUpdateCommand cmd = decode(data, TimerUpdateCommand.class, type);
                MatchMutation result = matchService.updateTimer(matchId, cmd.getTimeRemaining(), actorId);
                hub.publish(channel, channel.message(MessageType.TIMER_UPDATE,
                        Map.of("timeRemaining", result.snapshot().timeRemaining()), clock.instant()));
                if (result.autoFinished()) {
                    publishSnapshot(channel, result.snapshot());
                }
                break;
            }
            default:
                throw new ProtocolException("Unsupported message type: " + type);
        }
    }

    // ==================== PUBLISH ====================

    /**
     * MATCH_UPDATE to the match channel and, for tournament matches, to the
     * tournament channel as well.
     */
    private void publishSnapshot(Channel matchChannel, MatchSnapshot snapshot) {
        hub.publish(matchChannel, matchChannel.message(MessageType.MATCH_UPDATE, snapshot, clock.instant()));

        String tournamentId = snapshot.tournamentId();
        if (tournamentId == null || tournamentId.isBlank()) {
            return;
        }
        try {
            Channel tournament = Channel.tournament(tournamentId);
            hub.publish(tournament, tournament.message(MessageType.MATCH_UPDATE, snapshot, clock.instant()));
        } catch (IllegalArgumentException e) {
            log.warn("[WS] Match {} has unusable tournament id '{}': {}", snapshot.id(), tournamentId, e.getMessage());
        }
    }

    private void replyError(HubConnection connection, String message) {
        hub.sendTo(connection, connection.getChannel().message(MessageType.ERROR, Map.of("error", message),
                clock.instant()));
    }

    // ==================== DECODING ====================

    private JsonNode parse(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(ERR_INVALID_JSON, e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException(ERR_INVALID_JSON);
        }
        return root;
    }

    private <T> T decode(JsonNode data, Class<T> type, MessageType messageType) {
        if (data == null || !data.isObject()) {
            throw new ProtocolException("Missing data for " + messageType);
        }
        T command;
        try {
            command = objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Invalid data for " + messageType, e);
        }
        Set<ConstraintViolation<T>> violations = validator.validate(command);
        if (!violations.isEmpty()) {
            throw new ProtocolException(violations.iterator().next().getMessage());
        }
        return command;
    }
}
