package com.matcast.server.socket;

import java.time.Instant;
import java.util.regex.Pattern;

import com.matcast.server.dto.MessageType;
import com.matcast.server.dto.WireMessage;

/**
 * Broadcast scope: {@code match:<id>} or {@code tournament:<id>}.
 * Value type; equal channels are interchangeable as map keys.
 */
public record Channel(ChannelKind kind, String id) {

    private static final Pattern ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    public Channel {
        if (kind == null) {
            throw new IllegalArgumentException("Channel kind is required");
        }
        if (id == null || !ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid channel id: " + id);
        }
    }

    public static Channel match(String matchId) {
        return new Channel(ChannelKind.MATCH, matchId);
    }

    public static Channel tournament(String tournamentId) {
        return new Channel(ChannelKind.TOURNAMENT, tournamentId);
    }

    /**
     * Parse the {@code kind:id} form.
     *
     * @throws IllegalArgumentException unknown kind or bad id
     */
    public static Channel parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Channel is required");
        }
        int sep = value.indexOf(':');
        if (sep <= 0) {
            throw new IllegalArgumentException("Invalid channel: " + value);
        }
        String kind = value.substring(0, sep);
        String id = value.substring(sep + 1);
        for (ChannelKind k : ChannelKind.values()) {
            if (k.prefix().equals(kind)) {
                return new Channel(k, id);
            }
        }
        throw new IllegalArgumentException("Unknown channel kind: " + kind);
    }

    public boolean isMatch() {
        return kind == ChannelKind.MATCH;
    }

    /** Envelope addressed to this channel ({@code matchId} or {@code tournamentId} set accordingly). */
    public WireMessage message(MessageType type, Object data, Instant now) {
        return isMatch()
                ? WireMessage.forMatch(type, id, data, now)
                : WireMessage.forTournament(type, id, data, now);
    }

    @Override
    public String toString() {
        return kind.prefix() + ":" + id;
    }
}
