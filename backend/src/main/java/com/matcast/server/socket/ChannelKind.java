package com.matcast.server.socket;

public enum ChannelKind {
    MATCH("match"),
    TOURNAMENT("tournament");

    private final String prefix;

    ChannelKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
