package com.matcast.server.model;

/**
 * Role of a live connection. Only referees may send mutating commands.
 */
public enum Role {
    REFEREE,
    VIEWER;

    /**
     * Effective role for a connection. A client asking for {@code referee} only
     * gets it when its identity also carries the referee role; anything else
     * falls back to VIEWER.
     *
     * @param requested    raw {@code role} query parameter, may be null
     * @param identityRole role claim of the authenticated identity, may be null
     */
    public static Role resolve(String requested, String identityRole) {
        if ("referee".equalsIgnoreCase(requested) && "referee".equalsIgnoreCase(identityRole)) {
            return REFEREE;
        }
        return VIEWER;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
