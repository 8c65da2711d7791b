package com.matcast.server.security;

/**
 * Authenticated caller as established from a verified token.
 *
 * @param userId subject claim
 * @param name   display name, may be null
 * @param role   raw role claim; only {@code referee} has meaning to the hub
 */
public record HubIdentity(String userId, String name, String role) {
}
