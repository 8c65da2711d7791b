package com.matcast.server.security;

import com.matcast.server.dto.MessageType;
import com.matcast.server.exception.InsufficientPermissionException;
import com.matcast.server.model.Role;

/**
 * Who may send what. A pure function of (role, command type).
 */
public final class CommandAuthorizer {

    private CommandAuthorizer() {
    }

    public static boolean isAllowed(Role role, MessageType type) {
        if (type.isMutatingCommand()) {
            return role == Role.REFEREE;
        }
        return type == MessageType.PING || type == MessageType.PONG;
    }

    /**
     * @throws InsufficientPermissionException if {@link #isAllowed} is false
     */
    public static void authorize(Role role, MessageType type) {
        if (!isAllowed(role, type)) {
            throw new InsufficientPermissionException(role, type.name());
        }
    }
}
