package com.matcast.server.exception;

import com.matcast.server.model.Role;

/**
 * Thrown when a connection's role does not allow the command it sent.
 */
public class InsufficientPermissionException extends RuntimeException {
    private final Role role;
    private final String commandType;

    public InsufficientPermissionException(Role role, String commandType) {
        super("Insufficient permissions");
        this.role = role;
        this.commandType = commandType;
    }

    public Role getRole() {
        return role;
    }

    public String getCommandType() {
        return commandType;
    }
}
