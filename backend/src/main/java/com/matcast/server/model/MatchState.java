package com.matcast.server.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a match. The allowed targets of each state form the complete
 * transition table; FINISHED and CANCELLED are terminal.
 */
public enum MatchState {
    SCHEDULED,
    IN_PROGRESS,
    PAUSED,
    FINISHED,
    CANCELLED;

    public Set<MatchState> allowedTargets() {
        switch (this) {
            case SCHEDULED:
                return Collections.unmodifiableSet(EnumSet.of(IN_PROGRESS, CANCELLED));
            case IN_PROGRESS:
                return Collections.unmodifiableSet(EnumSet.of(PAUSED, FINISHED));
            case PAUSED:
                return Collections.unmodifiableSet(EnumSet.of(IN_PROGRESS, FINISHED));
            default:
                return Collections.emptySet();
        }
    }

    public boolean canTransitionTo(MatchState target) {
        return target != null && allowedTargets().contains(target);
    }
}
