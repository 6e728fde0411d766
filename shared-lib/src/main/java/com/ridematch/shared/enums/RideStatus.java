package com.ridematch.shared.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Ride lifecycle states with the allowed-transition table.
 *
 * <pre>
 *   REQUESTED       → MATCHED, CANCELLED
 *   MATCHED         → DRIVER_ARRIVING, CANCELLED
 *   DRIVER_ARRIVING → IN_PROGRESS, CANCELLED
 *   IN_PROGRESS     → COMPLETED
 *   COMPLETED, CANCELLED are terminal
 * </pre>
 * Starting a trip is the one move outside the table: a driver may start
 * straight from MATCHED without announcing arrival.
 */
public enum RideStatus {
    REQUESTED,
    MATCHED,
    DRIVER_ARRIVING,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public Set<RideStatus> allowedTargets() {
        return switch (this) {
            case REQUESTED       -> EnumSet.of(MATCHED, CANCELLED);
            case MATCHED         -> EnumSet.of(DRIVER_ARRIVING, CANCELLED);
            case DRIVER_ARRIVING -> EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS     -> EnumSet.of(COMPLETED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(RideStatus.class);
        };
    }

    public boolean canTransitionTo(RideStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /** Statuses a driver can start the trip from. */
    public boolean canStart() {
        return this == MATCHED || this == DRIVER_ARRIVING;
    }

    /** Statuses a ride can still be cancelled from, before pickup. */
    public boolean isCancellable() {
        return canTransitionTo(CANCELLED);
    }
}
