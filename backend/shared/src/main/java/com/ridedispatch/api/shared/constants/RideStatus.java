package com.ridedispatch.api.shared.constants;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum RideStatus {
    SEARCHING,             // Looking for a driver
    ASSIGNED,              // Driver accepted and is on the way
    ARRIVED,               // Driver at pickup
    IN_PROGRESS,           // Trip underway
    COMPLETED,             // Trip finished
    CANCELLED,             // Cancelled by customer
    NO_DRIVERS_AVAILABLE;  // Dispatch exhausted all candidates

    private static final Map<RideStatus, Set<RideStatus>> TRANSITIONS = Map.of(
            SEARCHING, EnumSet.of(ASSIGNED, NO_DRIVERS_AVAILABLE, CANCELLED),
            ASSIGNED, EnumSet.of(ARRIVED, CANCELLED),
            ARRIVED, EnumSet.of(IN_PROGRESS, CANCELLED),
            IN_PROGRESS, EnumSet.of(COMPLETED),
            COMPLETED, EnumSet.noneOf(RideStatus.class),
            CANCELLED, EnumSet.noneOf(RideStatus.class),
            NO_DRIVERS_AVAILABLE, EnumSet.noneOf(RideStatus.class)
    );

    public boolean canTransitionTo(RideStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<RideStatus> nextStates() {
        return EnumSet.copyOf(TRANSITIONS.get(this));
    }

    public static Set<RideStatus> active() {
        return EnumSet.of(SEARCHING, ASSIGNED, ARRIVED, IN_PROGRESS);
    }

    /**
     * Statuses in which the assigned driver is busy with the ride.
     */
    public static Set<RideStatus> holdingDriver() {
        return EnumSet.of(ASSIGNED, ARRIVED, IN_PROGRESS);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Statuses in which the ride holds an assigned driver.
     */
    public boolean hasAssignedDriver() {
        return this == ASSIGNED || this == ARRIVED || this == IN_PROGRESS || this == COMPLETED;
    }
}
