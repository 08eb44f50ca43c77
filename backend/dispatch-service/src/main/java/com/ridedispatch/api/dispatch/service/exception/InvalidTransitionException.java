package com.ridedispatch.api.dispatch.service.exception;

import com.ridedispatch.api.shared.constants.RideStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * A lifecycle move that the ride's current state does not allow, or that lost to a
 * concurrent change. The caller should re-read the ride before trying again.
 */
@Getter
public class InvalidTransitionException extends DispatchException {

    private final UUID rideId;
    private final RideStatus from;
    private final RideStatus to;

    public InvalidTransitionException(UUID rideId, RideStatus from, RideStatus to) {
        super(String.format("Ride %s cannot move from %s to %s", rideId, from, to));
        this.rideId = rideId;
        this.from = from;
        this.to = to;
    }

    public InvalidTransitionException(UUID rideId, RideStatus from, RideStatus to, Throwable cause) {
        super(String.format("Ride %s changed concurrently while moving from %s to %s", rideId, from, to), cause);
        this.rideId = rideId;
        this.from = from;
        this.to = to;
    }
}
