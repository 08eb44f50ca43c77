package com.ridedispatch.api.dispatch.service.exception;

import com.ridedispatch.api.dispatch.service.dto.AcceptOutcome;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown from inside the accept transaction after the ride update matched but a later
 * check failed, so the whole assignment rolls back.
 */
@Getter
public class AcceptRolledBackException extends DispatchException {

    private final AcceptOutcome outcome;
    private final UUID rideId;
    private final String driverId;

    public AcceptRolledBackException(AcceptOutcome outcome, UUID rideId, String driverId) {
        super("Accept of ride " + rideId + " by driver " + driverId + " rolled back: " + outcome);
        this.outcome = outcome;
        this.rideId = rideId;
        this.driverId = driverId;
    }
}
