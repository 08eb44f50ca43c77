package com.ridedispatch.api.dispatch.service.exception;

import java.util.UUID;

public class NotRideParticipantException extends DispatchException {
    public NotRideParticipantException(UUID rideId, String userId) {
        super("User " + userId + " is not allowed to act on ride " + rideId);
    }
}
