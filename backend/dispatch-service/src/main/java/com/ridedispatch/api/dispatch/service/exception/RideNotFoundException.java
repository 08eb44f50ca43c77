package com.ridedispatch.api.dispatch.service.exception;

import java.util.UUID;

public class RideNotFoundException extends DispatchException {
    public RideNotFoundException(UUID rideId) {
        super("Ride not found: " + rideId);
    }
}
