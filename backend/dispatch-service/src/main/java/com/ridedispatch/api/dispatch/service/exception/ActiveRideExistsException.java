package com.ridedispatch.api.dispatch.service.exception;

public class ActiveRideExistsException extends DispatchException {
    public ActiveRideExistsException(String customerId) {
        super("Customer " + customerId + " already has an active ride");
    }
}
