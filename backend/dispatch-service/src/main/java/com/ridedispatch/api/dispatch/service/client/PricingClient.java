package com.ridedispatch.api.dispatch.service.client;

import com.ridedispatch.api.dispatch.service.entity.Ride;

/**
 * Fare estimation collaborator. Called once per ride, before dispatch starts.
 */
public interface PricingClient {
    FareEstimate estimateFare(Ride ride);
}
