package com.ridedispatch.api.dispatch.service.service;

import com.ridedispatch.api.dispatch.service.dto.AcceptResult;
import com.ridedispatch.api.dispatch.service.dto.CreateRideRequest;
import com.ridedispatch.api.dispatch.service.dto.OfferHistoryResponse;
import com.ridedispatch.api.dispatch.service.dto.RejectOutcome;
import com.ridedispatch.api.dispatch.service.dto.RideStatusResponse;
import com.ridedispatch.api.dispatch.service.dto.StatusHistoryEntry;

import java.util.List;
import java.util.UUID;

public interface RideDispatchService {

    RideStatusResponse createRide(CreateRideRequest request);

    RideStatusResponse getRideStatus(UUID rideId);

    OfferHistoryResponse getOfferHistory(UUID rideId);

    List<StatusHistoryEntry> getStatusHistory(UUID rideId);

    RideStatusResponse cancelRide(UUID rideId, String customerId, String reason);

    /**
     * Starts a fresh dispatch cycle, as a new ride, for a ride that ended without a driver.
     */
    RideStatusResponse redispatch(UUID rideId, String customerId);

    AcceptResult acceptOffer(UUID offerId, String driverId);

    RejectOutcome rejectOffer(UUID offerId, String driverId, String reason);

    RideStatusResponse markArrived(UUID rideId, String driverId);

    RideStatusResponse startRide(UUID rideId, String driverId);

    RideStatusResponse completeRide(UUID rideId, String driverId);
}
