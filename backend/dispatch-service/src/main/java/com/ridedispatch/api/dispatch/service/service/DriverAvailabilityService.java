package com.ridedispatch.api.dispatch.service.service;

import com.ridedispatch.api.dispatch.service.dto.DriverStatusRequest;
import com.ridedispatch.api.dispatch.service.entity.DriverAvailability;

public interface DriverAvailabilityService {

    DriverAvailability goOnline(String driverId, DriverStatusRequest request);

    DriverAvailability goOffline(String driverId);

    DriverAvailability setAvailable(String driverId, boolean available);

    void updateLocation(String driverId, double latitude, double longitude);

    void heartbeat(String driverId);

    DriverAvailability getAvailability(String driverId);

    long countDispatchable();

    /**
     * Marks drivers offline whose heartbeat went stale and who hold no live connection.
     */
    int sweepStaleDrivers();
}
