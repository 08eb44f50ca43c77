package com.ridedispatch.api.dispatch.service.geo;

import com.ridedispatch.api.dispatch.service.entity.DriverAvailability;
import com.ridedispatch.api.shared.entities.Location;

import java.util.List;

/**
 * Distance and proximity lookups. The default implementation is plain great-circle math
 * over the availability table; a spatial index can replace it behind this interface.
 */
public interface GeoService {

    double distanceKm(Location from, Location to);

    List<DriverAvailability> withinRadius(Location center, double radiusKm);
}
