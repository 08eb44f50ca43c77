package com.ridedispatch.api.dispatch.service.geo;

import com.ridedispatch.api.dispatch.service.entity.DriverAvailability;
import com.ridedispatch.api.dispatch.service.repository.DriverAvailabilityRepository;
import com.ridedispatch.api.shared.entities.Location;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class HaversineGeoService implements GeoService {

    private static final double KM_PER_DEGREE_LAT = 111.32;

    private final DriverAvailabilityRepository driverAvailabilityRepository;

    @Override
    public double distanceKm(Location from, Location to) {
        return from.distanceTo(to);
    }

    @Override
    public List<DriverAvailability> withinRadius(Location center, double radiusKm) {
        double latDelta = radiusKm / KM_PER_DEGREE_LAT;
        double cosLat = Math.max(Math.cos(Math.toRadians(center.getLatitude())), 0.01);
        double lonDelta = radiusKm / (KM_PER_DEGREE_LAT * cosLat);

        // Box prefilter in the database, exact circle here
        return driverAvailabilityRepository.findInBoundingBox(
                        center.getLatitude() - latDelta, center.getLatitude() + latDelta,
                        center.getLongitude() - lonDelta, center.getLongitude() + lonDelta)
                .stream()
                .filter(d -> distanceKm(center, Location.of(d.getLatitude(), d.getLongitude())) <= radiusKm)
                .collect(Collectors.toList());
    }
}
