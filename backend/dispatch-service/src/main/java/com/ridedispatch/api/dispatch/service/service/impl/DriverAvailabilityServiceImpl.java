package com.ridedispatch.api.dispatch.service.service.impl;

import com.ridedispatch.api.dispatch.service.config.DispatchProperties;
import com.ridedispatch.api.dispatch.service.dto.DriverStatusRequest;
import com.ridedispatch.api.dispatch.service.entity.DriverAvailability;
import com.ridedispatch.api.dispatch.service.registry.ConnectionRegistry;
import com.ridedispatch.api.dispatch.service.repository.DriverAvailabilityRepository;
import com.ridedispatch.api.dispatch.service.repository.RideRepository;
import com.ridedispatch.api.dispatch.service.service.DriverAvailabilityService;
import com.ridedispatch.api.shared.constants.RideStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DriverAvailabilityServiceImpl implements DriverAvailabilityService {

    private final DriverAvailabilityRepository driverAvailabilityRepository;
    private final RideRepository rideRepository;
    private final ConnectionRegistry connectionRegistry;
    private final DispatchProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public DriverAvailability goOnline(String driverId, DriverStatusRequest request) {
        log.info("Driver {} going online", driverId);
        ZonedDateTime now = ZonedDateTime.now(clock);
        DriverAvailability availability = findOrCreate(driverId, now);

        availability.setOnline(true);
        if (request != null) {
            if (request.getLatitude() != null && request.getLongitude() != null) {
                availability.setLatitude(request.getLatitude());
                availability.setLongitude(request.getLongitude());
            }
            if (request.getVehicleType() != null) {
                availability.setVehicleType(request.getVehicleType());
            }
            if (request.getServiceTier() != null) {
                availability.setServiceTier(request.getServiceTier());
            }
            if (request.getRating() != null) {
                availability.setRating(request.getRating());
            }
        }
        applyAvailable(availability, true, now);
        availability.setLastSeenAt(now);
        availability.setUpdatedAt(now);
        return driverAvailabilityRepository.save(availability);
    }

    @Override
    @Transactional
    public DriverAvailability goOffline(String driverId) {
        log.info("Driver {} going offline", driverId);
        ZonedDateTime now = ZonedDateTime.now(clock);
        DriverAvailability availability = findOrCreate(driverId, now);
        availability.setOnline(false);
        availability.setAvailable(false);
        availability.setUpdatedAt(now);
        return driverAvailabilityRepository.save(availability);
    }

    @Override
    @Transactional
    public DriverAvailability setAvailable(String driverId, boolean available) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        DriverAvailability availability = findOrCreate(driverId, now);
        applyAvailable(availability, available, now);
        availability.setLastSeenAt(now);
        availability.setUpdatedAt(now);
        return driverAvailabilityRepository.save(availability);
    }

    @Override
    @Transactional
    public void updateLocation(String driverId, double latitude, double longitude) {
        log.debug("Location of driver {}: {}, {}", driverId, latitude, longitude);
        ZonedDateTime now = ZonedDateTime.now(clock);
        DriverAvailability availability = findOrCreate(driverId, now);
        availability.setLatitude(latitude);
        availability.setLongitude(longitude);
        availability.setLastSeenAt(now);
        availability.setUpdatedAt(now);
        driverAvailabilityRepository.save(availability);
    }

    @Override
    @Transactional
    public void heartbeat(String driverId) {
        driverAvailabilityRepository.findById(driverId).ifPresentOrElse(availability -> {
            availability.setLastSeenAt(ZonedDateTime.now(clock));
            driverAvailabilityRepository.save(availability);
        }, () -> log.warn("Heartbeat from unknown driver {}", driverId));
    }

    @Override
    @Transactional(readOnly = true)
    public DriverAvailability getAvailability(String driverId) {
        return driverAvailabilityRepository.findById(driverId).orElse(null);
    }

    @Override
    public long countDispatchable() {
        return driverAvailabilityRepository.countByOnlineTrueAndAvailableTrue();
    }

    @Override
    @Transactional
    public int sweepStaleDrivers() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        List<DriverAvailability> stale = driverAvailabilityRepository
                .findByOnlineTrueAndLastSeenAtBefore(now.minus(properties.getHeartbeatStaleness()));

        int swept = 0;
        for (DriverAvailability availability : stale) {
            if (connectionRegistry.isOnline(availability.getDriverId())) {
                continue;
            }
            availability.setOnline(false);
            availability.setAvailable(false);
            availability.setUpdatedAt(now);
            driverAvailabilityRepository.save(availability);
            swept++;
        }
        if (swept > 0) {
            log.info("Marked {} stale drivers offline", swept);
        }
        return swept;
    }

    // A driver holding a ride stays unavailable until it completes or is cancelled
    private void applyAvailable(DriverAvailability availability, boolean available, ZonedDateTime now) {
        if (available && rideRepository.existsByAssignedDriverIdAndStatusIn(availability.getDriverId(), RideStatus.holdingDriver())) {
            log.warn("Driver {} holds an active ride, staying unavailable", availability.getDriverId());
            available = false;
        }
        if (available && !availability.isAvailable()) {
            availability.setAvailableSince(now);
        }
        availability.setAvailable(available);
    }

    private DriverAvailability findOrCreate(String driverId, ZonedDateTime now) {
        return driverAvailabilityRepository.findById(driverId)
                .orElseGet(() -> DriverAvailability.builder()
                        .driverId(driverId)
                        .online(false)
                        .available(false)
                        .rating(5.0)
                        .lastSeenAt(now)
                        .build());
    }
}
