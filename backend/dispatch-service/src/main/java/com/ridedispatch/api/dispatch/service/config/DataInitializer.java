package com.ridedispatch.api.dispatch.service.config;

import com.ridedispatch.api.dispatch.service.entity.DriverAvailability;
import com.ridedispatch.api.dispatch.service.repository.DriverAvailabilityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Seeds a few offline drivers around Manhattan for local runs. They become dispatchable
 * once they connect and go online.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatch", name = "seed-sample-drivers", havingValue = "true")
public class DataInitializer implements CommandLineRunner {

    private final DriverAvailabilityRepository driverAvailabilityRepository;
    private final Clock clock;

    @Override
    public void run(String... args) throws Exception {
        if (driverAvailabilityRepository.count() == 0) {
            createSampleDrivers();
        }
    }

    private void createSampleDrivers() {
        log.info("Creating sample drivers...");
        ZonedDateTime now = ZonedDateTime.now(clock);

        List<DriverAvailability> drivers = List.of(
                sampleDriver("driver-john", 40.7128, -74.0060, "sedan", "standard", 4.8, now),
                sampleDriver("driver-jane", 40.7589, -73.9851, "sedan", "premium", 4.9, now),
                sampleDriver("driver-mike", 40.7505, -73.9934, "suv", "standard", 4.6, now),
                sampleDriver("driver-ana", 40.7306, -73.9866, "sedan", "standard", 4.7, now));
        driverAvailabilityRepository.saveAll(drivers);

        log.info("Created {} sample drivers", drivers.size());
    }

    private DriverAvailability sampleDriver(String driverId, double latitude, double longitude,
                                            String vehicleType, String serviceTier, double rating,
                                            ZonedDateTime now) {
        return DriverAvailability.builder()
                .driverId(driverId)
                .online(false)
                .available(false)
                .latitude(latitude)
                .longitude(longitude)
                .vehicleType(vehicleType)
                .serviceTier(serviceTier)
                .rating(rating)
                .lastSeenAt(now)
                .updatedAt(now)
                .build();
    }
}
