package com.ridedispatch.api.dispatch.service.matching;

import com.ridedispatch.api.dispatch.service.config.DispatchProperties;
import com.ridedispatch.api.dispatch.service.entity.DriverAvailability;
import com.ridedispatch.api.dispatch.service.geo.GeoService;
import com.ridedispatch.api.dispatch.service.registry.ConnectionRegistry;
import com.ridedispatch.api.shared.entities.Location;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks the next drivers to offer a ride to. Only online, available drivers with a fresh
 * heartbeat and a live connection qualify. The search radius widens step by step while
 * nobody qualifies; an empty result means the pool is exhausted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateSelector {

    private static final double MAX_RATING = 5.0;

    private final GeoService geoService;
    private final ConnectionRegistry connectionRegistry;
    private final DispatchProperties properties;
    private final Clock clock;

    public List<DriverCandidate> selectBatch(Location pickup,
                                             String vehicleFilter,
                                             String serviceFilter,
                                             Set<String> excludeDriverIds,
                                             int batchSize) {
        if (batchSize <= 0) {
            return Collections.emptyList();
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime seenAfter = now.minus(properties.getHeartbeatStaleness());
        DispatchProperties.Radius radius = properties.getRadius();

        for (double r = radius.getInitialKm(); r <= radius.getMaxKm() + 1e-9; r += radius.getStepKm()) {
            double searchRadius = r;
            List<DriverCandidate> ranked = geoService.withinRadius(pickup, searchRadius).stream()
                    .filter(d -> !excludeDriverIds.contains(d.getDriverId()))
                    .filter(d -> isDispatchable(d, vehicleFilter, serviceFilter, seenAfter))
                    .filter(d -> connectionRegistry.isOnline(d.getDriverId()))
                    .map(d -> toCandidate(d, pickup, searchRadius, now))
                    .filter(c -> c.getDistanceKm() <= searchRadius)
                    .sorted(Comparator.comparingDouble(DriverCandidate::getScore).reversed()
                            .thenComparing(DriverCandidate::getDriverId))
                    .limit(batchSize)
                    .collect(Collectors.toList());

            if (!ranked.isEmpty()) {
                log.info("Selected {} candidates within {} km of pickup (excluded {})",
                        ranked.size(), searchRadius, excludeDriverIds.size());
                return ranked;
            }
            if (radius.getStepKm() <= 0) {
                break;
            }
            log.debug("No candidates within {} km, widening search", searchRadius);
        }

        log.info("No candidates left within {} km (excluded {})", radius.getMaxKm(), excludeDriverIds.size());
        return Collections.emptyList();
    }

    private boolean isDispatchable(DriverAvailability d, String vehicleFilter, String serviceFilter,
                                   ZonedDateTime seenAfter) {
        return d.isOnline()
                && d.isAvailable()
                && d.getLastSeenAt() != null && !d.getLastSeenAt().isBefore(seenAfter)
                && matches(vehicleFilter, d.getVehicleType())
                && matches(serviceFilter, d.getServiceTier());
    }

    private static boolean matches(String filter, String value) {
        return filter == null || filter.isBlank() || filter.equalsIgnoreCase(value);
    }

    private DriverCandidate toCandidate(DriverAvailability d, Location pickup, double radiusKm, ZonedDateTime now) {
        double distance = geoService.distanceKm(pickup, Location.of(d.getLatitude(), d.getLongitude()));
        DispatchProperties.Ranking ranking = properties.getRanking();

        double distanceFactor = Math.max(0.0, (radiusKm - distance) / radiusKm);
        double rating = d.getRating() != null ? d.getRating() : 0.0;
        double ratingFactor = Math.min(rating / MAX_RATING, 1.0);
        double idleFactor = 0.0;
        if (d.getAvailableSince() != null) {
            long idleMs = Math.max(0, Duration.between(d.getAvailableSince(), now).toMillis());
            idleFactor = Math.min((double) idleMs / ranking.getIdleCap().toMillis(), 1.0);
        }

        double score = ranking.getDistanceWeight() * distanceFactor
                + ranking.getRatingWeight() * ratingFactor
                + ranking.getIdleWeight() * idleFactor;

        return DriverCandidate.builder()
                .driverId(d.getDriverId())
                .distanceKm(distance)
                .etaMinutes(etaMinutes(distance))
                .score(score)
                .build();
    }

    public int etaMinutes(double distanceKm) {
        return (int) Math.ceil(distanceKm / properties.getAverageSpeedKmh() * 60.0);
    }
}
