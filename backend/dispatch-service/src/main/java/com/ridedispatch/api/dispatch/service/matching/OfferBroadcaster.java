package com.ridedispatch.api.dispatch.service.matching;

import com.ridedispatch.api.dispatch.service.config.DispatchProperties;
import com.ridedispatch.api.dispatch.service.entity.Offer;
import com.ridedispatch.api.dispatch.service.entity.Ride;
import com.ridedispatch.api.dispatch.service.event.OffersBroadcastEvent;
import com.ridedispatch.api.dispatch.service.exception.RideNotFoundException;
import com.ridedispatch.api.dispatch.service.registry.ConnectionRegistry;
import com.ridedispatch.api.dispatch.service.repository.OfferRepository;
import com.ridedispatch.api.dispatch.service.repository.RideRepository;
import com.ridedispatch.api.shared.constants.OfferStatus;
import com.ridedispatch.api.shared.constants.RideStatus;
import com.ridedispatch.api.shared.events.RideOfferEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes one pending offer per reachable candidate, all sharing the batch's expiry, and
 * hands the batch to the realtime notifier once the rows are committed. Driver
 * availability is not touched here: a driver stays eligible elsewhere until accepting.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfferBroadcaster {

    private final RideRepository rideRepository;
    private final OfferRepository offerRepository;
    private final ConnectionRegistry connectionRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final DispatchProperties properties;
    private final Clock clock;

    @Transactional
    public BroadcastResult broadcast(UUID rideId, List<DriverCandidate> candidates) {
        // Row lock keeps the batch from interleaving with a cancel or a concurrent round
        Ride ride = rideRepository.findByIdForUpdate(rideId).orElseThrow(() -> new RideNotFoundException(rideId));
        if (ride.getStatus() != RideStatus.SEARCHING) {
            log.info("Ride {} is {}, not broadcasting", rideId, ride.getStatus());
            return BroadcastResult.rideSettled();
        }

        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime expiresAt = now.plus(properties.getOfferWindow());
        int batchNumber = offerRepository.findLatestBatchNumber(rideId) + 1;

        BroadcastResult result = BroadcastResult.builder()
                .batchNumber(batchNumber)
                .expiresAt(expiresAt)
                .build();
        Map<String, RideOfferEvent> payloads = new LinkedHashMap<>();

        for (DriverCandidate candidate : candidates) {
            if (!connectionRegistry.isOnline(candidate.getDriverId())) {
                log.warn("Driver {} has no live connection, skipping for ride {}", candidate.getDriverId(), rideId);
                result.getSkippedDriverIds().add(candidate.getDriverId());
                continue;
            }
            Offer offer = offerRepository.save(Offer.builder()
                    .rideId(rideId)
                    .driverId(candidate.getDriverId())
                    .batchNumber(batchNumber)
                    .status(OfferStatus.PENDING)
                    .distanceFromPickupKm(candidate.getDistanceKm())
                    .estimatedArrivalMinutes(candidate.getEtaMinutes())
                    .createdAt(now)
                    .expiresAt(expiresAt)
                    .build());
            result.getOfferedDriverIds().add(candidate.getDriverId());
            payloads.put(candidate.getDriverId(), RideOfferEvent.builder()
                    .rideId(rideId)
                    .offerId(offer.getId())
                    .batchNumber(batchNumber)
                    .pickup(ride.getPickup())
                    .dropoff(ride.getDropoff())
                    .fare(ride.getEstimatedFare())
                    .vehicleType(ride.getVehicleType())
                    .distanceFromPickupKm(candidate.getDistanceKm())
                    .estimatedArrivalMinutes(candidate.getEtaMinutes())
                    .expiresAt(expiresAt)
                    .timeoutSeconds(properties.getOfferWindow().getSeconds())
                    .build());
        }

        if (!payloads.isEmpty()) {
            eventPublisher.publishEvent(new OffersBroadcastEvent(rideId, batchNumber, payloads));
            log.info("Ride {} batch {} offered to {} drivers, window closes at {}",
                    rideId, batchNumber, payloads.size(), expiresAt);
        }
        return result;
    }

    /**
     * Expires what is still pending in a batch whose window has passed. Runs under the
     * same ride lock as broadcast, so an accept either commits first or no longer finds
     * its offer pending.
     */
    @Transactional
    public int expireBatch(UUID rideId, int batchNumber) {
        rideRepository.findByIdForUpdate(rideId);
        return offerRepository.expirePendingInBatch(rideId, batchNumber, ZonedDateTime.now(clock),
                OfferStatus.PENDING, OfferStatus.EXPIRED);
    }

    @Transactional
    public int expireElapsed(UUID rideId) {
        rideRepository.findByIdForUpdate(rideId);
        return offerRepository.expireElapsed(rideId, ZonedDateTime.now(clock), OfferStatus.PENDING, OfferStatus.EXPIRED);
    }
}
