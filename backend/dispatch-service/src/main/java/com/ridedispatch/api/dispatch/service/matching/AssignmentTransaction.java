package com.ridedispatch.api.dispatch.service.matching;

import com.ridedispatch.api.dispatch.service.dto.AcceptOutcome;
import com.ridedispatch.api.dispatch.service.dto.AcceptResult;
import com.ridedispatch.api.dispatch.service.entity.Offer;
import com.ridedispatch.api.dispatch.service.entity.Ride;
import com.ridedispatch.api.dispatch.service.event.RideAssignedEvent;
import com.ridedispatch.api.dispatch.service.exception.AcceptRolledBackException;
import com.ridedispatch.api.dispatch.service.exception.RideNotFoundException;
import com.ridedispatch.api.dispatch.service.repository.DriverAvailabilityRepository;
import com.ridedispatch.api.dispatch.service.repository.OfferRepository;
import com.ridedispatch.api.dispatch.service.repository.RideRepository;
import com.ridedispatch.api.dispatch.service.service.RideStateMachine;
import com.ridedispatch.api.shared.constants.ActorType;
import com.ridedispatch.api.shared.constants.OfferStatus;
import com.ridedispatch.api.shared.constants.RideStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The accept transaction. The conditional update on the ride row picks the winner; the
 * offer and driver checks after it either confirm the win or roll everything back with
 * {@link AcceptRolledBackException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssignmentTransaction {

    private final RideRepository rideRepository;
    private final OfferRepository offerRepository;
    private final DriverAvailabilityRepository driverAvailabilityRepository;
    private final RideStateMachine rideStateMachine;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    @Retryable(value = {PessimisticLockingFailureException.class}, maxAttempts = 3, backoff = @Backoff(delay = 50))
    public AcceptResult assign(UUID rideId, String driverId) {
        ZonedDateTime now = ZonedDateTime.now(clock);

        int updated = rideRepository.assignIfOfferOpen(rideId, driverId, now,
                RideStatus.SEARCHING, RideStatus.ASSIGNED, OfferStatus.PENDING, RideStatus.holdingDriver());
        if (updated == 0) {
            return classifyFailure(rideId, driverId);
        }

        // The window timer may have expired the offer after the ride update was evaluated
        if (offerRepository.markAccepted(rideId, driverId, now, OfferStatus.PENDING, OfferStatus.ACCEPTED) != 1) {
            throw new AcceptRolledBackException(AcceptOutcome.EXPIRED, rideId, driverId);
        }

        // Serializes wins by the same driver on different rides
        driverAvailabilityRepository.findByIdForUpdate(driverId);
        if (rideRepository.countByAssignedDriverIdAndStatusIn(driverId, RideStatus.holdingDriver()) > 1) {
            throw new AcceptRolledBackException(AcceptOutcome.DRIVER_BUSY, rideId, driverId);
        }

        List<String> superseded = offerRepository.findByRideIdAndStatus(rideId, OfferStatus.PENDING).stream()
                .map(Offer::getDriverId)
                .collect(Collectors.toList());
        offerRepository.transitionPending(rideId, now, OfferStatus.PENDING, OfferStatus.SUPERSEDED);
        driverAvailabilityRepository.updateAvailable(driverId, false, null, now);

        Ride ride = rideRepository.findById(rideId).orElseThrow(() -> new RideNotFoundException(rideId));
        rideStateMachine.record(ride, RideStatus.SEARCHING, RideStatus.ASSIGNED, ActorType.DRIVER, driverId, null, now);

        Integer eta = offerRepository.findByRideIdAndDriverId(rideId, driverId)
                .map(Offer::getEstimatedArrivalMinutes)
                .orElse(null);
        eventPublisher.publishEvent(new RideAssignedEvent(rideId, ride.getCustomerId(), driverId, eta, superseded));

        log.info("Driver {} won ride {}, {} other offers superseded", driverId, rideId, superseded.size());
        AcceptResult result = AcceptResult.of(AcceptOutcome.WON, rideId, driverId);
        result.setEtaMinutes(eta);
        return result;
    }

    // Read-only: explains why the conditional update matched nothing
    private AcceptResult classifyFailure(UUID rideId, String driverId) {
        Ride ride = rideRepository.findById(rideId).orElseThrow(() -> new RideNotFoundException(rideId));
        Optional<Offer> offer = offerRepository.findByRideIdAndDriverId(rideId, driverId);
        if (offer.isEmpty()) {
            return AcceptResult.of(AcceptOutcome.NO_OFFER, rideId, driverId);
        }
        if (ride.getStatus() != RideStatus.SEARCHING) {
            if (ride.getAssignedDriverId() != null && !ride.getAssignedDriverId().equals(driverId)) {
                return AcceptResult.of(AcceptOutcome.LOST_RACE, rideId, driverId);
            }
            return AcceptResult.of(AcceptOutcome.RIDE_NOT_SEARCHING, rideId, driverId);
        }
        if (rideRepository.existsByAssignedDriverIdAndStatusIn(driverId, RideStatus.holdingDriver())) {
            return AcceptResult.of(AcceptOutcome.DRIVER_BUSY, rideId, driverId);
        }
        return AcceptResult.of(AcceptOutcome.EXPIRED, rideId, driverId);
    }
}
