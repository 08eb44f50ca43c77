package com.ridedispatch.api.dispatch.service.service.impl;

import com.ridedispatch.api.dispatch.service.client.PricingClient;
import com.ridedispatch.api.dispatch.service.dto.AcceptOutcome;
import com.ridedispatch.api.dispatch.service.dto.AcceptResult;
import com.ridedispatch.api.dispatch.service.dto.CreateRideRequest;
import com.ridedispatch.api.dispatch.service.dto.LocationDTO;
import com.ridedispatch.api.dispatch.service.dto.OfferHistoryResponse;
import com.ridedispatch.api.dispatch.service.dto.OfferView;
import com.ridedispatch.api.dispatch.service.dto.RejectOutcome;
import com.ridedispatch.api.dispatch.service.dto.RideStatusResponse;
import com.ridedispatch.api.dispatch.service.dto.StatusHistoryEntry;
import com.ridedispatch.api.dispatch.service.entity.Offer;
import com.ridedispatch.api.dispatch.service.entity.Ride;
import com.ridedispatch.api.dispatch.service.event.RideCancelledEvent;
import com.ridedispatch.api.dispatch.service.event.RideCreatedEvent;
import com.ridedispatch.api.dispatch.service.exception.ActiveRideExistsException;
import com.ridedispatch.api.dispatch.service.exception.InvalidTransitionException;
import com.ridedispatch.api.dispatch.service.exception.NotRideParticipantException;
import com.ridedispatch.api.dispatch.service.exception.OfferNotFoundException;
import com.ridedispatch.api.dispatch.service.exception.RideNotFoundException;
import com.ridedispatch.api.dispatch.service.matching.AcceptanceArbitrator;
import com.ridedispatch.api.dispatch.service.repository.DriverAvailabilityRepository;
import com.ridedispatch.api.dispatch.service.repository.OfferRepository;
import com.ridedispatch.api.dispatch.service.repository.RideRepository;
import com.ridedispatch.api.dispatch.service.repository.RideStatusHistoryRepository;
import com.ridedispatch.api.dispatch.service.service.RideDispatchService;
import com.ridedispatch.api.dispatch.service.service.RideStateMachine;
import com.ridedispatch.api.shared.constants.ActorType;
import com.ridedispatch.api.shared.constants.OfferStatus;
import com.ridedispatch.api.shared.constants.RideStatus;
import com.ridedispatch.api.shared.entities.Location;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RideDispatchServiceImpl implements RideDispatchService {

    private final RideRepository rideRepository;
    private final OfferRepository offerRepository;
    private final RideStatusHistoryRepository historyRepository;
    private final DriverAvailabilityRepository driverAvailabilityRepository;
    private final RideStateMachine rideStateMachine;
    private final AcceptanceArbitrator acceptanceArbitrator;
    private final PricingClient pricingClient;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional
    public RideStatusResponse createRide(CreateRideRequest request) {
        log.info("Creating ride for customer: {}", request.getCustomerId());
        return mapToRideStatusResponse(openRide(request.getCustomerId(), toLocation(request.getPickup()),
                toLocation(request.getDropoff()), request.getVehicleType(), request.getServiceTier()));
    }

    @Override
    @Transactional(readOnly = true)
    public RideStatusResponse getRideStatus(UUID rideId) {
        return mapToRideStatusResponse(findRide(rideId));
    }

    @Override
    @Transactional(readOnly = true)
    public OfferHistoryResponse getOfferHistory(UUID rideId) {
        findRide(rideId);
        List<Offer> offers = offerRepository.findByRideIdOrderByBatchNumberAscCreatedAtAsc(rideId);

        Map<OfferStatus, Long> counts = new EnumMap<>(OfferStatus.class);
        for (OfferStatus status : OfferStatus.values()) {
            counts.put(status, 0L);
        }
        offers.forEach(o -> counts.merge(o.getStatus(), 1L, Long::sum));

        OptionalDouble avgDistance = offers.stream()
                .map(Offer::getDistanceFromPickupKm)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        OptionalDouble avgEta = offers.stream()
                .map(Offer::getEstimatedArrivalMinutes)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average();

        return OfferHistoryResponse.builder()
                .rideId(rideId)
                .offers(offers.stream().map(this::mapToOfferView).collect(Collectors.toList()))
                .driversContacted((int) offers.stream().map(Offer::getDriverId).distinct().count())
                .batchesUsed(offers.stream().mapToInt(Offer::getBatchNumber).max().orElse(0))
                .countsByStatus(counts)
                .averageDistanceKm(avgDistance.isPresent() ? avgDistance.getAsDouble() : null)
                .averageEtaMinutes(avgEta.isPresent() ? avgEta.getAsDouble() : null)
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<StatusHistoryEntry> getStatusHistory(UUID rideId) {
        findRide(rideId);
        return historyRepository.findByRideIdOrderByCreatedAtAsc(rideId).stream()
                .map(h -> StatusHistoryEntry.builder()
                        .fromStatus(h.getFromStatus())
                        .toStatus(h.getToStatus())
                        .actorType(h.getActorType())
                        .actorId(h.getActorId())
                        .reason(h.getReason())
                        .at(h.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public RideStatusResponse cancelRide(UUID rideId, String customerId, String reason) {
        log.info("Cancelling ride {} for customer {}", rideId, customerId);
        Ride ride = findRide(rideId);
        if (!ride.getCustomerId().equals(customerId)) {
            throw new NotRideParticipantException(rideId, customerId);
        }
        String releasedDriverId = ride.getAssignedDriverId();

        // Version-checked like the accept update, so exactly one of them lands
        Ride cancelled = rideStateMachine.transition(rideId, RideStatus.CANCELLED, ActorType.CUSTOMER, customerId,
                reason != null ? reason : "Cancelled by customer");

        ZonedDateTime now = ZonedDateTime.now(clock);
        List<String> offeredDriverIds = offerRepository.findByRideIdAndStatus(rideId, OfferStatus.PENDING).stream()
                .map(Offer::getDriverId)
                .collect(Collectors.toList());
        offerRepository.transitionPending(rideId, now, OfferStatus.PENDING, OfferStatus.EXPIRED);
        if (releasedDriverId != null) {
            driverAvailabilityRepository.updateAvailable(releasedDriverId, true, now, now);
        }

        eventPublisher.publishEvent(new RideCancelledEvent(rideId, customerId, releasedDriverId, offeredDriverIds,
                cancelled.getCancellationReason()));
        return mapToRideStatusResponse(cancelled);
    }

    @Override
    @Transactional
    public RideStatusResponse redispatch(UUID rideId, String customerId) {
        Ride previous = findRide(rideId);
        if (!previous.getCustomerId().equals(customerId)) {
            throw new NotRideParticipantException(rideId, customerId);
        }
        boolean endedWithoutDriver = previous.getStatus() == RideStatus.NO_DRIVERS_AVAILABLE
                || (previous.getStatus() == RideStatus.CANCELLED && previous.getAssignedAt() == null);
        if (!endedWithoutDriver) {
            log.error("Ride {} in {} cannot be redispatched", rideId, previous.getStatus());
            throw new InvalidTransitionException(rideId, previous.getStatus(), RideStatus.SEARCHING);
        }
        log.info("Redispatching ride {} as a new ride", rideId);
        return mapToRideStatusResponse(openRide(customerId, copy(previous.getPickup()), copy(previous.getDropoff()),
                previous.getVehicleType(), previous.getServiceTier()));
    }

    @Override
    public AcceptResult acceptOffer(UUID offerId, String driverId) {
        log.info("Driver {} accepting offer {}", driverId, offerId);
        Offer offer = offerRepository.findById(offerId).orElseThrow(() -> new OfferNotFoundException(offerId));
        if (!offer.getDriverId().equals(driverId)) {
            log.warn("Driver {} tried to accept offer {} of driver {}", driverId, offerId, offer.getDriverId());
            return AcceptResult.of(AcceptOutcome.NO_OFFER, offer.getRideId(), driverId);
        }
        return acceptanceArbitrator.tryAccept(offer.getRideId(), driverId);
    }

    @Override
    @Transactional
    public RejectOutcome rejectOffer(UUID offerId, String driverId, String reason) {
        Offer offer = offerRepository.findById(offerId).orElseThrow(() -> new OfferNotFoundException(offerId));
        if (!offer.getDriverId().equals(driverId)) {
            throw new NotRideParticipantException(offer.getRideId(), driverId);
        }
        int updated = offerRepository.rejectIfPending(offerId, driverId, reason, ZonedDateTime.now(clock),
                OfferStatus.PENDING, OfferStatus.REJECTED);
        log.info("Driver {} rejected offer {} for ride {}: {}", driverId, offerId, offer.getRideId(),
                updated == 1 ? "recorded" : "offer no longer pending");
        return updated == 1 ? RejectOutcome.REJECTED : RejectOutcome.NOT_PENDING;
    }

    @Override
    @Transactional
    public RideStatusResponse markArrived(UUID rideId, String driverId) {
        requireAssignedDriver(rideId, driverId);
        return mapToRideStatusResponse(rideStateMachine.transition(rideId, RideStatus.ARRIVED, ActorType.DRIVER, driverId, null));
    }

    @Override
    @Transactional
    public RideStatusResponse startRide(UUID rideId, String driverId) {
        requireAssignedDriver(rideId, driverId);
        return mapToRideStatusResponse(rideStateMachine.transition(rideId, RideStatus.IN_PROGRESS, ActorType.DRIVER, driverId, null));
    }

    @Override
    @Transactional
    public RideStatusResponse completeRide(UUID rideId, String driverId) {
        requireAssignedDriver(rideId, driverId);
        Ride ride = rideStateMachine.transition(rideId, RideStatus.COMPLETED, ActorType.DRIVER, driverId, null);
        ZonedDateTime now = ZonedDateTime.now(clock);
        driverAvailabilityRepository.updateAvailable(driverId, true, now, now);
        return mapToRideStatusResponse(ride);
    }

    private Ride openRide(String customerId, Location pickup, Location dropoff, String vehicleType, String serviceTier) {
        if (rideRepository.existsByCustomerIdAndStatusIn(customerId, RideStatus.active())) {
            throw new ActiveRideExistsException(customerId);
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        Ride ride = Ride.builder()
                .customerId(customerId)
                .pickup(pickup)
                .dropoff(dropoff)
                .vehicleType(vehicleType)
                .serviceTier(serviceTier)
                .status(RideStatus.SEARCHING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        ride.setEstimatedFare(pricingClient.estimateFare(ride).getAmount());
        Ride saved = rideRepository.save(ride);

        rideStateMachine.record(saved, null, RideStatus.SEARCHING, ActorType.CUSTOMER, customerId, null, now);
        eventPublisher.publishEvent(new RideCreatedEvent(saved.getId()));
        log.info("Ride {} created with estimated fare {}", saved.getId(), saved.getEstimatedFare());
        return saved;
    }

    private void requireAssignedDriver(UUID rideId, String driverId) {
        Ride ride = findRide(rideId);
        if (ride.getAssignedDriverId() == null || !ride.getAssignedDriverId().equals(driverId)) {
            throw new NotRideParticipantException(rideId, driverId);
        }
    }

    private Ride findRide(UUID rideId) {
        return rideRepository.findById(rideId).orElseThrow(() -> new RideNotFoundException(rideId));
    }

    private Location toLocation(LocationDTO dto) {
        if (dto == null) {
            return null;
        }
        return Location.builder()
                .latitude(dto.getLatitude())
                .longitude(dto.getLongitude())
                .address(dto.getAddress())
                .city(dto.getCity())
                .build();
    }

    private Location copy(Location location) {
        if (location == null) {
            return null;
        }
        return Location.builder()
                .latitude(location.getLatitude())
                .longitude(location.getLongitude())
                .address(location.getAddress())
                .city(location.getCity())
                .build();
    }

    private OfferView mapToOfferView(Offer offer) {
        return OfferView.builder()
                .offerId(offer.getId())
                .rideId(offer.getRideId())
                .driverId(offer.getDriverId())
                .batchNumber(offer.getBatchNumber())
                .status(offer.getStatus())
                .distanceFromPickupKm(offer.getDistanceFromPickupKm())
                .estimatedArrivalMinutes(offer.getEstimatedArrivalMinutes())
                .rejectionReason(offer.getRejectionReason())
                .createdAt(offer.getCreatedAt())
                .expiresAt(offer.getExpiresAt())
                .respondedAt(offer.getRespondedAt())
                .build();
    }

    private RideStatusResponse mapToRideStatusResponse(Ride ride) {
        return RideStatusResponse.builder()
                .rideId(ride.getId())
                .customerId(ride.getCustomerId())
                .status(ride.getStatus())
                .assignedDriverId(ride.getAssignedDriverId())
                .pickup(ride.getPickup())
                .dropoff(ride.getDropoff())
                .vehicleType(ride.getVehicleType())
                .serviceTier(ride.getServiceTier())
                .estimatedFare(ride.getEstimatedFare())
                .createdAt(ride.getCreatedAt())
                .assignedAt(ride.getAssignedAt())
                .completedAt(ride.getCompletedAt())
                .cancelledAt(ride.getCancelledAt())
                .cancellationReason(ride.getCancellationReason())
                .statusMessage(getStatusMessage(ride.getStatus()))
                .build();
    }

    private String getStatusMessage(RideStatus status) {
        return switch (status) {
            case SEARCHING -> "Looking for a driver";
            case ASSIGNED -> "Driver is on the way";
            case ARRIVED -> "Driver has arrived";
            case IN_PROGRESS -> "Ride in progress";
            case COMPLETED -> "Ride completed";
            case CANCELLED -> "Ride cancelled";
            case NO_DRIVERS_AVAILABLE -> "No drivers available, try again";
        };
    }
}
