package com.ridedispatch.api.dispatch.service.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridedispatch.api.dispatch.service.entity.DispatchOutbox;
import com.ridedispatch.api.dispatch.service.entity.Ride;
import com.ridedispatch.api.dispatch.service.entity.RideStatusHistory;
import com.ridedispatch.api.dispatch.service.exception.InvalidTransitionException;
import com.ridedispatch.api.dispatch.service.exception.RideNotFoundException;
import com.ridedispatch.api.dispatch.service.repository.DispatchOutboxRepository;
import com.ridedispatch.api.dispatch.service.repository.RideRepository;
import com.ridedispatch.api.dispatch.service.repository.RideStatusHistoryRepository;
import com.ridedispatch.api.shared.constants.ActorType;
import com.ridedispatch.api.shared.constants.KafkaTopics;
import com.ridedispatch.api.shared.constants.RideStatus;
import com.ridedispatch.api.shared.events.RideStatusChangedEvent;
import com.ridedispatch.api.shared.outbox.OutboxStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * The only writer of ride status. Every transition is validated against the lifecycle
 * table, written together with one history row and one outbox row, and announced as a
 * {@link RideStatusChangedEvent} once the surrounding transaction commits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RideStateMachine {

    private final RideRepository rideRepository;
    private final RideStatusHistoryRepository historyRepository;
    private final DispatchOutboxRepository outboxRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Loads the ride, checks the move, applies it and flushes under the ride's version.
     * A version conflict means another actor moved the ride first and surfaces as
     * {@link InvalidTransitionException}.
     */
    @Transactional
    public Ride transition(UUID rideId, RideStatus target, ActorType actorType, String actorId, String reason) {
        Ride ride = rideRepository.findById(rideId).orElseThrow(() -> new RideNotFoundException(rideId));
        RideStatus previous = ride.getStatus();
        if (!previous.canTransitionTo(target)) {
            log.error("Rejected transition of ride {} from {} to {} by {} {}", rideId, previous, target, actorType, actorId);
            throw new InvalidTransitionException(rideId, previous, target);
        }

        ZonedDateTime now = ZonedDateTime.now(clock);
        ride.setStatus(target);
        ride.setUpdatedAt(now);
        switch (target) {
            case ARRIVED -> ride.setArrivedAt(now);
            case IN_PROGRESS -> ride.setStartedAt(now);
            case COMPLETED -> ride.setCompletedAt(now);
            case CANCELLED -> {
                ride.setCancelledAt(now);
                ride.setCancellationReason(reason);
                ride.setAssignedDriverId(null);
            }
            default -> {
            }
        }

        Ride saved;
        try {
            saved = rideRepository.saveAndFlush(ride);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.error("Ride {} changed concurrently, {} -> {} rejected", rideId, previous, target);
            throw new InvalidTransitionException(rideId, previous, target, e);
        }

        record(saved, previous, target, actorType, actorId, reason, now);
        return saved;
    }

    /**
     * Writes the audit trail for a transition that was already applied by a conditional
     * update (the accept race).
     */
    @Transactional
    public void record(Ride ride, RideStatus previous, RideStatus target, ActorType actorType, String actorId,
                       String reason, ZonedDateTime at) {
        historyRepository.save(RideStatusHistory.builder()
                .rideId(ride.getId())
                .fromStatus(previous)
                .toStatus(target)
                .actorType(actorType)
                .actorId(actorId)
                .reason(reason)
                .createdAt(at)
                .build());

        RideStatusChangedEvent event = RideStatusChangedEvent.builder()
                .rideId(ride.getId())
                .customerId(ride.getCustomerId())
                .driverId(ride.getAssignedDriverId())
                .previousStatus(previous)
                .status(target)
                .actorType(actorType)
                .actorId(actorId)
                .reason(reason)
                .occurredAt(at)
                .build();
        saveToOutbox(ride.getId(), event, at);
        eventPublisher.publishEvent(event);

        log.info("Ride {} moved {} -> {} by {} {}", ride.getId(), previous, target, actorType,
                actorId != null ? actorId : "");
    }

    private void saveToOutbox(UUID rideId, RideStatusChangedEvent event, ZonedDateTime at) {
        try {
            outboxRepository.save(DispatchOutbox.builder()
                    .aggregateId(rideId)
                    .eventType(KafkaTopics.RIDE_STATUS_EVENTS)
                    .payload(objectMapper.writeValueAsString(event))
                    .status(OutboxStatus.PENDING)
                    .createdAt(at)
                    .build());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize status event for ride {}", rideId, e);
            throw new IllegalStateException("Failed to save status event to outbox", e);
        }
    }
}
