package com.ridedispatch.api.dispatch.service.notification;

import com.ridedispatch.api.dispatch.service.event.OffersBroadcastEvent;
import com.ridedispatch.api.dispatch.service.event.RideAssignedEvent;
import com.ridedispatch.api.dispatch.service.event.RideCancelledEvent;
import com.ridedispatch.api.dispatch.service.registry.ConnectionRegistry;
import com.ridedispatch.api.dispatch.service.registry.SendResult;
import com.ridedispatch.api.shared.constants.RealtimeEvents;
import com.ridedispatch.api.shared.constants.RideStatus;
import com.ridedispatch.api.shared.events.DriverAssignedEvent;
import com.ridedispatch.api.shared.events.NoDriversAvailableEvent;
import com.ridedispatch.api.shared.events.RideOfferCancelledEvent;
import com.ridedispatch.api.shared.events.RideOfferEvent;
import com.ridedispatch.api.shared.events.RideStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Pushes committed dispatch outcomes to connected clients. Runs after commit, so a failed
 * push never undoes a state change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeNotifier {

    private final ConnectionRegistry connectionRegistry;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onOffersBroadcast(OffersBroadcastEvent event) {
        for (Map.Entry<String, RideOfferEvent> entry : event.getOffers().entrySet()) {
            SendResult result = safeSend(entry.getKey(), RealtimeEvents.RIDE_REQUEST_NEW, entry.getValue());
            if (result == SendResult.NOT_CONNECTED) {
                log.warn("Offer for ride {} could not reach driver {}, it will lapse with the window",
                        event.getRideId(), entry.getKey());
            }
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRideAssigned(RideAssignedEvent event) {
        safeSend(event.getCustomerId(), RealtimeEvents.RIDE_DRIVER_ASSIGNED, DriverAssignedEvent.builder()
                .rideId(event.getRideId())
                .driverId(event.getDriverId())
                .eta(event.getEtaMinutes())
                .build());

        RideOfferCancelledEvent cancelled = RideOfferCancelledEvent.builder()
                .rideId(event.getRideId())
                .reason(RealtimeEvents.REASON_ACCEPTED_BY_ANOTHER_DRIVER)
                .build();
        for (String driverId : event.getSupersededDriverIds()) {
            safeSend(driverId, RealtimeEvents.RIDE_REQUEST_CANCELLED, cancelled);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRideCancelled(RideCancelledEvent event) {
        Set<String> drivers = new LinkedHashSet<>(event.getOfferedDriverIds());
        if (event.getReleasedDriverId() != null) {
            drivers.add(event.getReleasedDriverId());
        }
        RideOfferCancelledEvent cancelled = RideOfferCancelledEvent.builder()
                .rideId(event.getRideId())
                .reason(RealtimeEvents.REASON_CANCELLED_BY_CUSTOMER)
                .build();
        for (String driverId : drivers) {
            safeSend(driverId, RealtimeEvents.RIDE_REQUEST_CANCELLED, cancelled);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onStatusChanged(RideStatusChangedEvent event) {
        safeSend(event.getCustomerId(), RealtimeEvents.RIDE_STATUS_UPDATED, event);
        if (event.getDriverId() != null) {
            safeSend(event.getDriverId(), RealtimeEvents.RIDE_STATUS_UPDATED, event);
        }
        if (event.getStatus() == RideStatus.NO_DRIVERS_AVAILABLE) {
            safeSend(event.getCustomerId(), RealtimeEvents.RIDE_NO_DRIVERS_AVAILABLE, NoDriversAvailableEvent.builder()
                    .rideId(event.getRideId())
                    .message("No drivers available, please try again")
                    .build());
        }
    }

    private SendResult safeSend(String userId, String eventName, Object payload) {
        try {
            return connectionRegistry.send(userId, eventName, payload);
        } catch (RuntimeException e) {
            log.error("Failed to push {} to user {}", eventName, userId, e);
            return SendResult.NOT_CONNECTED;
        }
    }
}
