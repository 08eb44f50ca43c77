package com.ridedispatch.api.dispatch.service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcceptResult {
    private AcceptOutcome outcome;
    private UUID rideId;
    private String driverId;
    private Integer etaMinutes;
    private String message;

    public boolean isWon() {
        return outcome == AcceptOutcome.WON;
    }

    public static AcceptResult of(AcceptOutcome outcome, UUID rideId, String driverId) {
        return AcceptResult.builder()
                .outcome(outcome)
                .rideId(rideId)
                .driverId(driverId)
                .message(messageFor(outcome))
                .build();
    }

    private static String messageFor(AcceptOutcome outcome) {
        return switch (outcome) {
            case WON -> "Ride assigned to you";
            case LOST_RACE -> "Ride no longer available: taken by another driver";
            case EXPIRED -> "Ride no longer available: offer expired";
            case RIDE_NOT_SEARCHING -> "Ride no longer available";
            case NO_OFFER -> "No offer for this ride";
            case DRIVER_BUSY -> "Finish your current ride before accepting another";
        };
    }
}
