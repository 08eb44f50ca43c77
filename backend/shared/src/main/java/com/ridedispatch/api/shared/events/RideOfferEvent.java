package com.ridedispatch.api.shared.events;

import com.ridedispatch.api.shared.entities.Location;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * Payload of {@code ride:request:new}, sent to every driver in a batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideOfferEvent {
    private UUID rideId;
    private UUID offerId;
    private int batchNumber;
    private Location pickup;
    private Location dropoff;
    private BigDecimal fare;
    private String vehicleType;
    private Double distanceFromPickupKm;
    private Integer estimatedArrivalMinutes;
    private ZonedDateTime expiresAt;
    private long timeoutSeconds;
}
