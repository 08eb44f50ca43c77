package com.ridedispatch.api.dispatch.service.dto;

import com.ridedispatch.api.shared.constants.OfferStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OfferView {
    private UUID offerId;
    private UUID rideId;
    private String driverId;
    private int batchNumber;
    private OfferStatus status;
    private Double distanceFromPickupKm;
    private Integer estimatedArrivalMinutes;
    private String rejectionReason;
    private ZonedDateTime createdAt;
    private ZonedDateTime expiresAt;
    private ZonedDateTime respondedAt;
}
