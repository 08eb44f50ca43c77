package com.ridedispatch.api.dispatch.service.dto;

import com.ridedispatch.api.shared.constants.RideStatus;
import com.ridedispatch.api.shared.entities.Location;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.ZonedDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideStatusResponse {

    private UUID rideId;
    private String customerId;
    private RideStatus status;
    private String assignedDriverId;
    private Location pickup;
    private Location dropoff;
    private String vehicleType;
    private String serviceTier;
    private BigDecimal estimatedFare;
    private ZonedDateTime createdAt;
    private ZonedDateTime assignedAt;
    private ZonedDateTime completedAt;
    private ZonedDateTime cancelledAt;
    private String cancellationReason;
    private String statusMessage;
}
