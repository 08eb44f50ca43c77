package com.ridedispatch.api.shared.events;

import com.ridedispatch.api.shared.constants.ActorType;
import com.ridedispatch.api.shared.constants.RideStatus;
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
public class RideStatusChangedEvent {
    private UUID rideId;
    private String customerId;
    private String driverId;
    private RideStatus previousStatus;
    private RideStatus status;
    private ActorType actorType;
    private String actorId;
    private String reason;
    private ZonedDateTime occurredAt;
}
