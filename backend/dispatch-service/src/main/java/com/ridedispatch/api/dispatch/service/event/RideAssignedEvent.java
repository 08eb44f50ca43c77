package com.ridedispatch.api.dispatch.service.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@AllArgsConstructor
public class RideAssignedEvent {
    private UUID rideId;
    private String customerId;
    private String driverId;
    private Integer etaMinutes;
    private List<String> supersededDriverIds;
}
