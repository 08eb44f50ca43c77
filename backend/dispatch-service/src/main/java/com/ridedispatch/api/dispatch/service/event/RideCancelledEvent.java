package com.ridedispatch.api.dispatch.service.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@AllArgsConstructor
public class RideCancelledEvent {
    private UUID rideId;
    private String customerId;
    private String releasedDriverId;
    private List<String> offeredDriverIds;
    private String reason;
}
