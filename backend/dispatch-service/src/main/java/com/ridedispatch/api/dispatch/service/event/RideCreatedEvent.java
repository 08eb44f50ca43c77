package com.ridedispatch.api.dispatch.service.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

@Data
@AllArgsConstructor
public class RideCreatedEvent {
    private UUID rideId;
}
