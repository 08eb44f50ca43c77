package com.ridedispatch.api.dispatch.service.event;

import com.ridedispatch.api.shared.events.RideOfferEvent;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;
import java.util.UUID;

/**
 * A batch of offers that has been committed and now needs pushing to the drivers.
 */
@Data
@AllArgsConstructor
public class OffersBroadcastEvent {
    private UUID rideId;
    private int batchNumber;
    // driver id -> offer payload
    private Map<String, RideOfferEvent> offers;
}
