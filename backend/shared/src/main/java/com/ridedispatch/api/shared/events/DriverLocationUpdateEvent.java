package com.ridedispatch.api.shared.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Location ping from a driver's client, received over Kafka or the live connection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverLocationUpdateEvent {
    private String driverId;
    private Double latitude;
    private Double longitude;
    private Boolean available;
}
