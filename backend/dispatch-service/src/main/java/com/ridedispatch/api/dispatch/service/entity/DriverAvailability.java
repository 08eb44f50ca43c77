package com.ridedispatch.api.dispatch.service.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Entity
@Table(name = "driver_availability",
        indexes = @Index(name = "idx_availability_dispatchable", columnList = "is_online, is_available"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverAvailability {

    @Id
    @Column(name = "driver_id")
    private String driverId;

    @Column(name = "is_online", nullable = false)
    private boolean online;

    @Column(name = "is_available", nullable = false)
    private boolean available;

    private Double latitude;
    private Double longitude;

    private String vehicleType;
    private String serviceTier;

    private Double rating;

    // Idle time for ranking is measured from here
    private ZonedDateTime availableSince;

    private ZonedDateTime lastSeenAt;
    private ZonedDateTime updatedAt;
}
