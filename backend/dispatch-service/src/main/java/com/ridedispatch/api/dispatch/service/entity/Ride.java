package com.ridedispatch.api.dispatch.service.entity;

import com.ridedispatch.api.shared.constants.RideStatus;
import com.ridedispatch.api.shared.entities.Location;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.ZonedDateTime;
import java.util.UUID;

@Entity
@Table(name = "rides",
        indexes = {
                @Index(name = "idx_ride_customer", columnList = "customer_id"),
                @Index(name = "idx_ride_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ride {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "customer_id", nullable = false)
    private String customerId;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "pickup_latitude", nullable = false)),
            @AttributeOverride(name = "longitude", column = @Column(name = "pickup_longitude", nullable = false)),
            @AttributeOverride(name = "address", column = @Column(name = "pickup_address")),
            @AttributeOverride(name = "city", column = @Column(name = "pickup_city"))
    })
    private Location pickup;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "dropoff_latitude")),
            @AttributeOverride(name = "longitude", column = @Column(name = "dropoff_longitude")),
            @AttributeOverride(name = "address", column = @Column(name = "dropoff_address")),
            @AttributeOverride(name = "city", column = @Column(name = "dropoff_city"))
    })
    private Location dropoff;

    private String vehicleType;
    private String serviceTier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RideStatus status;

    private BigDecimal estimatedFare;

    @Column(name = "assigned_driver_id")
    private String assignedDriverId;

    private String cancellationReason;

    private ZonedDateTime createdAt;
    private ZonedDateTime assignedAt;
    private ZonedDateTime arrivedAt;
    private ZonedDateTime startedAt;
    private ZonedDateTime completedAt;
    private ZonedDateTime cancelledAt;
    private ZonedDateTime updatedAt;

    @Version
    private Long version;

    // Business logic
    public double tripDistanceKm() {
        if (pickup == null || dropoff == null || dropoff.getLatitude() == null) {
            return 0.0;
        }
        return pickup.distanceTo(dropoff);
    }
}
