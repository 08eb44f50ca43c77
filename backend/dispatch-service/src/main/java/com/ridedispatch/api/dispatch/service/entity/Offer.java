package com.ridedispatch.api.dispatch.service.entity;

import com.ridedispatch.api.shared.constants.OfferStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * One proposal of a ride to one driver. Rows are never deleted, only moved out of PENDING.
 */
@Entity
@Table(name = "offers",
        indexes = {
                @Index(name = "idx_offer_ride", columnList = "ride_id"),
                @Index(name = "idx_offer_driver", columnList = "driver_id")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_offer_ride_driver", columnNames = {"ride_id", "driver_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Offer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "ride_id", nullable = false)
    private UUID rideId;

    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @Column(nullable = false)
    private int batchNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OfferStatus status;

    private Double distanceFromPickupKm;
    private Integer estimatedArrivalMinutes;

    private String rejectionReason;

    @Column(nullable = false, updatable = false)
    private ZonedDateTime createdAt;

    @Column(nullable = false, updatable = false)
    private ZonedDateTime expiresAt;

    private ZonedDateTime respondedAt;
}
