package com.ridedispatch.api.dispatch.service.entity;

import com.ridedispatch.api.shared.constants.ActorType;
import com.ridedispatch.api.shared.constants.RideStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * Audit record of a single ride transition. Insert-only: no setters, no updatable columns.
 */
@Entity
@Table(name = "ride_status_history",
        indexes = @Index(name = "idx_history_ride", columnList = "ride_id"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class RideStatusHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "ride_id", nullable = false, updatable = false)
    private UUID rideId;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private RideStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private RideStatus toStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ActorType actorType;

    @Column(updatable = false)
    private String actorId;

    @Column(updatable = false)
    private String reason;

    @Column(nullable = false, updatable = false)
    private ZonedDateTime createdAt;
}
