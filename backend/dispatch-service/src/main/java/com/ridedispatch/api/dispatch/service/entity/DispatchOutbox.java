package com.ridedispatch.api.dispatch.service.entity;

import com.ridedispatch.api.shared.outbox.OutboxStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.UUID;

@Entity
@Table(name = "dispatch_outbox")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchOutbox {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID id;

    private UUID aggregateId;

    private String eventType;

    @Column(length = 4000)
    private String payload;

    @Enumerated(EnumType.STRING)
    private OutboxStatus status;

    private ZonedDateTime createdAt;

    private ZonedDateTime processedAt;

    @Version
    private Long version;
}
