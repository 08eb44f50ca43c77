package com.ridedispatch.api.dispatch.service.entity;

import com.ridedispatch.api.shared.constants.UserType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Entity
@Table(name = "socket_connections",
        indexes = @Index(name = "idx_connection_user", columnList = "user_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionRecord {

    @Id
    @Column(name = "connection_id")
    private String connectionId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    private UserType userType;

    @Column(name = "is_connected")
    private boolean connected;

    private ZonedDateTime connectedAt;
    private ZonedDateTime disconnectedAt;
    private ZonedDateTime lastActivityAt;
}
