package com.ridedispatch.api.dispatch.service.dto;

import com.ridedispatch.api.shared.constants.ActorType;
import com.ridedispatch.api.shared.constants.RideStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusHistoryEntry {
    private RideStatus fromStatus;
    private RideStatus toStatus;
    private ActorType actorType;
    private String actorId;
    private String reason;
    private ZonedDateTime at;
}
