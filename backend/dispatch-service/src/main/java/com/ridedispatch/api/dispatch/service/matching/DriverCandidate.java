package com.ridedispatch.api.dispatch.service.matching;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverCandidate {
    private String driverId;
    private double distanceKm;
    private int etaMinutes;
    private double score;
}
