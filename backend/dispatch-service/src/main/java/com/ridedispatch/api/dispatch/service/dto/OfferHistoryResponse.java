package com.ridedispatch.api.dispatch.service.dto;

import com.ridedispatch.api.shared.constants.OfferStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OfferHistoryResponse {
    private UUID rideId;
    private List<OfferView> offers;
    private int driversContacted;
    private int batchesUsed;
    private Map<OfferStatus, Long> countsByStatus;
    private Double averageDistanceKm;
    private Double averageEtaMinutes;
}
