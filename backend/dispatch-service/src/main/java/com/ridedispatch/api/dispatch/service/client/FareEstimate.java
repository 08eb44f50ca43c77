package com.ridedispatch.api.dispatch.service.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FareEstimate {
    private BigDecimal amount;
    private Map<String, BigDecimal> breakdown;
}
