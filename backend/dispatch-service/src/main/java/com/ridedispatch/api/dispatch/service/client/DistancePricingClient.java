package com.ridedispatch.api.dispatch.service.client;

import com.ridedispatch.api.dispatch.service.config.DispatchProperties;
import com.ridedispatch.api.dispatch.service.entity.Ride;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base fare plus a per-kilometer rate over the straight-line trip distance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DistancePricingClient implements PricingClient {

    private final DispatchProperties properties;

    @Override
    public FareEstimate estimateFare(Ride ride) {
        BigDecimal base = BigDecimal.valueOf(properties.getPricing().getBaseFare());
        BigDecimal distance = BigDecimal.valueOf(ride.tripDistanceKm()).multiply(
                BigDecimal.valueOf(properties.getPricing().getPerKm()));

        Map<String, BigDecimal> breakdown = new LinkedHashMap<>();
        breakdown.put("base", base.setScale(2, RoundingMode.HALF_UP));
        breakdown.put("distance", distance.setScale(2, RoundingMode.HALF_UP));

        BigDecimal total = base.add(distance).setScale(2, RoundingMode.HALF_UP);
        log.debug("Estimated fare {} for {} km", total, ride.tripDistanceKm());
        return FareEstimate.builder().amount(total).breakdown(breakdown).build();
    }
}
