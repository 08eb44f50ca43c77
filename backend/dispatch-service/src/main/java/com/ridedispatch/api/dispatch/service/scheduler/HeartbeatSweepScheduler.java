package com.ridedispatch.api.dispatch.service.scheduler;

import com.ridedispatch.api.dispatch.service.service.DriverAvailabilityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatch.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HeartbeatSweepScheduler {

    private final DriverAvailabilityService driverAvailabilityService;

    @Scheduled(fixedDelayString = "${dispatch.sweep.interval-ms:60000}")
    public void sweep() {
        try {
            driverAvailabilityService.sweepStaleDrivers();
        } catch (Exception e) {
            log.error("Stale driver sweep failed", e);
        }
    }
}
