package com.ridedispatch.api.dispatch.service.scheduler;

import com.ridedispatch.api.dispatch.service.entity.Ride;
import com.ridedispatch.api.dispatch.service.repository.ConnectionRecordRepository;
import com.ridedispatch.api.dispatch.service.repository.RideRepository;
import com.ridedispatch.api.shared.constants.RideStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Rebuilds in-process dispatch state after a restart. Connections from the previous
 * process are gone, and rides still searching need a worker again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatch", name = "recovery-enabled", havingValue = "true", matchIfMissing = true)
public class DispatchRecoveryRunner implements ApplicationRunner {

    private final RideRepository rideRepository;
    private final ConnectionRecordRepository connectionRecordRepository;
    private final BatchScheduler batchScheduler;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        int closed = connectionRecordRepository.markAllDisconnected(ZonedDateTime.now(clock));
        if (closed > 0) {
            log.info("Closed {} connection records left over from the previous run", closed);
        }

        List<Ride> searching = rideRepository.findByStatus(RideStatus.SEARCHING);
        int resumed = 0;
        for (Ride ride : searching) {
            try {
                if (batchScheduler.resume(ride)) {
                    resumed++;
                }
            } catch (RuntimeException e) {
                log.error("Could not resume dispatch for ride {}", ride.getId(), e);
            }
        }
        log.info("Recovery resumed {} of {} searching rides", resumed, searching.size());
    }
}
