package com.ridedispatch.api.dispatch.service.matching;

import com.ridedispatch.api.dispatch.service.dto.AcceptResult;
import com.ridedispatch.api.dispatch.service.exception.AcceptRolledBackException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Decides the accept race. Exactly one driver per ride gets {@code WON}; everyone else
 * gets a typed reason. Losing is a normal outcome and is returned, never thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AcceptanceArbitrator {

    private final AssignmentTransaction assignmentTransaction;

    public AcceptResult tryAccept(UUID rideId, String driverId) {
        AcceptResult result;
        try {
            result = assignmentTransaction.assign(rideId, driverId);
        } catch (AcceptRolledBackException e) {
            log.warn("Driver {} won the ride update for {} but the assignment was rolled back: {}",
                    driverId, rideId, e.getOutcome());
            return AcceptResult.of(e.getOutcome(), rideId, driverId);
        }
        if (!result.isWon()) {
            log.warn("Driver {} did not get ride {}: {}", driverId, rideId, result.getOutcome());
        }
        return result;
    }
}
