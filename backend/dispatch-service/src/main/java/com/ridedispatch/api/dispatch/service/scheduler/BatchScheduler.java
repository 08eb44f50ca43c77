package com.ridedispatch.api.dispatch.service.scheduler;

import com.ridedispatch.api.dispatch.service.config.DispatchProperties;
import com.ridedispatch.api.dispatch.service.entity.Offer;
import com.ridedispatch.api.dispatch.service.entity.Ride;
import com.ridedispatch.api.dispatch.service.event.RideAssignedEvent;
import com.ridedispatch.api.dispatch.service.event.RideCancelledEvent;
import com.ridedispatch.api.dispatch.service.event.RideCreatedEvent;
import com.ridedispatch.api.dispatch.service.exception.InvalidTransitionException;
import com.ridedispatch.api.dispatch.service.matching.BroadcastResult;
import com.ridedispatch.api.dispatch.service.matching.CandidateSelector;
import com.ridedispatch.api.dispatch.service.matching.DriverCandidate;
import com.ridedispatch.api.dispatch.service.matching.OfferBroadcaster;
import com.ridedispatch.api.dispatch.service.repository.OfferRepository;
import com.ridedispatch.api.dispatch.service.repository.RideRepository;
import com.ridedispatch.api.dispatch.service.service.RideStateMachine;
import com.ridedispatch.api.shared.constants.ActorType;
import com.ridedispatch.api.shared.constants.OfferStatus;
import com.ridedispatch.api.shared.constants.RideStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs one dispatch worker per searching ride: select a batch, broadcast it, wait for the
 * window, repeat. The wait is a timer on the dispatch scheduler, cancelled by the
 * assignment or cancellation event rather than by polling the ride.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchScheduler {

    private final ThreadPoolTaskScheduler dispatchTaskScheduler;
    private final CandidateSelector candidateSelector;
    private final OfferBroadcaster offerBroadcaster;
    private final RideRepository rideRepository;
    private final OfferRepository offerRepository;
    private final RideStateMachine rideStateMachine;
    private final DispatchProperties properties;
    private final Clock clock;

    private final Map<UUID, DispatchWorker> workers = new ConcurrentHashMap<>();

    /**
     * Starts the dispatch loop for a ride. Calling it again while a loop is running is a no-op.
     */
    public boolean scheduleRide(UUID rideId) {
        DispatchWorker created = new DispatchWorker(rideId);
        DispatchWorker existing = workers.putIfAbsent(rideId, created);
        if (existing != null) {
            log.debug("Ride {} already has a dispatch worker", rideId);
            return false;
        }
        log.info("Starting dispatch for ride {}", rideId);
        dispatchTaskScheduler.execute(() -> guarded(created, () -> runRound(created)));
        return true;
    }

    /**
     * Picks up a searching ride after a restart. An open window is waited out; otherwise
     * stale offers are expired and the next batch goes out.
     */
    public boolean resume(Ride ride) {
        DispatchWorker worker = new DispatchWorker(ride.getId());
        if (workers.putIfAbsent(ride.getId(), worker) != null) {
            return false;
        }
        int expired = offerBroadcaster.expireElapsed(ride.getId());

        Optional<Offer> open = offerRepository.findByRideIdAndStatus(ride.getId(), OfferStatus.PENDING).stream()
                .max(Comparator.comparing(Offer::getExpiresAt));
        if (open.isPresent()) {
            Offer latest = open.get();
            log.info("Resuming ride {}: batch {} open until {}", ride.getId(), latest.getBatchNumber(), latest.getExpiresAt());
            synchronized (worker) {
                armWindow(worker, latest.getBatchNumber(), latest.getExpiresAt());
            }
        } else {
            log.info("Resuming ride {}: {} stale offers expired, issuing next batch", ride.getId(), expired);
            dispatchTaskScheduler.execute(() -> guarded(worker, () -> runRound(worker)));
        }
        return true;
    }

    public void stop(UUID rideId) {
        DispatchWorker worker = workers.remove(rideId);
        if (worker == null) {
            return;
        }
        worker.stopped = true;
        ScheduledFuture<?> timer = worker.windowTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        log.info("Dispatch for ride {} stopped", rideId);
    }

    public boolean isDispatching(UUID rideId) {
        return workers.containsKey(rideId);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRideCreated(RideCreatedEvent event) {
        scheduleRide(event.getRideId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRideAssigned(RideAssignedEvent event) {
        stop(event.getRideId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRideCancelled(RideCancelledEvent event) {
        stop(event.getRideId());
    }

    void runRound(DispatchWorker worker) {
        synchronized (worker) {
            while (!worker.stopped) {
                Optional<Ride> found = rideRepository.findById(worker.rideId);
                if (found.isEmpty() || found.get().getStatus() != RideStatus.SEARCHING) {
                    finish(worker);
                    return;
                }
                Ride ride = found.get();
                ZonedDateTime now = ZonedDateTime.now(clock);

                int batchesUsed = offerRepository.findLatestBatchNumber(ride.getId());
                if (batchesUsed >= properties.getMaxBatches()) {
                    exhaust(worker, "Offered " + batchesUsed + " batches without acceptance");
                    return;
                }
                if (ride.getCreatedAt() != null && now.isAfter(ride.getCreatedAt().plus(properties.getSearchTimeout()))) {
                    exhaust(worker, "Search timed out");
                    return;
                }

                Set<String> exclude = new HashSet<>(offerRepository.findDriverIdsByRideId(ride.getId()));
                exclude.addAll(worker.skippedDriverIds);
                List<DriverCandidate> batch = candidateSelector.selectBatch(ride.getPickup(), ride.getVehicleType(),
                        ride.getServiceTier(), exclude, properties.getBatchSize());
                if (batch.isEmpty()) {
                    exhaust(worker, "No drivers available");
                    return;
                }

                BroadcastResult result = offerBroadcaster.broadcast(ride.getId(), batch);
                if (result.isRideSettled()) {
                    finish(worker);
                    return;
                }
                worker.skippedDriverIds.addAll(result.getSkippedDriverIds());
                if (!result.getOfferedDriverIds().isEmpty()) {
                    armWindow(worker, result.getBatchNumber(), result.getExpiresAt());
                    return;
                }
                log.warn("Nobody in batch for ride {} was reachable, selecting again", ride.getId());
            }
        }
    }

    void onWindowElapsed(DispatchWorker worker, int batchNumber) {
        synchronized (worker) {
            if (worker.stopped || worker.currentBatch != batchNumber) {
                return;
            }
            int expired = offerBroadcaster.expireBatch(worker.rideId, batchNumber);
            log.info("Window of batch {} for ride {} elapsed, {} offers expired", batchNumber, worker.rideId, expired);
            worker.windowTimer = null;
            runRound(worker);
        }
    }

    private void armWindow(DispatchWorker worker, int batchNumber, ZonedDateTime expiresAt) {
        worker.currentBatch = batchNumber;
        worker.windowTimer = dispatchTaskScheduler.schedule(
                () -> guarded(worker, () -> onWindowElapsed(worker, batchNumber)), expiresAt.toInstant());
    }

    private void exhaust(DispatchWorker worker, String reason) {
        try {
            rideStateMachine.transition(worker.rideId, RideStatus.NO_DRIVERS_AVAILABLE, ActorType.SYSTEM, null, reason);
            log.info("Ride {} exhausted: {}", worker.rideId, reason);
        } catch (InvalidTransitionException e) {
            // Settled by an accept or a cancel in the meantime
            log.info("Ride {} left searching before exhaustion: {}", worker.rideId, e.getMessage());
        }
        finish(worker);
    }

    private void finish(DispatchWorker worker) {
        worker.stopped = true;
        workers.remove(worker.rideId, worker);
    }

    private void guarded(DispatchWorker worker, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.error("Dispatch step for ride {} failed, worker dropped until recovery", worker.rideId, e);
            finish(worker);
        }
    }

    static final class DispatchWorker {
        private final UUID rideId;
        // Unreachable candidates, kept out for the rest of this cycle
        private final Set<String> skippedDriverIds = ConcurrentHashMap.newKeySet();
        private volatile boolean stopped;
        private volatile int currentBatch;
        private volatile ScheduledFuture<?> windowTimer;

        DispatchWorker(UUID rideId) {
            this.rideId = rideId;
        }
    }
}
