package com.ridedispatch.api.dispatch.service;

import com.ridedispatch.api.dispatch.service.config.DispatchProperties;
import com.ridedispatch.api.dispatch.service.dto.AcceptOutcome;
import com.ridedispatch.api.dispatch.service.dto.AcceptResult;
import com.ridedispatch.api.dispatch.service.dto.CreateRideRequest;
import com.ridedispatch.api.dispatch.service.dto.LocationDTO;
import com.ridedispatch.api.dispatch.service.dto.OfferHistoryResponse;
import com.ridedispatch.api.dispatch.service.dto.RejectOutcome;
import com.ridedispatch.api.dispatch.service.dto.RideStatusResponse;
import com.ridedispatch.api.dispatch.service.dto.StatusHistoryEntry;
import com.ridedispatch.api.dispatch.service.entity.DriverAvailability;
import com.ridedispatch.api.dispatch.service.entity.Offer;
import com.ridedispatch.api.dispatch.service.entity.Ride;
import com.ridedispatch.api.dispatch.service.entity.RideStatusHistory;
import com.ridedispatch.api.dispatch.service.exception.ActiveRideExistsException;
import com.ridedispatch.api.dispatch.service.exception.InvalidTransitionException;
import com.ridedispatch.api.dispatch.service.matching.AcceptanceArbitrator;
import com.ridedispatch.api.dispatch.service.registry.ClientConnection;
import com.ridedispatch.api.dispatch.service.registry.ConnectionRegistry;
import com.ridedispatch.api.dispatch.service.repository.ConnectionRecordRepository;
import com.ridedispatch.api.dispatch.service.repository.DispatchOutboxRepository;
import com.ridedispatch.api.dispatch.service.repository.DriverAvailabilityRepository;
import com.ridedispatch.api.dispatch.service.repository.OfferRepository;
import com.ridedispatch.api.dispatch.service.repository.RideRepository;
import com.ridedispatch.api.dispatch.service.repository.RideStatusHistoryRepository;
import com.ridedispatch.api.dispatch.service.scheduler.BatchScheduler;
import com.ridedispatch.api.dispatch.service.service.RideDispatchService;
import com.ridedispatch.api.shared.constants.OfferStatus;
import com.ridedispatch.api.shared.constants.RealtimeEvents;
import com.ridedispatch.api.shared.constants.RideStatus;
import com.ridedispatch.api.shared.constants.UserType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

@SpringBootTest(properties = "dispatch.offer-window=1s")
class DispatchEngineIntegrationTest {

    private static final double PICKUP_LAT = 40.7128;
    private static final double PICKUP_LON = -74.0060;
    private static final double KM_PER_DEGREE = 111.195;
    private static final Duration WINDOW = Duration.ofSeconds(1);
    private static final Duration AWAIT = Duration.ofSeconds(10);

    @Autowired
    private RideDispatchService rideDispatchService;
    @Autowired
    private AcceptanceArbitrator acceptanceArbitrator;
    @Autowired
    private BatchScheduler batchScheduler;
    @Autowired
    private ConnectionRegistry connectionRegistry;
    @Autowired
    private DispatchProperties properties;
    @Autowired
    private RideRepository rideRepository;
    @Autowired
    private OfferRepository offerRepository;
    @Autowired
    private DriverAvailabilityRepository driverAvailabilityRepository;
    @Autowired
    private RideStatusHistoryRepository historyRepository;
    @Autowired
    private DispatchOutboxRepository outboxRepository;
    @Autowired
    private ConnectionRecordRepository connectionRecordRepository;

    private final Map<String, RecordingConnection> connections = new ConcurrentHashMap<>();
    private int defaultBatchSize;
    private Duration defaultOfferWindow;

    @BeforeEach
    void setUp() {
        defaultBatchSize = properties.getBatchSize();
        defaultOfferWindow = properties.getOfferWindow();
    }

    @AfterEach
    void tearDown() {
        properties.setBatchSize(defaultBatchSize);
        properties.setOfferWindow(defaultOfferWindow);
        rideRepository.findAll().forEach(ride -> batchScheduler.stop(ride.getId()));
        connections.values().forEach(c -> connectionRegistry.unregister(c.getId()));
        connections.clear();

        offerRepository.deleteAll();
        historyRepository.deleteAll();
        outboxRepository.deleteAll();
        rideRepository.deleteAll();
        driverAvailabilityRepository.deleteAll();
        connectionRecordRepository.deleteAll();
    }

    @Test
    void concurrentAcceptsProduceExactlyOneWinner() throws Exception {
        List<String> drivers = List.of("d-1", "d-2", "d-3", "d-4", "d-5");
        for (int i = 0; i < drivers.size(); i++) {
            onlineDriver(drivers.get(i), 0.5 + i * 0.2);
        }
        UUID rideId = createRide("customer-race");
        awaitUntil(() -> offerRepository.countByRideId(rideId) == drivers.size());

        List<AcceptResult> results = race(drivers.stream()
                .map(driverId -> (Callable<AcceptResult>) () -> acceptanceArbitrator.tryAccept(rideId, driverId))
                .collect(Collectors.toList()));

        List<AcceptResult> winners = results.stream().filter(AcceptResult::isWon).collect(Collectors.toList());
        assertEquals(1, winners.size());
        for (AcceptResult loser : results) {
            if (!loser.isWon()) {
                assertTrue(loser.getOutcome() == AcceptOutcome.LOST_RACE || loser.getOutcome() == AcceptOutcome.EXPIRED,
                        "unexpected " + loser.getOutcome());
            }
        }

        String winner = winners.get(0).getDriverId();
        Ride ride = rideRepository.findById(rideId).orElseThrow();
        assertEquals(RideStatus.ASSIGNED, ride.getStatus());
        assertEquals(winner, ride.getAssignedDriverId());

        List<Offer> offers = offerRepository.findByRideIdOrderByBatchNumberAscCreatedAtAsc(rideId);
        assertEquals(1, offers.stream().filter(o -> o.getStatus() == OfferStatus.ACCEPTED).count());
        assertEquals(drivers.size() - 1, offers.stream().filter(o -> o.getStatus() == OfferStatus.SUPERSEDED).count());
        assertFalse(driverAvailabilityRepository.findById(winner).orElseThrow().isAvailable());
    }

    @Test
    void settledRideIsNeverMutatedByLateAccepts() {
        onlineDriver("d-1", 1.0);
        onlineDriver("d-2", 1.5);
        UUID rideId = createRide("customer-late");
        awaitUntil(() -> offerRepository.countByRideId(rideId) == 2);

        assertEquals(AcceptOutcome.WON, acceptanceArbitrator.tryAccept(rideId, "d-1").getOutcome());
        Ride before = rideRepository.findById(rideId).orElseThrow();
        Map<String, OfferStatus> offersBefore = offerStatuses(rideId);

        assertEquals(AcceptOutcome.RIDE_NOT_SEARCHING, acceptanceArbitrator.tryAccept(rideId, "d-1").getOutcome());
        assertEquals(AcceptOutcome.LOST_RACE, acceptanceArbitrator.tryAccept(rideId, "d-2").getOutcome());
        assertEquals(AcceptOutcome.NO_OFFER, acceptanceArbitrator.tryAccept(rideId, "stranger").getOutcome());

        Ride after = rideRepository.findById(rideId).orElseThrow();
        assertEquals(before.getVersion(), after.getVersion());
        assertEquals(before.getStatus(), after.getStatus());
        assertEquals("d-1", after.getAssignedDriverId());
        assertEquals(offersBefore, offerStatuses(rideId));
    }

    @Test
    void cancelRacingAcceptSettlesConsistently() throws Exception {
        for (int round = 0; round < 5; round++) {
            String driverId = "race-driver-" + round;
            String customerId = "race-customer-" + round;
            onlineDriver(driverId, 1.0);
            UUID rideId = createRide(customerId);
            awaitUntil(() -> offerRepository.findByRideIdAndDriverId(rideId, driverId).isPresent());

            List<Callable<Boolean>> attempts = new ArrayList<>();
            attempts.add(() -> acceptanceArbitrator.tryAccept(rideId, driverId).isWon());
            attempts.add(() -> {
                try {
                    rideDispatchService.cancelRide(rideId, customerId, "changed my mind");
                    return true;
                } catch (InvalidTransitionException e) {
                    return false;
                }
            });
            List<Boolean> outcomes = race(attempts);
            boolean accepted = outcomes.get(0);
            boolean cancelled = outcomes.get(1);
            assertTrue(accepted || cancelled, "round " + round + " settled nothing");

            Ride ride = rideRepository.findById(rideId).orElseThrow();
            List<RideStatus> path = historyRepository.findByRideIdOrderByCreatedAtAsc(rideId).stream()
                    .map(RideStatusHistory::getToStatus)
                    .collect(Collectors.toList());
            if (!cancelled) {
                assertEquals(RideStatus.ASSIGNED, ride.getStatus());
                assertEquals(driverId, ride.getAssignedDriverId());
                assertEquals(List.of(RideStatus.SEARCHING, RideStatus.ASSIGNED), path);
            } else {
                assertEquals(RideStatus.CANCELLED, ride.getStatus());
                assertNull(ride.getAssignedDriverId());
                assertTrue(driverAvailabilityRepository.findById(driverId).orElseThrow().isAvailable());
                if (accepted) {
                    // Cancel landed after the assignment committed
                    assertEquals(List.of(RideStatus.SEARCHING, RideStatus.ASSIGNED, RideStatus.CANCELLED), path);
                } else {
                    assertEquals(List.of(RideStatus.SEARCHING, RideStatus.CANCELLED), path);
                    assertEquals(OfferStatus.EXPIRED, offerStatuses(rideId).get(driverId));
                }
            }
            assertFalse(offerStatuses(rideId).containsValue(OfferStatus.PENDING));
        }
    }

    @Test
    void driverOfferedTwoRidesCanHoldOnlyOne() {
        properties.setOfferWindow(Duration.ofSeconds(30));
        onlineDriver("shared", 0.5);
        UUID first = createRide("customer-first");
        UUID second = createRide("customer-second");
        awaitUntil(() -> offerRepository.countByRideId(first) == 1 && offerRepository.countByRideId(second) == 1);
        Offer firstOffer = offerRepository.findByRideIdAndDriverId(first, "shared").orElseThrow();
        Offer secondOffer = offerRepository.findByRideIdAndDriverId(second, "shared").orElseThrow();

        assertEquals(AcceptOutcome.WON, rideDispatchService.acceptOffer(firstOffer.getId(), "shared").getOutcome());
        assertEquals(AcceptOutcome.DRIVER_BUSY, rideDispatchService.acceptOffer(secondOffer.getId(), "shared").getOutcome());

        assertEquals(RideStatus.ASSIGNED, rideStatus(first));
        Ride untouched = rideRepository.findById(second).orElseThrow();
        assertEquals(RideStatus.SEARCHING, untouched.getStatus());
        assertNull(untouched.getAssignedDriverId());
        assertEquals(OfferStatus.PENDING, offerStatuses(second).get("shared"));
    }

    @Test
    void driverRacingTwoRidesAtOnceWinsExactlyOne() throws Exception {
        properties.setOfferWindow(Duration.ofSeconds(30));
        onlineDriver("double", 0.5);
        UUID first = createRide("customer-left");
        UUID second = createRide("customer-right");
        awaitUntil(() -> offerRepository.countByRideId(first) == 1 && offerRepository.countByRideId(second) == 1);

        List<AcceptResult> results = race(List.<Callable<AcceptResult>>of(
                () -> acceptanceArbitrator.tryAccept(first, "double"),
                () -> acceptanceArbitrator.tryAccept(second, "double")));

        assertEquals(1, results.stream().filter(AcceptResult::isWon).count());
        AcceptResult loser = results.stream().filter(r -> !r.isWon()).findFirst().orElseThrow();
        assertEquals(AcceptOutcome.DRIVER_BUSY, loser.getOutcome());
        assertEquals(RideStatus.SEARCHING, rideStatus(loser.getRideId()));
        assertEquals(OfferStatus.PENDING, offerStatuses(loser.getRideId()).get("double"));
        assertEquals(1, rideRepository.countByAssignedDriverIdAndStatusIn("double", RideStatus.holdingDriver()));
    }

    @Test
    void winnerWithinWindowStopsFurtherBatches() throws Exception {
        onlineDriver("D1", 1.0);
        onlineDriver("D2", 1.2);
        onlineDriver("D3", 1.4);
        onlineDriver("D4", 1.6);
        properties.setBatchSize(3);
        RecordingConnection customer = connectCustomer("customer-r1");

        UUID rideId = createRide("customer-r1");
        awaitUntil(() -> offerRepository.countByRideId(rideId) == 3);
        assertEquals(Set.of("D1", "D2", "D3"), offerStatuses(rideId).keySet());

        assertEquals(AcceptOutcome.WON, acceptanceArbitrator.tryAccept(rideId, "D2").getOutcome());
        assertEquals(AcceptOutcome.LOST_RACE, acceptanceArbitrator.tryAccept(rideId, "D1").getOutcome());

        Thread.sleep(WINDOW.toMillis() + 500);

        assertEquals(3, offerRepository.countByRideId(rideId));
        assertEquals(1, offerRepository.findLatestBatchNumber(rideId));
        assertFalse(batchScheduler.isDispatching(rideId));
        Ride ride = rideRepository.findById(rideId).orElseThrow();
        assertEquals(RideStatus.ASSIGNED, ride.getStatus());
        assertEquals("D2", ride.getAssignedDriverId());

        assertTrue(connections.get("D3").received(RealtimeEvents.RIDE_REQUEST_CANCELLED));
        assertTrue(connections.get("D3").received(RealtimeEvents.REASON_ACCEPTED_BY_ANOTHER_DRIVER));
        assertFalse(connections.get("D4").received(RealtimeEvents.RIDE_REQUEST_NEW));
        assertTrue(customer.received(RealtimeEvents.RIDE_DRIVER_ASSIGNED));
    }

    @Test
    void emptyPoolEndsInNoDriversWithoutOffers() {
        RecordingConnection customer = connectCustomer("customer-r2");

        UUID rideId = createRide("customer-r2");
        awaitUntil(() -> rideStatus(rideId) == RideStatus.NO_DRIVERS_AVAILABLE);

        assertEquals(0, offerRepository.countByRideId(rideId));
        assertFalse(batchScheduler.isDispatching(rideId));
        assertTrue(customer.received(RealtimeEvents.RIDE_NO_DRIVERS_AVAILABLE));

        List<StatusHistoryEntry> history = rideDispatchService.getStatusHistory(rideId);
        assertEquals(2, history.size());
        assertEquals(RideStatus.SEARCHING, history.get(0).getToStatus());
        assertEquals(RideStatus.NO_DRIVERS_AVAILABLE, history.get(1).getToStatus());
    }

    @Test
    void laterBatchesNeverRepeatDriversAndPoolExhausts() {
        properties.setBatchSize(2);
        for (int i = 0; i < 4; i++) {
            onlineDriver("b-" + i, 0.5 + i * 0.3);
        }

        UUID rideId = createRide("customer-batches");
        awaitUntil(() -> rideStatus(rideId) == RideStatus.NO_DRIVERS_AVAILABLE);

        List<Offer> offers = offerRepository.findByRideIdOrderByBatchNumberAscCreatedAtAsc(rideId);
        assertEquals(4, offers.size());
        assertEquals(4, offers.stream().map(Offer::getDriverId).distinct().count());

        List<Offer> first = offers.stream().filter(o -> o.getBatchNumber() == 1).collect(Collectors.toList());
        List<Offer> second = offers.stream().filter(o -> o.getBatchNumber() == 2).collect(Collectors.toList());
        assertEquals(Set.of("b-0", "b-1"), first.stream().map(Offer::getDriverId).collect(Collectors.toSet()));
        assertEquals(Set.of("b-2", "b-3"), second.stream().map(Offer::getDriverId).collect(Collectors.toSet()));

        ZonedDateTime firstExpiry = first.get(0).getExpiresAt();
        ZonedDateTime secondCreated = second.get(0).getCreatedAt();
        assertTrue(first.stream().allMatch(o -> o.getExpiresAt().isEqual(firstExpiry)));
        // Batch 1 was closed out before batch 2 was written
        assertTrue(first.stream().noneMatch(o -> o.getRespondedAt().isAfter(secondCreated)));
        assertTrue(offers.stream().allMatch(o -> o.getStatus() == OfferStatus.EXPIRED));

        OfferHistoryResponse history = rideDispatchService.getOfferHistory(rideId);
        assertEquals(4, history.getDriversContacted());
        assertEquals(2, history.getBatchesUsed());
        assertEquals(4L, history.getCountsByStatus().get(OfferStatus.EXPIRED));
    }

    @Test
    void rejectingDoesNotAdvanceTheBatchEarly() {
        properties.setBatchSize(1);
        onlineDriver("first", 0.5);
        onlineDriver("second", 1.0);

        UUID rideId = createRide("customer-reject");
        awaitUntil(() -> offerRepository.countByRideId(rideId) == 1);
        Offer offer = offerRepository.findByRideIdAndDriverId(rideId, "first").orElseThrow();

        assertEquals(RejectOutcome.REJECTED, rideDispatchService.rejectOffer(offer.getId(), "first", "too far"));
        assertEquals(RejectOutcome.NOT_PENDING, rideDispatchService.rejectOffer(offer.getId(), "first", "again"));
        assertEquals(1, offerRepository.countByRideId(rideId));

        awaitUntil(() -> offerRepository.countByRideId(rideId) == 2);
        Offer next = offerRepository.findByRideIdAndDriverId(rideId, "second").orElseThrow();
        assertEquals(2, next.getBatchNumber());
        assertEquals(OfferStatus.REJECTED, offerStatuses(rideId).get("first"));
        Offer rejected = offerRepository.findById(offer.getId()).orElseThrow();
        assertEquals("too far", rejected.getRejectionReason());
    }

    @Test
    void cancellationWhileSearchingVoidsOffers() {
        onlineDriver("c-1", 0.5);
        onlineDriver("c-2", 0.8);

        UUID rideId = createRide("customer-cancel");
        awaitUntil(() -> offerRepository.countByRideId(rideId) == 2);

        RideStatusResponse cancelled = rideDispatchService.cancelRide(rideId, "customer-cancel", null);

        assertEquals(RideStatus.CANCELLED, cancelled.getStatus());
        assertFalse(batchScheduler.isDispatching(rideId));
        assertTrue(offerStatuses(rideId).values().stream().allMatch(s -> s == OfferStatus.EXPIRED));
        assertTrue(connections.get("c-1").received(RealtimeEvents.REASON_CANCELLED_BY_CUSTOMER));
        assertTrue(connections.get("c-2").received(RealtimeEvents.REASON_CANCELLED_BY_CUSTOMER));
        assertEquals(AcceptOutcome.RIDE_NOT_SEARCHING, acceptanceArbitrator.tryAccept(rideId, "c-1").getOutcome());
    }

    @Test
    void tripRunsToCompletionAndReleasesDriver() {
        onlineDriver("trip-driver", 0.5);
        UUID rideId = createRide("customer-trip");
        awaitUntil(() -> offerRepository.countByRideId(rideId) == 1);
        Offer offer = offerRepository.findByRideIdAndDriverId(rideId, "trip-driver").orElseThrow();

        assertThrows(ActiveRideExistsException.class, () -> createRide("customer-trip"));
        assertEquals(AcceptOutcome.WON, rideDispatchService.acceptOffer(offer.getId(), "trip-driver").getOutcome());
        assertThrows(InvalidTransitionException.class, () -> rideDispatchService.completeRide(rideId, "trip-driver"));

        rideDispatchService.markArrived(rideId, "trip-driver");
        rideDispatchService.startRide(rideId, "trip-driver");
        RideStatusResponse done = rideDispatchService.completeRide(rideId, "trip-driver");

        assertEquals(RideStatus.COMPLETED, done.getStatus());
        assertTrue(driverAvailabilityRepository.findById("trip-driver").orElseThrow().isAvailable());
        List<RideStatus> path = rideDispatchService.getStatusHistory(rideId).stream()
                .map(StatusHistoryEntry::getToStatus)
                .collect(Collectors.toList());
        assertEquals(List.of(RideStatus.SEARCHING, RideStatus.ASSIGNED, RideStatus.ARRIVED,
                RideStatus.IN_PROGRESS, RideStatus.COMPLETED), path);
        assertEquals(5, outboxRepository.findByAggregateId(rideId).size());
    }

    @Test
    void exhaustedRideCanBeRedispatchedAsNewRide() {
        UUID rideId = createRide("customer-again");
        awaitUntil(() -> rideStatus(rideId) == RideStatus.NO_DRIVERS_AVAILABLE);

        onlineDriver("late-driver", 0.5);
        RideStatusResponse retry = rideDispatchService.redispatch(rideId, "customer-again");

        assertNotEquals(rideId, retry.getRideId());
        assertEquals(RideStatus.SEARCHING, retry.getStatus());
        awaitUntil(() -> offerRepository.countByRideId(retry.getRideId()) == 1);
        assertEquals(RideStatus.NO_DRIVERS_AVAILABLE, rideStatus(rideId));
    }

    private UUID createRide(String customerId) {
        CreateRideRequest request = CreateRideRequest.builder()
                .customerId(customerId)
                .pickup(LocationDTO.builder().latitude(PICKUP_LAT).longitude(PICKUP_LON).address("City Hall").build())
                .dropoff(LocationDTO.builder().latitude(40.7580).longitude(-73.9855).address("Times Square").build())
                .build();
        return rideDispatchService.createRide(request).getRideId();
    }

    private void onlineDriver(String driverId, double kmNorthOfPickup) {
        ZonedDateTime now = ZonedDateTime.now();
        driverAvailabilityRepository.save(DriverAvailability.builder()
                .driverId(driverId)
                .online(true)
                .available(true)
                .latitude(PICKUP_LAT + kmNorthOfPickup / KM_PER_DEGREE)
                .longitude(PICKUP_LON)
                .vehicleType("sedan")
                .serviceTier("standard")
                .rating(4.5)
                .availableSince(now)
                .lastSeenAt(now)
                .updatedAt(now)
                .build());
        RecordingConnection connection = new RecordingConnection("conn-" + driverId);
        connections.put(driverId, connection);
        connectionRegistry.register(driverId, UserType.DRIVER, connection);
    }

    private RecordingConnection connectCustomer(String customerId) {
        RecordingConnection connection = new RecordingConnection("conn-" + customerId);
        connections.put(customerId, connection);
        connectionRegistry.register(customerId, UserType.CUSTOMER, connection);
        return connection;
    }

    private RideStatus rideStatus(UUID rideId) {
        return rideRepository.findById(rideId).map(Ride::getStatus).orElse(null);
    }

    private Map<String, OfferStatus> offerStatuses(UUID rideId) {
        return offerRepository.findByRideIdOrderByBatchNumberAscCreatedAtAsc(rideId).stream()
                .collect(Collectors.toMap(Offer::getDriverId, Offer::getStatus));
    }

    // Releases all tasks at once and returns their results in submission order
    private static <T> List<T> race(List<Callable<T>> tasks) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch gate = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(pool.submit(() -> {
                    gate.await();
                    return task.call();
                }));
            }
            gate.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(AWAIT.toMillis(), TimeUnit.MILLISECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private static void awaitUntil(BooleanSupplier condition) {
        long deadline = System.nanoTime() + AWAIT.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted while waiting");
            }
        }
        fail("condition not met within " + AWAIT);
    }

    static class RecordingConnection implements ClientConnection {
        private final String id;
        private final List<String> sent = new CopyOnWriteArrayList<>();

        RecordingConnection(String id) {
            this.id = id;
        }

        boolean received(String fragment) {
            return sent.stream().anyMatch(text -> text.contains(fragment));
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public boolean isOpen() {
            return true;
        }

        @Override
        public void send(String text) {
            sent.add(text);
        }
    }
}
