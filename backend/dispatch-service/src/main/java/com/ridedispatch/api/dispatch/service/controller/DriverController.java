package com.ridedispatch.api.dispatch.service.controller;

import com.ridedispatch.api.dispatch.service.dto.AcceptResult;
import com.ridedispatch.api.dispatch.service.dto.DriverStatusRequest;
import com.ridedispatch.api.dispatch.service.dto.RejectOutcome;
import com.ridedispatch.api.dispatch.service.dto.RideStatusResponse;
import com.ridedispatch.api.dispatch.service.entity.DriverAvailability;
import com.ridedispatch.api.dispatch.service.service.DriverAvailabilityService;
import com.ridedispatch.api.dispatch.service.service.RideDispatchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/driver")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class DriverController {

    private final RideDispatchService rideDispatchService;
    private final DriverAvailabilityService driverAvailabilityService;

    @PostMapping("/{driverId}/offers/{offerId}/accept")
    public ResponseEntity<AcceptResult> acceptOffer(@PathVariable String driverId, @PathVariable UUID offerId) {
        log.info("Driver {} accepting offer {}", driverId, offerId);
        // Losing the race is a normal answer, not an error status
        return ResponseEntity.ok(rideDispatchService.acceptOffer(offerId, driverId));
    }

    @PostMapping("/{driverId}/offers/{offerId}/reject")
    public ResponseEntity<RejectOutcome> rejectOffer(@PathVariable String driverId,
                                                     @PathVariable UUID offerId,
                                                     @RequestParam(required = false) String reason) {
        log.info("Driver {} rejecting offer {}", driverId, offerId);
        return ResponseEntity.ok(rideDispatchService.rejectOffer(offerId, driverId, reason));
    }

    @PostMapping("/{driverId}/online")
    public ResponseEntity<DriverAvailability> goOnline(@PathVariable String driverId,
                                                       @Valid @RequestBody(required = false) DriverStatusRequest request) {
        return ResponseEntity.ok(driverAvailabilityService.goOnline(driverId, request));
    }

    @PostMapping("/{driverId}/offline")
    public ResponseEntity<DriverAvailability> goOffline(@PathVariable String driverId) {
        return ResponseEntity.ok(driverAvailabilityService.goOffline(driverId));
    }

    @PostMapping("/{driverId}/location")
    public ResponseEntity<String> updateLocation(@PathVariable String driverId,
                                                 @RequestParam Double latitude,
                                                 @RequestParam Double longitude) {
        driverAvailabilityService.updateLocation(driverId, latitude, longitude);
        return ResponseEntity.ok("Driver location updated successfully");
    }

    @PostMapping("/{driverId}/heartbeat")
    public ResponseEntity<Void> heartbeat(@PathVariable String driverId) {
        driverAvailabilityService.heartbeat(driverId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{driverId}")
    public ResponseEntity<DriverAvailability> getAvailability(@PathVariable String driverId) {
        DriverAvailability availability = driverAvailabilityService.getAvailability(driverId);
        return availability != null ? ResponseEntity.ok(availability) : ResponseEntity.notFound().build();
    }

    @PostMapping("/{driverId}/rides/{rideId}/arrived")
    public ResponseEntity<RideStatusResponse> arrived(@PathVariable String driverId, @PathVariable UUID rideId) {
        log.info("Driver {} arrived for ride {}", driverId, rideId);
        return ResponseEntity.ok(rideDispatchService.markArrived(rideId, driverId));
    }

    @PostMapping("/{driverId}/rides/{rideId}/start")
    public ResponseEntity<RideStatusResponse> start(@PathVariable String driverId, @PathVariable UUID rideId) {
        log.info("Driver {} starting ride {}", driverId, rideId);
        return ResponseEntity.ok(rideDispatchService.startRide(rideId, driverId));
    }

    @PostMapping("/{driverId}/rides/{rideId}/complete")
    public ResponseEntity<RideStatusResponse> complete(@PathVariable String driverId, @PathVariable UUID rideId) {
        log.info("Driver {} completing ride {}", driverId, rideId);
        return ResponseEntity.ok(rideDispatchService.completeRide(rideId, driverId));
    }

    @GetMapping("/available-count")
    public ResponseEntity<Long> getAvailableDriverCount() {
        return ResponseEntity.ok(driverAvailabilityService.countDispatchable());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Dispatch Service is healthy");
    }
}
