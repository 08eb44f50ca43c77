package com.ridedispatch.api.dispatch.service.controller;

import com.ridedispatch.api.dispatch.service.dto.CreateRideRequest;
import com.ridedispatch.api.dispatch.service.dto.OfferHistoryResponse;
import com.ridedispatch.api.dispatch.service.dto.RideStatusResponse;
import com.ridedispatch.api.dispatch.service.dto.StatusHistoryEntry;
import com.ridedispatch.api.dispatch.service.service.RideDispatchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/rides")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class RideController {

    private final RideDispatchService rideDispatchService;

    @PostMapping
    public ResponseEntity<RideStatusResponse> createRide(@Valid @RequestBody CreateRideRequest request) {
        log.info("Ride requested by customer: {}", request.getCustomerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(rideDispatchService.createRide(request));
    }

    @GetMapping("/{rideId}")
    public ResponseEntity<RideStatusResponse> getRideStatus(@PathVariable UUID rideId) {
        return ResponseEntity.ok(rideDispatchService.getRideStatus(rideId));
    }

    @GetMapping("/{rideId}/offers")
    public ResponseEntity<OfferHistoryResponse> getOfferHistory(@PathVariable UUID rideId) {
        return ResponseEntity.ok(rideDispatchService.getOfferHistory(rideId));
    }

    @GetMapping("/{rideId}/history")
    public ResponseEntity<List<StatusHistoryEntry>> getStatusHistory(@PathVariable UUID rideId) {
        return ResponseEntity.ok(rideDispatchService.getStatusHistory(rideId));
    }

    @PostMapping("/{rideId}/cancel")
    public ResponseEntity<RideStatusResponse> cancelRide(@PathVariable UUID rideId,
                                                         @RequestParam String customerId,
                                                         @RequestParam(required = false) String reason) {
        log.info("Cancel requested for ride {} by customer {}", rideId, customerId);
        return ResponseEntity.ok(rideDispatchService.cancelRide(rideId, customerId, reason));
    }

    @PostMapping("/{rideId}/redispatch")
    public ResponseEntity<RideStatusResponse> redispatch(@PathVariable UUID rideId,
                                                         @RequestParam String customerId) {
        log.info("Redispatch requested for ride {} by customer {}", rideId, customerId);
        return ResponseEntity.status(HttpStatus.CREATED).body(rideDispatchService.redispatch(rideId, customerId));
    }
}
