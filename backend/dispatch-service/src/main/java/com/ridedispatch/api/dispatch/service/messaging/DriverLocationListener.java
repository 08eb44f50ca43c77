package com.ridedispatch.api.dispatch.service.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridedispatch.api.dispatch.service.service.DriverAvailabilityService;
import com.ridedispatch.api.shared.constants.KafkaTopics;
import com.ridedispatch.api.shared.events.DriverLocationUpdateEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DriverLocationListener {

    private final DriverAvailabilityService driverAvailabilityService;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = KafkaTopics.DRIVER_LOCATION_UPDATES, groupId = "dispatch-service-group")
    public void handleLocationUpdate(String message) {
        DriverLocationUpdateEvent event;
        try {
            event = objectMapper.readValue(message, DriverLocationUpdateEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Discarding unreadable location update: {}", message, e);
            return;
        }

        if (event.getDriverId() == null || event.getLatitude() == null || event.getLongitude() == null) {
            log.warn("Discarding incomplete location update: {}", message);
            return;
        }
        driverAvailabilityService.updateLocation(event.getDriverId(), event.getLatitude(), event.getLongitude());
        if (event.getAvailable() != null) {
            driverAvailabilityService.setAvailable(event.getDriverId(), event.getAvailable());
        }
    }
}
