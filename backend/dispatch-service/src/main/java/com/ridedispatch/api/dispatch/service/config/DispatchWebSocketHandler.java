package com.ridedispatch.api.dispatch.service.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridedispatch.api.dispatch.service.dto.AcceptResult;
import com.ridedispatch.api.dispatch.service.dto.RejectOutcome;
import com.ridedispatch.api.dispatch.service.exception.DispatchException;
import com.ridedispatch.api.dispatch.service.registry.ConnectionRegistry;
import com.ridedispatch.api.dispatch.service.registry.WebSocketClientConnection;
import com.ridedispatch.api.dispatch.service.service.DriverAvailabilityService;
import com.ridedispatch.api.dispatch.service.service.RideDispatchService;
import com.ridedispatch.api.shared.constants.RealtimeEvents;
import com.ridedispatch.api.shared.constants.UserType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Live channel for drivers and customers: {@code /ws/dispatch?userId=..&userType=driver|customer}.
 * Messages in both directions are {@code {"event": .., "data": {..}}} envelopes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchWebSocketHandler extends TextWebSocketHandler {

    private static final String ATTR_USER_ID = "userId";
    private static final String ATTR_USER_TYPE = "userType";

    private final ConnectionRegistry connectionRegistry;
    private final RideDispatchService rideDispatchService;
    private final DriverAvailabilityService driverAvailabilityService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams();
        String userId = params.getFirst(ATTR_USER_ID);
        if (userId == null || userId.isBlank()) {
            log.warn("Rejecting WebSocket connection {} without userId", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("userId is required"));
            return;
        }
        UserType userType;
        try {
            userType = UserType.fromValue(params.getFirst(ATTR_USER_TYPE));
        } catch (IllegalArgumentException e) {
            log.warn("Rejecting WebSocket connection {}: {}", session.getId(), e.getMessage());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("unknown userType"));
            return;
        }

        session.getAttributes().put(ATTR_USER_ID, userId);
        session.getAttributes().put(ATTR_USER_TYPE, userType);
        connectionRegistry.register(userId, userType, new WebSocketClientConnection(session));

        Map<String, Object> hello = new LinkedHashMap<>();
        hello.put("userId", userId);
        hello.put("userType", userType);
        hello.put("connectionId", session.getId());
        connectionRegistry.send(userId, RealtimeEvents.CONNECTED, hello);
        log.info("WebSocket connection established for {} {}", userType, userId);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        connectionRegistry.unregister(session.getId());
        log.info("WebSocket connection {} closed: {}", session.getId(), status);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String userId = (String) session.getAttributes().get(ATTR_USER_ID);
        UserType userType = (UserType) session.getAttributes().get(ATTR_USER_TYPE);
        if (userId == null) {
            return;
        }
        connectionRegistry.touch(session.getId());

        JsonNode root;
        try {
            root = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Malformed message from {}: {}", userId, e.getOriginalMessage());
            sendError(userId, "Malformed message");
            return;
        }
        String event = root.path("event").asText("");
        JsonNode data = root.path("data");

        try {
            switch (event) {
                case RealtimeEvents.PING -> handlePing(userId, userType);
                case RealtimeEvents.DRIVER_LOCATION_UPDATE -> {
                    if (requireDriver(userId, userType, event)) {
                        driverAvailabilityService.updateLocation(userId,
                                data.path("latitude").asDouble(), data.path("longitude").asDouble());
                    }
                }
                case RealtimeEvents.DRIVER_AVAILABILITY_UPDATE -> {
                    if (requireDriver(userId, userType, event)) {
                        driverAvailabilityService.setAvailable(userId, data.path("available").asBoolean());
                    }
                }
                case RealtimeEvents.RIDE_REQUEST_RESPOND -> {
                    if (requireDriver(userId, userType, event)) {
                        handleRespond(userId, data);
                    }
                }
                default -> {
                    log.warn("Unknown event '{}' from {}", event, userId);
                    sendError(userId, "Unknown event: " + event);
                }
            }
        } catch (DispatchException | IllegalArgumentException e) {
            log.warn("Event {} from {} failed: {}", event, userId, e.getMessage());
            sendError(userId, e.getMessage());
        }
    }

    private void handlePing(String userId, UserType userType) {
        if (userType == UserType.DRIVER) {
            driverAvailabilityService.heartbeat(userId);
        }
        Map<String, Object> pong = new LinkedHashMap<>();
        pong.put("timestamp", ZonedDateTime.now(clock));
        connectionRegistry.send(userId, RealtimeEvents.PONG, pong);
    }

    private void handleRespond(String driverId, JsonNode data) {
        UUID offerId = UUID.fromString(data.path("offerId").asText());
        String response = data.path("response").asText("");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("offerId", offerId);
        result.put("response", response);
        if ("accept".equalsIgnoreCase(response)) {
            AcceptResult accept = rideDispatchService.acceptOffer(offerId, driverId);
            result.put("rideId", accept.getRideId());
            result.put("outcome", accept.getOutcome());
            result.put("message", accept.getMessage());
            result.put("etaMinutes", accept.getEtaMinutes());
        } else if ("decline".equalsIgnoreCase(response)) {
            String reason = data.hasNonNull("reason") ? data.get("reason").asText() : null;
            RejectOutcome reject = rideDispatchService.rejectOffer(offerId, driverId, reason);
            result.put("outcome", reject);
        } else {
            throw new IllegalArgumentException("response must be accept or decline");
        }
        connectionRegistry.send(driverId, RealtimeEvents.RIDE_REQUEST_RESPOND_RESULT, result);
    }

    private boolean requireDriver(String userId, UserType userType, String event) {
        if (userType != UserType.DRIVER) {
            log.warn("Customer {} sent driver-only event {}", userId, event);
            sendError(userId, "Only drivers may send " + event);
            return false;
        }
        return true;
    }

    private void sendError(String userId, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", message);
        connectionRegistry.send(userId, RealtimeEvents.ERROR, error);
    }
}
