package com.ridedispatch.api.dispatch.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridedispatch.api.dispatch.service.dto.AcceptOutcome;
import com.ridedispatch.api.dispatch.service.dto.AcceptResult;
import com.ridedispatch.api.dispatch.service.registry.ConnectionRegistry;
import com.ridedispatch.api.dispatch.service.service.DriverAvailabilityService;
import com.ridedispatch.api.dispatch.service.service.RideDispatchService;
import com.ridedispatch.api.shared.constants.RealtimeEvents;
import com.ridedispatch.api.shared.constants.UserType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DispatchWebSocketHandlerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private ConnectionRegistry connectionRegistry;
    private RideDispatchService rideDispatchService;
    private DriverAvailabilityService driverAvailabilityService;
    private DispatchWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        connectionRegistry = mock(ConnectionRegistry.class);
        rideDispatchService = mock(RideDispatchService.class);
        driverAvailabilityService = mock(DriverAvailabilityService.class);
        handler = new DispatchWebSocketHandler(connectionRegistry, rideDispatchService, driverAvailabilityService,
                new ObjectMapper(), clock);
    }

    @Test
    @SuppressWarnings("unchecked")
    void driverPingRecordsHeartbeatAndPongsWithServerTime() throws Exception {
        WebSocketSession session = session("d-1", UserType.DRIVER);

        handler.handleMessage(session, new TextMessage("{\"event\":\"ping\",\"data\":{}}"));

        verify(connectionRegistry).touch("s-d-1");
        verify(driverAvailabilityService).heartbeat("d-1");
        ArgumentCaptor<Object> pong = ArgumentCaptor.forClass(Object.class);
        verify(connectionRegistry).send(eq("d-1"), eq(RealtimeEvents.PONG), pong.capture());
        assertEquals(ZonedDateTime.now(clock), ((Map<String, Object>) pong.getValue()).get("timestamp"));
    }

    @Test
    void customerPingIsNotAHeartbeat() throws Exception {
        handler.handleMessage(session("c-1", UserType.CUSTOMER), new TextMessage("{\"event\":\"ping\"}"));

        verify(driverAvailabilityService, never()).heartbeat(any());
        verify(connectionRegistry).send(eq("c-1"), eq(RealtimeEvents.PONG), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void acceptReplyCarriesTheTypedOutcome() throws Exception {
        UUID offerId = UUID.randomUUID();
        UUID rideId = UUID.randomUUID();
        when(rideDispatchService.acceptOffer(offerId, "d-1"))
                .thenReturn(AcceptResult.of(AcceptOutcome.DRIVER_BUSY, rideId, "d-1"));

        handler.handleMessage(session("d-1", UserType.DRIVER), new TextMessage(
                "{\"event\":\"ride:request:respond\",\"data\":{\"offerId\":\"" + offerId + "\",\"response\":\"accept\"}}"));

        ArgumentCaptor<Object> reply = ArgumentCaptor.forClass(Object.class);
        verify(connectionRegistry).send(eq("d-1"), eq(RealtimeEvents.RIDE_REQUEST_RESPOND_RESULT), reply.capture());
        Map<String, Object> body = (Map<String, Object>) reply.getValue();
        assertEquals(AcceptOutcome.DRIVER_BUSY, body.get("outcome"));
        assertEquals(rideId, body.get("rideId"));
    }

    private static WebSocketSession session(String userId, UserType userType) {
        WebSocketSession session = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("userId", userId);
        attributes.put("userType", userType);
        when(session.getId()).thenReturn("s-" + userId);
        when(session.getAttributes()).thenReturn(attributes);
        return session;
    }
}
