package com.ridedispatch.api.dispatch.service.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridedispatch.api.dispatch.service.entity.ConnectionRecord;
import com.ridedispatch.api.dispatch.service.entity.DriverAvailability;
import com.ridedispatch.api.dispatch.service.repository.ConnectionRecordRepository;
import com.ridedispatch.api.dispatch.service.repository.DriverAvailabilityRepository;
import com.ridedispatch.api.shared.constants.UserType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps user ids to their live connections. A user may hold several connections at once;
 * sends go to all of them. Registrations are mirrored into {@code socket_connections}
 * and, for drivers, into the online flag of their availability row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final ConnectionRecordRepository connectionRecordRepository;
    private final DriverAvailabilityRepository driverAvailabilityRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Map<String, ClientConnection>> connectionsByUser = new ConcurrentHashMap<>();
    private final Map<String, String> userByConnection = new ConcurrentHashMap<>();

    public void register(String userId, UserType userType, ClientConnection connection) {
        boolean[] first = new boolean[1];
        connectionsByUser.compute(userId, (id, existing) -> {
            Map<String, ClientConnection> connections = existing != null ? existing : new LinkedHashMap<>();
            first[0] = connections.isEmpty();
            connections.put(connection.getId(), connection);
            return connections;
        });
        userByConnection.put(connection.getId(), userId);
        log.info("Registered {} connection {} for user {}", userType, connection.getId(), userId);

        ZonedDateTime now = ZonedDateTime.now(clock);
        try {
            connectionRecordRepository.save(ConnectionRecord.builder()
                    .connectionId(connection.getId())
                    .userId(userId)
                    .userType(userType)
                    .connected(true)
                    .connectedAt(now)
                    .lastActivityAt(now)
                    .build());
            if (userType == UserType.DRIVER && first[0]) {
                markDriverOnline(userId, true, now);
            }
        } catch (DataAccessException e) {
            log.error("Failed to persist connection {} for user {}", connection.getId(), userId, e);
        }
    }

    /**
     * Removes a connection. Unknown ids are ignored.
     */
    public void unregister(String connectionId) {
        String userId = userByConnection.remove(connectionId);
        if (userId == null) {
            return;
        }
        boolean[] last = new boolean[1];
        connectionsByUser.computeIfPresent(userId, (id, connections) -> {
            connections.remove(connectionId);
            last[0] = connections.isEmpty();
            return connections.isEmpty() ? null : connections;
        });
        log.info("Unregistered connection {} for user {}", connectionId, userId);

        ZonedDateTime now = ZonedDateTime.now(clock);
        try {
            connectionRecordRepository.findById(connectionId).ifPresent(record -> {
                record.setConnected(false);
                record.setDisconnectedAt(now);
                connectionRecordRepository.save(record);
                if (record.getUserType() == UserType.DRIVER && last[0]) {
                    markDriverOnline(userId, false, now);
                }
            });
        } catch (DataAccessException e) {
            log.error("Failed to persist disconnect of {} for user {}", connectionId, userId, e);
        }
    }

    public boolean isOnline(String userId) {
        Map<String, ClientConnection> connections = connectionsByUser.get(userId);
        return connections != null && !connections.isEmpty();
    }

    public int connectionCount(String userId) {
        Map<String, ClientConnection> connections = connectionsByUser.get(userId);
        return connections == null ? 0 : connections.size();
    }

    /**
     * Sends an {@code {event, data}} envelope to every connection of the user.
     * Connections that fail to write are dropped.
     */
    public SendResult send(String userId, String event, Object payload) {
        List<ClientConnection> targets = snapshot(userId);
        if (targets.isEmpty()) {
            log.warn("User {} not connected, dropping event {}", userId, event);
            return SendResult.NOT_CONNECTED;
        }

        String text;
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("event", event);
            envelope.put("data", payload);
            text = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize payload for event " + event, e);
        }

        int delivered = 0;
        for (ClientConnection connection : targets) {
            if (!connection.isOpen()) {
                unregister(connection.getId());
                continue;
            }
            try {
                connection.send(text);
                delivered++;
            } catch (IOException | IllegalStateException e) {
                log.warn("Send of {} to connection {} failed, dropping it: {}", event, connection.getId(), e.getMessage());
                unregister(connection.getId());
            }
        }
        log.debug("Sent {} to {} of {} connections of user {}", event, delivered, targets.size(), userId);
        return delivered > 0 ? SendResult.DELIVERED : SendResult.NOT_CONNECTED;
    }

    public void touch(String connectionId) {
        try {
            connectionRecordRepository.findById(connectionId).ifPresent(record -> {
                record.setLastActivityAt(ZonedDateTime.now(clock));
                connectionRecordRepository.save(record);
            });
        } catch (DataAccessException e) {
            log.error("Failed to record activity on connection {}", connectionId, e);
        }
    }

    private List<ClientConnection> snapshot(String userId) {
        List<ClientConnection> result = new ArrayList<>();
        connectionsByUser.computeIfPresent(userId, (id, connections) -> {
            result.addAll(connections.values());
            return connections;
        });
        return result;
    }

    private void markDriverOnline(String driverId, boolean online, ZonedDateTime now) {
        DriverAvailability availability = driverAvailabilityRepository.findById(driverId)
                .orElseGet(() -> DriverAvailability.builder().driverId(driverId).build());
        availability.setOnline(online);
        availability.setLastSeenAt(now);
        availability.setUpdatedAt(now);
        if (!online) {
            availability.setAvailable(false);
        }
        driverAvailabilityRepository.save(availability);
        log.info("Driver {} is now {}", driverId, online ? "online" : "offline");
    }
}
