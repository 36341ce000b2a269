package com.routeclip.service;

import com.routeclip.service.port.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Live notification channels, at most one per user.
 */
@Slf4j
@Component
public class ConnectionManager {

    private final Map<Long, ActiveConnection> connections = new HashMap<>();

    /**
     * Installs a connection for the user. An existing connection of that user is evicted and
     * closed first.
     */
    public ActiveConnection register(Long userId, NotificationChannel channel) {
        ActiveConnection created = new ActiveConnection(userId, channel);
        ActiveConnection evicted;
        synchronized (connections) {
            evicted = connections.put(userId, created);
        }
        if (evicted != null) {
            log.info("evicting previous connection of user={}", userId);
            evicted.close();
        }
        return created;
    }

    /**
     * Removes the connection if it is still the user's current one. Returns false for unknown or
     * already replaced connections.
     */
    public boolean unregister(ActiveConnection connection) {
        synchronized (connections) {
            return connections.remove(connection.getUserId(), connection);
        }
    }

    public Optional<ActiveConnection> find(Long userId) {
        synchronized (connections) {
            return Optional.ofNullable(connections.get(userId));
        }
    }

    public List<ActiveConnection> activeConnections() {
        synchronized (connections) {
            return new ArrayList<>(connections.values());
        }
    }

    public int size() {
        synchronized (connections) {
            return connections.size();
        }
    }
}
