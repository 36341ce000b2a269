package com.routeclip.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routeclip.config.MediaProperties;
import com.routeclip.event.VideoCompressedEvent;
import com.routeclip.service.port.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Entry point for live notification channels. Opening a channel installs it as the user's only
 * connection and starts its {@link NotificationLoop}.
 */
@Slf4j
@Service
public class NotificationService {

    private final ConnectionManager connections;
    private final JobRegistry jobs;
    private final JobHistoryService history;
    private final ObjectMapper objectMapper;
    private final TaskScheduler scheduler;
    private final MediaProperties properties;

    public NotificationService(ConnectionManager connections,
                               JobRegistry jobs,
                               JobHistoryService history,
                               ObjectMapper objectMapper,
                               @Qualifier("notificationScheduler") TaskScheduler scheduler,
                               MediaProperties properties) {
        this.connections = connections;
        this.jobs = jobs;
        this.history = history;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    public ActiveConnection open(Long userId, NotificationChannel channel) {
        ActiveConnection connection = connections.register(userId, channel);
        NotificationLoop loop = new NotificationLoop(connection, jobs, history, objectMapper, this::close);
        connection.bind(loop);
        loop.start(scheduler, properties.getNotificationInterval());
        log.info("notification channel open user={} pending={}", userId, jobs.pendingFor(userId).size());
        return connection;
    }

    /**
     * Tears down one connection. Safe to call repeatedly and for connections that were already
     * evicted.
     */
    public void close(ActiveConnection connection) {
        connection.close();
        if (connections.unregister(connection)) {
            log.info("notification channel closed user={}", connection.getUserId());
        }
    }

    /**
     * Delivers right away instead of waiting for the next tick of the owner's loop.
     */
    @EventListener
    public void onVideoCompressed(VideoCompressedEvent event) {
        connections.find(event.userId())
                .map(ActiveConnection::getLoop)
                .ifPresent(loop -> scheduler.schedule(loop, Instant.now()));
    }
}
