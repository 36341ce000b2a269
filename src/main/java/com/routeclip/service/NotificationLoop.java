package com.routeclip.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routeclip.dto.VideoCompressedMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Recurring delivery task of one connection. Each tick takes the user's completed jobs from the
 * registry, pushes one message per job and records the delivery. Once {@link State#DISCONNECTED}
 * the loop never ticks again.
 */
@Slf4j
public class NotificationLoop implements Runnable {

    public enum State { CONNECTED, DISCONNECTED }

    private final ActiveConnection connection;
    private final JobRegistry jobs;
    private final JobHistoryService history;
    private final ObjectMapper objectMapper;
    private final Consumer<ActiveConnection> onDisconnect;

    private volatile State state = State.CONNECTED;
    private volatile ScheduledFuture<?> future;

    public NotificationLoop(ActiveConnection connection, JobRegistry jobs, JobHistoryService history,
                            ObjectMapper objectMapper, Consumer<ActiveConnection> onDisconnect) {
        this.connection = connection;
        this.jobs = jobs;
        this.history = history;
        this.objectMapper = objectMapper;
        this.onDisconnect = onDisconnect;
    }

    public void start(TaskScheduler scheduler, Duration interval) {
        if (state == State.DISCONNECTED) {
            return;
        }
        this.future = scheduler.scheduleAtFixedRate(this, interval);
        // stop() may have run before the future was assigned
        if (state == State.DISCONNECTED) {
            future.cancel(false);
        }
    }

    @Override
    public void run() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("notification tick failed user={}", connection.getUserId(), e);
        }
    }

    /**
     * One scan of the registry. Returns the number of jobs delivered.
     */
    public synchronized int tick() {
        if (state == State.DISCONNECTED) {
            return 0;
        }
        if (!connection.getChannel().isOpen()) {
            disconnect("channel closed");
            return 0;
        }

        List<Job> taken = jobs.takeCompleted(connection.getUserId());
        int delivered = 0;
        for (int i = 0; i < taken.size(); i++) {
            Job job = taken.get(i);
            try {
                connection.getChannel().send(toMessage(job));
            } catch (IOException | RuntimeException e) {
                // the session decorator signals exceeded send limits unchecked
                log.warn("push failed user={} video={}: {}", connection.getUserId(), job.getVideoId(), e.toString());
                taken.subList(i, taken.size()).forEach(jobs::restore);
                disconnect("send failed");
                return delivered;
            }
            delivered++;
            try {
                history.recordDelivery(job);
            } catch (RuntimeException e) {
                log.error("delivered video={} but could not record history", job.getVideoId(), e);
            }
            log.info("notified user={} video={}", connection.getUserId(), job.getVideoId());
        }
        return delivered;
    }

    /**
     * Cancels further ticks. Idempotent; never throws.
     */
    public void stop() {
        state = State.DISCONNECTED;
        ScheduledFuture<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
    }

    public State getState() {
        return state;
    }

    private void disconnect(String reason) {
        log.info("notification loop stopped user={}: {}", connection.getUserId(), reason);
        stop();
        onDisconnect.accept(connection);
    }

    private String toMessage(Job job) {
        try {
            return objectMapper.writeValueAsString(VideoCompressedMessage.of(job.getVideoId(), job.getRouteId()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize notification", e);
        }
    }
}
