package com.routeclip.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationLoopTest {

    @Mock
    private JobHistoryService history;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JobRegistry jobs = new JobRegistry();
    private final List<ActiveConnection> disconnected = new ArrayList<>();

    private RecordingChannel channel;
    private NotificationLoop loop;

    @BeforeEach
    void setUp() {
        channel = new RecordingChannel();
        ActiveConnection connection = new ActiveConnection(1L, channel);
        loop = new NotificationLoop(connection, jobs, history, objectMapper, disconnected::add);
        connection.bind(loop);
    }

    @Test
    void deliversCompletedJobOnceAndRecordsHistory() throws Exception {
        jobs.add(new Job(1L, 42L, 7L));
        jobs.markCompleted(42L);

        assertEquals(1, loop.tick());
        assertEquals(0, loop.tick());

        assertEquals(1, channel.getMessages().size());
        JsonNode message = objectMapper.readTree(channel.getMessages().get(0));
        assertEquals("VIDEO_COMPRESSED", message.get("event").asText());
        assertEquals(42L, message.get("videoId").asLong());
        assertEquals(7L, message.get("routeId").asLong());
        verify(history, times(1)).recordDelivery(argThat(j -> j.getVideoId().equals(42L)));
        assertTrue(jobs.find(42L).isEmpty());
    }

    @Test
    void ignoresPendingJobsAndOtherUsers() {
        jobs.add(new Job(1L, 10L, 7L));
        jobs.add(new Job(2L, 11L, 7L));
        jobs.markCompleted(11L);

        assertEquals(0, loop.tick());

        assertTrue(channel.getMessages().isEmpty());
        assertEquals(2, jobs.size());
        verifyNoInteractions(history);
    }

    @Test
    void failedSendRestoresJobAndDisconnects() {
        jobs.add(new Job(1L, 42L, 7L));
        jobs.markCompleted(42L);
        channel.failSends();

        assertEquals(0, loop.tick());

        assertEquals(NotificationLoop.State.DISCONNECTED, loop.getState());
        assertEquals(1, disconnected.size());
        assertTrue(jobs.find(42L).orElseThrow().isCompleted());
        verifyNoInteractions(history);
    }

    @Test
    void uncheckedSendFailureRestoresAllTakenJobs() {
        jobs.add(new Job(1L, 42L, 7L));
        jobs.add(new Job(1L, 43L, 7L));
        jobs.markCompleted(42L);
        jobs.markCompleted(43L);
        channel.failSendsWith(new IllegalStateException("send time limit exceeded"));

        loop.run();

        assertEquals(NotificationLoop.State.DISCONNECTED, loop.getState());
        assertEquals(1, disconnected.size());
        assertTrue(jobs.find(42L).orElseThrow().isCompleted());
        assertTrue(jobs.find(43L).orElseThrow().isCompleted());
        verifyNoInteractions(history);
    }

    @Test
    void historyFailureDoesNotCauseRedelivery() {
        jobs.add(new Job(1L, 42L, 7L));
        jobs.markCompleted(42L);
        doThrow(new IllegalStateException("db down")).when(history).recordDelivery(any());

        assertEquals(1, loop.tick());
        loop.tick();

        assertEquals(1, channel.getMessages().size());
        assertEquals(NotificationLoop.State.CONNECTED, loop.getState());
    }

    @Test
    void closedChannelEndsTheLoop() {
        jobs.add(new Job(1L, 42L, 7L));
        jobs.markCompleted(42L);
        channel.close();

        assertEquals(0, loop.tick());

        assertEquals(NotificationLoop.State.DISCONNECTED, loop.getState());
        assertEquals(1, disconnected.size());
        assertTrue(jobs.find(42L).isPresent());
    }

    @Test
    void stoppedLoopNeverTicksAgain() {
        loop.stop();
        loop.stop();
        jobs.add(new Job(1L, 42L, 7L));
        jobs.markCompleted(42L);

        assertEquals(0, loop.tick());
        assertTrue(channel.getMessages().isEmpty());
        assertTrue(jobs.find(42L).isPresent());
    }

    @Test
    @SuppressWarnings("unchecked")
    void startSchedulesAtFixedRateAndStopCancels() {
        TaskScheduler scheduler = mock(TaskScheduler.class);
        ScheduledFuture<Object> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleAtFixedRate(loop, Duration.ofSeconds(5));

        loop.start(scheduler, Duration.ofSeconds(5));
        loop.stop();

        verify(future).cancel(false);
    }
}
