package com.routeclip.service;

import lombok.Getter;
import lombok.ToString;

/**
 * In-memory marker for a video whose completion still has to be pushed to its uploader.
 * Lives only in {@link JobRegistry}; the registry hands out this same instance to every caller.
 */
@Getter
@ToString
public class Job {

    private final Long userId;
    private final Long videoId;
    private final Long routeId;
    private volatile boolean completed;

    public Job(Long userId, Long videoId, Long routeId) {
        this.userId = userId;
        this.videoId = videoId;
        this.routeId = routeId;
    }

    void markCompleted() {
        this.completed = true;
    }
}
