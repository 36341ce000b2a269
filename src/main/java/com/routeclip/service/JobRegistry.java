package com.routeclip.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pending completion notifications, keyed by video id in upload order. Every access goes through
 * the same monitor, so a completed job is taken by at most one caller.
 */
@Slf4j
@Component
public class JobRegistry {

    private final Map<Long, Job> jobs = new LinkedHashMap<>();

    public void add(Job job) {
        synchronized (jobs) {
            if (jobs.containsKey(job.getVideoId())) {
                throw new IllegalStateException("Job already registered for video " + job.getVideoId());
            }
            jobs.put(job.getVideoId(), job);
        }
        log.debug("job added video={} user={}", job.getVideoId(), job.getUserId());
    }

    public boolean markCompleted(Long videoId) {
        synchronized (jobs) {
            Job job = jobs.get(videoId);
            if (job == null) {
                return false;
            }
            job.markCompleted();
            return true;
        }
    }

    /**
     * Removes and returns every completed job of the user.
     */
    public List<Job> takeCompleted(Long userId) {
        List<Job> taken = new ArrayList<>();
        synchronized (jobs) {
            Iterator<Job> it = jobs.values().iterator();
            while (it.hasNext()) {
                Job job = it.next();
                if (job.isCompleted() && job.getUserId().equals(userId)) {
                    it.remove();
                    taken.add(job);
                }
            }
        }
        return taken;
    }

    /**
     * Puts back a job that was taken but could not be delivered.
     */
    public void restore(Job job) {
        synchronized (jobs) {
            jobs.putIfAbsent(job.getVideoId(), job);
        }
    }

    public Optional<Job> remove(Long videoId) {
        synchronized (jobs) {
            return Optional.ofNullable(jobs.remove(videoId));
        }
    }

    public Optional<Job> find(Long videoId) {
        synchronized (jobs) {
            return Optional.ofNullable(jobs.get(videoId));
        }
    }

    public List<Job> pendingFor(Long userId) {
        synchronized (jobs) {
            return jobs.values().stream()
                    .filter(j -> j.getUserId().equals(userId))
                    .toList();
        }
    }

    public int size() {
        synchronized (jobs) {
            return jobs.size();
        }
    }
}
