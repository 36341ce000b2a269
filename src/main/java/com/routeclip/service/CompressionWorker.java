package com.routeclip.service;

import com.routeclip.config.MediaProperties;
import com.routeclip.entity.VideoRecord;
import com.routeclip.event.VideoCompressedEvent;
import com.routeclip.repository.VideoRecordRepository;
import com.routeclip.service.command.CompressionTask;
import com.routeclip.service.port.VideoEncoder;
import com.routeclip.service.port.VideoEncodingRequest;
import com.routeclip.storage.StorageService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Single best-effort transcode per upload. The video record is the outcome: {@code completed} on
 * success (raw file deleted), {@code failed} otherwise (raw file kept for an operator), including
 * when the completion itself cannot be saved. Failures are never pushed to the uploader and their
 * job leaves the registry.
 */
@Service
@RequiredArgsConstructor
public class CompressionWorker {

    private static final Logger log = LoggerFactory.getLogger(CompressionWorker.class);

    private final VideoRecordRepository repo;
    private final StorageService storage;
    private final JobRegistry jobs;
    private final List<VideoEncoder> videoEncoders;
    private final ApplicationEventPublisher events;
    private final MediaProperties properties;

    @Async("compressionExecutor")
    public void compressAsync(CompressionTask task) {
        compress(task);
    }

    public void compress(CompressionTask task) {
        Long videoId = task.videoId();
        log.info("compression start video={} raw={}", videoId, task.rawPath());
        try {
            VideoEncoder encoder = videoEncoders.stream()
                    .filter(e -> e.supports(properties.getTranscodeMode()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("No encoder found for mode: " + properties.getTranscodeMode()));

            encoder.encode(new VideoEncodingRequest(videoId, task.rawPath(), task.outputPath(), properties.getCrf()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markFailed(task, "Interrupted");
            return;
        } catch (Exception e) {
            markFailed(task, e.getMessage());
            return;
        }

        markCompleted(task);
    }

    private void markCompleted(CompressionTask task) {
        Optional<VideoRecord> found = repo.findByStoragePath(task.outputPath().toString());
        if (found.isEmpty()) {
            log.error("compressed video has no record video={} path={}", task.videoId(), task.outputPath());
            jobs.remove(task.videoId());
            return;
        }
        VideoRecord vr = found.get();
        try {
            vr.complete();
            repo.updateById(vr);
        } catch (RuntimeException e) {
            log.error("could not persist completion video={}", vr.getId(), e);
            markFailed(task, "Could not persist completion: " + e.getMessage());
            return;
        }
        // raw input is only dropped once the record is terminal
        storage.deleteQuietly(task.rawPath());

        if (jobs.markCompleted(vr.getId())) {
            events.publishEvent(new VideoCompressedEvent(task.userId(), vr.getId()));
        } else {
            log.warn("no pending job for compressed video={}", vr.getId());
        }
        log.info("compression done video={}", vr.getId());
    }

    private void markFailed(CompressionTask task, String reason) {
        log.error("compression failed video={} raw kept at {}: {}", task.videoId(), task.rawPath(), reason);
        jobs.remove(task.videoId());

        Optional<VideoRecord> found = repo.findByStoragePath(task.outputPath().toString());
        if (found.isEmpty()) {
            log.error("failed video has no record video={} path={}", task.videoId(), task.outputPath());
            return;
        }
        VideoRecord vr = found.get();
        try {
            vr.fail(reason);
            repo.updateById(vr);
        } catch (RuntimeException e) {
            log.error("could not persist failure video={}", vr.getId(), e);
        }
    }
}
