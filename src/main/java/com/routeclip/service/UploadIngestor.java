package com.routeclip.service;

import com.routeclip.common.IngestException;
import com.routeclip.entity.VideoRecord;
import com.routeclip.repository.VideoRecordRepository;
import com.routeclip.service.command.CompressionTask;
import com.routeclip.storage.StorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Accepts an uploaded clip for a route. The call returns as soon as the raw file is on disk, the
 * video record exists and compression is queued; it never waits for the transcode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadIngestor {

    private final VideoRecordRepository repo;
    private final StorageService storage;
    private final JobRegistry jobs;
    private final CompressionWorker compressionWorker;

    public Long ingest(Long userId, Long routeId, MultipartFile file) {
        InputStream in;
        try {
            in = file.getInputStream();
        } catch (IOException e) {
            throw new IngestException("Could not read upload", e);
        }
        try {
            return ingest(userId, routeId, in, file.getOriginalFilename());
        } finally {
            // the upload is already accepted at this point
            try {
                in.close();
            } catch (IOException e) {
                log.warn("closing upload stream failed user={} route={}: {}", userId, routeId, e.getMessage());
            }
        }
    }

    /**
     * Stores the clip and schedules its compression.
     *
     * @return id of the new video record
     * @throws IngestException if the clip could not be stored, recorded or queued; nothing of the
     *                         upload is left behind in that case
     */
    public Long ingest(Long userId, Long routeId, InputStream content, String suggestedName) {
        Path rawPath;
        Path outputPath;
        try {
            storage.ensureBaseDir();
            rawPath = storage.newUploadPath(suggestedName);
            outputPath = storage.newOutputPath(suggestedName);
            storage.write(content, rawPath);
        } catch (IOException | RuntimeException e) {
            log.error("upload write failed user={} route={}: {}", userId, routeId, e.getMessage());
            throw new IngestException("Could not store upload", e);
        }

        VideoRecord vr = VideoRecord.pending(outputPath.toString(), routeId);
        try {
            repo.insert(vr);
            if (vr.getId() == null) {
                throw new IllegalStateException("No id generated for video record");
            }
        } catch (RuntimeException e) {
            storage.deleteQuietly(rawPath);
            log.error("video record insert failed user={} route={}", userId, routeId, e);
            throw new IngestException("Could not create video record", e);
        }

        Long videoId = vr.getId();
        jobs.add(new Job(userId, videoId, routeId));

        try {
            compressionWorker.compressAsync(new CompressionTask(userId, videoId, rawPath, outputPath));
        } catch (TaskRejectedException e) {
            jobs.remove(videoId);
            repo.deleteById(videoId);
            storage.deleteQuietly(rawPath);
            log.error("compression queue rejected video={}", videoId, e);
            throw new IngestException("Compression queue is full", e);
        }

        log.info("upload accepted video={} user={} route={} raw={}", videoId, userId, routeId, rawPath);
        return videoId;
    }
}
