package com.routeclip.service;

import com.routeclip.common.IngestException;
import com.routeclip.config.MediaProperties;
import com.routeclip.entity.VideoRecord;
import com.routeclip.repository.VideoRecordRepository;
import com.routeclip.service.command.CompressionTask;
import com.routeclip.storage.StorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UploadIngestorTest {

    @Mock
    private VideoRecordRepository repo;
    @Mock
    private CompressionWorker compressionWorker;

    @TempDir
    Path tempDir;

    private Path videosDir;
    private JobRegistry jobs;
    private UploadIngestor ingestor;

    @BeforeEach
    void setUp() {
        videosDir = tempDir.resolve("videos");
        MediaProperties properties = new MediaProperties();
        properties.setVideosDir(videosDir.toString());
        jobs = new JobRegistry();
        ingestor = new UploadIngestor(repo, new StorageService(properties), jobs, compressionWorker);
    }

    @Test
    void ingestStoresFileCreatesRecordAndQueuesCompression() throws IOException {
        when(repo.insert(any(VideoRecord.class))).thenAnswer(inv -> {
            inv.getArgument(0, VideoRecord.class).setId(42L);
            return 1;
        });

        Long videoId = ingestor.ingest(5L, 7L, new ByteArrayInputStream("raw-bytes".getBytes()), "clip.mp4");

        assertEquals(42L, videoId);

        ArgumentCaptor<VideoRecord> recordCaptor = ArgumentCaptor.forClass(VideoRecord.class);
        verify(repo).insert(recordCaptor.capture());
        VideoRecord vr = recordCaptor.getValue();
        assertFalse(vr.getCompleted());
        assertFalse(vr.getFailed());
        assertEquals(7L, vr.getRouteId());

        ArgumentCaptor<CompressionTask> taskCaptor = ArgumentCaptor.forClass(CompressionTask.class);
        verify(compressionWorker).compressAsync(taskCaptor.capture());
        CompressionTask task = taskCaptor.getValue();
        assertEquals(42L, task.videoId());
        assertEquals(5L, task.userId());
        assertEquals(vr.getStoragePath(), task.outputPath().toString());
        assertNotEquals(task.rawPath(), task.outputPath());
        assertTrue(task.rawPath().getFileName().toString().endsWith("-clip.mp4"));
        assertEquals("raw-bytes", Files.readString(task.rawPath()));
        assertFalse(Files.exists(task.outputPath()));

        Job job = jobs.find(42L).orElseThrow();
        assertEquals(5L, job.getUserId());
        assertEquals(7L, job.getRouteId());
        assertFalse(job.isCompleted());
        assertEquals(1, jobs.size());
    }

    @Test
    void ingestMultipartUsesOriginalFilename() {
        when(repo.insert(any(VideoRecord.class))).thenAnswer(inv -> {
            inv.getArgument(0, VideoRecord.class).setId(3L);
            return 1;
        });
        MockMultipartFile file = new MockMultipartFile("file", "boulder.mov", "video/quicktime", new byte[10]);

        Long videoId = ingestor.ingest(1L, 2L, file);

        assertEquals(3L, videoId);
        ArgumentCaptor<CompressionTask> taskCaptor = ArgumentCaptor.forClass(CompressionTask.class);
        verify(compressionWorker).compressAsync(taskCaptor.capture());
        assertTrue(taskCaptor.getValue().rawPath().toString().endsWith("-boulder.mov"));
    }

    @Test
    void streamCloseFailureAfterAcceptDoesNotFailUpload() {
        when(repo.insert(any(VideoRecord.class))).thenAnswer(inv -> {
            inv.getArgument(0, VideoRecord.class).setId(4L);
            return 1;
        });
        MockMultipartFile file = new MockMultipartFile("file", "slab.mp4", "video/mp4", new byte[10]) {
            @Override
            public InputStream getInputStream() {
                return new ByteArrayInputStream(new byte[10]) {
                    @Override
                    public void close() throws IOException {
                        throw new IOException("connection reset");
                    }
                };
            }
        };

        Long videoId = ingestor.ingest(1L, 2L, file);

        assertEquals(4L, videoId);
        assertTrue(jobs.find(4L).isPresent());
        verify(compressionWorker).compressAsync(any(CompressionTask.class));
    }

    @Test
    void writeFailureCreatesNothing() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk full");
            }
        };

        assertThrows(IngestException.class, () -> ingestor.ingest(5L, 7L, broken, "clip.mp4"));

        verify(repo, never()).insert(any(VideoRecord.class));
        verifyNoInteractions(compressionWorker);
        assertEquals(0, jobs.size());
        assertEquals(0, countFiles());
    }

    @Test
    void recordFailureRemovesRawFile() {
        when(repo.insert(any(VideoRecord.class))).thenThrow(new IllegalStateException("db down"));

        IngestException e = assertThrows(IngestException.class,
                () -> ingestor.ingest(5L, 7L, new ByteArrayInputStream(new byte[4]), "clip.mp4"));

        assertEquals(IngestException.CODE, e.getCode());
        verifyNoInteractions(compressionWorker);
        assertEquals(0, jobs.size());
        assertEquals(0, countFiles());
    }

    @Test
    void rejectedCompressionRollsBackEverything() {
        when(repo.insert(any(VideoRecord.class))).thenAnswer(inv -> {
            inv.getArgument(0, VideoRecord.class).setId(9L);
            return 1;
        });
        doThrow(new TaskRejectedException("queue full")).when(compressionWorker).compressAsync(any());

        assertThrows(IngestException.class,
                () -> ingestor.ingest(5L, 7L, new ByteArrayInputStream(new byte[4]), "clip.mp4"));

        verify(repo).deleteById(9L);
        assertTrue(jobs.find(9L).isEmpty());
        assertEquals(0, countFiles());
    }

    private long countFiles() {
        if (!Files.exists(videosDir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(videosDir)) {
            return files.count();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
