package com.routeclip.web;

import com.routeclip.common.ApiResponse;
import com.routeclip.common.VideoNotFoundException;
import com.routeclip.common.VideoNotReadyException;
import com.routeclip.dto.VideoStatusResponse;
import com.routeclip.entity.VideoRecord;
import com.routeclip.repository.VideoRecordRepository;
import com.routeclip.service.UploadIngestor;
import com.routeclip.storage.StorageService;
import jakarta.validation.constraints.Min;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Validated
public class VideoController {

    private final UploadIngestor ingestor;
    private final VideoRecordRepository repo;
    private final StorageService storageService;

    public VideoController(UploadIngestor ingestor, VideoRecordRepository repo, StorageService storageService) {
        this.ingestor = ingestor;
        this.repo = repo;
        this.storageService = storageService;
    }

    /**
     * Attaches a clip to a route. Answers once the clip is stored and queued for compression;
     * the result of the compression arrives later on the notification channel or via
     * {@link #status(String, Long)}.
     */
    @PostMapping(value = "/routes/{routeId}/video", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ApiResponse<Map<String, Long>> upload(@RequestHeader(value = UserIdentity.USER_ID_HEADER, required = false) String userHeader,
                                                 @PathVariable("routeId") @Min(1) Long routeId,
                                                 @RequestParam("file") MultipartFile file) {
        Long userId = UserIdentity.require(userHeader);
        Long videoId = ingestor.ingest(userId, routeId, file);
        return ApiResponse.success(Map.of("videoId", videoId));
    }

    @GetMapping("/videos/{id}")
    public ApiResponse<VideoStatusResponse> status(@RequestHeader(value = UserIdentity.USER_ID_HEADER, required = false) String userHeader,
                                                   @PathVariable("id") Long id) {
        UserIdentity.require(userHeader);
        return ApiResponse.success(VideoStatusResponse.from(load(id)));
    }

    @GetMapping("/videos/{id}/file")
    public ResponseEntity<Resource> download(@RequestHeader(value = UserIdentity.USER_ID_HEADER, required = false) String userHeader,
                                             @PathVariable("id") Long id) {
        UserIdentity.require(userHeader);
        VideoRecord vr = load(id);
        Path p = storageService.loadAsPath(vr.getStoragePath());
        if (!Boolean.TRUE.equals(vr.getCompleted()) || !storageService.exists(p)) {
            throw new VideoNotReadyException(id);
        }
        Resource res = new FileSystemResource(p);
        String filename = p.getFileName().toString();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename, StandardCharsets.UTF_8).build().toString())
                .header(HttpHeaders.ACCEPT_RANGES, "bytes")
                .contentType(MediaTypeFactory.getMediaType(filename).orElse(MediaType.APPLICATION_OCTET_STREAM))
                .body(res);
    }

    private VideoRecord load(Long id) {
        VideoRecord vr = repo.selectById(id);
        if (vr == null) {
            throw new VideoNotFoundException(id);
        }
        return vr;
    }
}
