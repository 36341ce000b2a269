package com.routeclip.dto;

/**
 * Text frame pushed to the uploader when a video finished compressing.
 */
public record VideoCompressedMessage(
    String event,
    Long videoId,
    Long routeId
) {
    public static final String EVENT = "VIDEO_COMPRESSED";

    public static VideoCompressedMessage of(Long videoId, Long routeId) {
        return new VideoCompressedMessage(EVENT, videoId, routeId);
    }
}
