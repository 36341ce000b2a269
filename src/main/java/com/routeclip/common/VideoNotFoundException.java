package com.routeclip.common;

public class VideoNotFoundException extends BusinessException {

    public VideoNotFoundException(Long videoId) {
        super("VIDEO_NOT_FOUND", "Video not found: " + videoId);
    }
}
