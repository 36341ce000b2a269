package com.routeclip.common;

public class VideoNotReadyException extends BusinessException {

    public VideoNotReadyException(Long videoId) {
        super("VIDEO_NOT_READY", "Video is not compressed yet: " + videoId);
    }
}
