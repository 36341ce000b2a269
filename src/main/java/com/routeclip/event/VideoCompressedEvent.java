package com.routeclip.event;

/**
 * Published once a video record has been marked completed and its job is ready for delivery.
 */
public record VideoCompressedEvent(Long userId, Long videoId) {}
