package com.routeclip.dto;

import com.routeclip.entity.VideoRecord;

import java.time.LocalDateTime;

public record VideoStatusResponse(
    Long id,
    Long routeId,
    boolean completed,
    boolean failed,
    boolean notified,
    String error,
    LocalDateTime createdAt,
    LocalDateTime completedAt
) {
    public static VideoStatusResponse from(VideoRecord vr) {
        return new VideoStatusResponse(
                vr.getId(),
                vr.getRouteId(),
                Boolean.TRUE.equals(vr.getCompleted()),
                Boolean.TRUE.equals(vr.getFailed()),
                Boolean.TRUE.equals(vr.getNotified()),
                vr.getErrorMessage(),
                vr.getCreatedAt(),
                vr.getCompletedAt());
    }
}
