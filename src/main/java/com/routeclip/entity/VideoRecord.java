package com.routeclip.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@TableName("videos")
@Data
public class VideoRecord {

    private static final int MAX_ERROR_LENGTH = 4000;

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("storage_path")
    private String storagePath;       // where the compressed file lives once the transcode succeeds

    @TableField("route_id")
    private Long routeId;             // parent route record, may be null

    @TableField("completed")
    private Boolean completed = Boolean.FALSE;

    @TableField("failed")
    private Boolean failed = Boolean.FALSE;

    @TableField("notified")
    private Boolean notified = Boolean.FALSE;   // completion was pushed to the uploader

    @TableField("error_message")
    private String errorMessage;

    @TableField("created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @TableField("completed_at")
    private LocalDateTime completedAt;

    public static VideoRecord pending(String storagePath, Long routeId) {
        VideoRecord vr = new VideoRecord();
        vr.setStoragePath(storagePath);
        vr.setRouteId(routeId);
        return vr;
    }

    public boolean isFinished() {
        return Boolean.TRUE.equals(completed) || Boolean.TRUE.equals(failed);
    }

    public void complete() {
        if (isFinished()) {
            throw new IllegalStateException("Video " + id + " already finished");
        }
        this.completed = Boolean.TRUE;
        this.completedAt = LocalDateTime.now();
    }

    public void fail(String errorMessage) {
        if (isFinished()) {
            throw new IllegalStateException("Video " + id + " already finished");
        }
        this.failed = Boolean.TRUE;
        this.errorMessage = errorMessage != null && errorMessage.length() > MAX_ERROR_LENGTH
                ? errorMessage.substring(0, MAX_ERROR_LENGTH)
                : errorMessage;
        this.completedAt = LocalDateTime.now();
    }
}
