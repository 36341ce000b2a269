package com.routeclip.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Durable trace of a completion notification that reached its user. Rows are only ever inserted.
 */
@TableName("job_history")
@Data
public class JobHistoryRecord {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("user_id")
    private Long userId;

    @TableField("video_id")
    private Long videoId;

    @TableField("route_id")
    private Long routeId;

    @TableField("completed")
    private Boolean completed;

    public static JobHistoryRecord delivered(Long userId, Long videoId, Long routeId) {
        JobHistoryRecord record = new JobHistoryRecord();
        record.setCreatedAt(LocalDateTime.now());
        record.setUserId(userId);
        record.setVideoId(videoId);
        record.setRouteId(routeId);
        record.setCompleted(Boolean.TRUE);
        return record;
    }
}
