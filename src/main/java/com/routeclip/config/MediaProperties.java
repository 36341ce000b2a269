package com.routeclip.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.media")
public class MediaProperties {

    private String videosDir = "videos";
    private String defaultExtension = ".mp4";
    private String transcodeMode = "FFMPEG";
    private Integer crf = 30;
    private Integer processOutputLimit = 32768;
    private Duration notificationInterval = Duration.ofSeconds(5);
    private Integer compressionThreads = 2;
    private Integer compressionQueueCapacity = 100;
    private Integer notificationThreads = 4;
    private Integer uploadLimitPerMinute = 30;

    public String getVideosDir() {
        return videosDir;
    }

    public void setVideosDir(String videosDir) {
        this.videosDir = videosDir;
    }

    public String getDefaultExtension() {
        return defaultExtension;
    }

    public void setDefaultExtension(String defaultExtension) {
        this.defaultExtension = defaultExtension;
    }

    public String getTranscodeMode() {
        return transcodeMode;
    }

    public void setTranscodeMode(String transcodeMode) {
        this.transcodeMode = transcodeMode;
    }

    public Integer getCrf() {
        return crf;
    }

    public void setCrf(Integer crf) {
        this.crf = crf;
    }

    public Integer getProcessOutputLimit() {
        return processOutputLimit;
    }

    public void setProcessOutputLimit(Integer processOutputLimit) {
        this.processOutputLimit = processOutputLimit;
    }

    public Duration getNotificationInterval() {
        return notificationInterval;
    }

    public void setNotificationInterval(Duration notificationInterval) {
        this.notificationInterval = notificationInterval;
    }

    public Integer getCompressionThreads() {
        return compressionThreads;
    }

    public void setCompressionThreads(Integer compressionThreads) {
        this.compressionThreads = compressionThreads;
    }

    public Integer getCompressionQueueCapacity() {
        return compressionQueueCapacity;
    }

    public void setCompressionQueueCapacity(Integer compressionQueueCapacity) {
        this.compressionQueueCapacity = compressionQueueCapacity;
    }

    public Integer getNotificationThreads() {
        return notificationThreads;
    }

    public void setNotificationThreads(Integer notificationThreads) {
        this.notificationThreads = notificationThreads;
    }

    public Integer getUploadLimitPerMinute() {
        return uploadLimitPerMinute;
    }

    public void setUploadLimitPerMinute(Integer uploadLimitPerMinute) {
        this.uploadLimitPerMinute = uploadLimitPerMinute;
    }
}
