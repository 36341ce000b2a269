package com.routeclip.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;

@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * Runs the blocking transcode processes so request threads never wait on them.
     */
    @Bean(name = "compressionExecutor")
    public ThreadPoolTaskExecutor compressionExecutor(MediaProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCompressionThreads());
        executor.setMaxPoolSize(properties.getCompressionThreads());
        executor.setQueueCapacity(properties.getCompressionQueueCapacity());
        executor.setThreadNamePrefix("compress-");
        executor.setTaskDecorator(mdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Drives the per-connection notification loops.
     */
    @Bean(name = "notificationScheduler")
    public ThreadPoolTaskScheduler notificationScheduler(MediaProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getNotificationThreads());
        scheduler.setThreadNamePrefix("notify-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public TaskDecorator mdcTaskDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
