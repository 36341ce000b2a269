package com.routeclip.service;

import com.routeclip.entity.JobHistoryRecord;
import com.routeclip.repository.JobHistoryRepository;
import com.routeclip.repository.VideoRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class JobHistoryService {

    private final JobHistoryRepository history;
    private final VideoRecordRepository videos;

    @Transactional
    public JobHistoryRecord recordDelivery(Job job) {
        JobHistoryRecord record = JobHistoryRecord.delivered(job.getUserId(), job.getVideoId(), job.getRouteId());
        history.insert(record);
        videos.markNotified(job.getVideoId());
        return record;
    }
}
