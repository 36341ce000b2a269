package com.routeclip.repository;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.routeclip.entity.JobHistoryRecord;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface JobHistoryRepository extends BaseMapper<JobHistoryRecord> {

    default List<JobHistoryRecord> findByVideoId(Long videoId) {
        return selectList(new LambdaQueryWrapper<JobHistoryRecord>()
                .eq(JobHistoryRecord::getVideoId, videoId));
    }
}
