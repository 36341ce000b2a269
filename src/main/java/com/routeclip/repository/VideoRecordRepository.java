package com.routeclip.repository;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.routeclip.entity.VideoRecord;
import org.apache.ibatis.annotations.Mapper;

import java.util.Optional;

@Mapper
public interface VideoRecordRepository extends BaseMapper<VideoRecord> {

    default Optional<VideoRecord> findByStoragePath(String storagePath) {
        return Optional.ofNullable(selectOne(new LambdaQueryWrapper<VideoRecord>()
                .eq(VideoRecord::getStoragePath, storagePath)
                .last("limit 1")));
    }

    default int markNotified(Long id) {
        return update(null, new LambdaUpdateWrapper<VideoRecord>()
                .eq(VideoRecord::getId, id)
                .set(VideoRecord::getNotified, Boolean.TRUE));
    }
}
