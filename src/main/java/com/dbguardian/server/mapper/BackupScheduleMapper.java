package com.dbguardian.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.dbguardian.server.model.entity.BackupScheduleEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface BackupScheduleMapper extends BaseMapper<BackupScheduleEntity> {
}
