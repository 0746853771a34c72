package com.dbguardian.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.dbguardian.server.model.entity.BackupEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface BackupMapper extends BaseMapper<BackupEntity> {
}
