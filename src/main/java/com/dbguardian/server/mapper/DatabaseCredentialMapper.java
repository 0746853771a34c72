package com.dbguardian.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.dbguardian.server.model.entity.DatabaseCredentialEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface DatabaseCredentialMapper extends BaseMapper<DatabaseCredentialEntity> {
}
