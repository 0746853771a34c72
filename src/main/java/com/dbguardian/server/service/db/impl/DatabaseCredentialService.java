package com.dbguardian.server.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.dbguardian.server.mapper.DatabaseCredentialMapper;
import com.dbguardian.server.model.entity.DatabaseCredentialEntity;
import com.dbguardian.server.service.db.IDatabaseCredentialService;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DatabaseCredentialService
        extends ServiceImpl<DatabaseCredentialMapper, DatabaseCredentialEntity>
        implements IDatabaseCredentialService {

    @Override
    public DatabaseCredentialEntity getByName(String name) {
        if (StringUtils.isBlank(name)) {
            return null;
        }
        LambdaQueryWrapper<DatabaseCredentialEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(DatabaseCredentialEntity::getName, name);
        List<DatabaseCredentialEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? null : dbResult.get(0);
    }
}
