package com.dbguardian.server.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.dbguardian.server.enums.BackupStatusEnum;
import com.dbguardian.server.exception.DbException;
import com.dbguardian.server.mapper.BackupMapper;
import com.dbguardian.server.model.entity.BackupEntity;
import com.dbguardian.server.service.db.IBackupRecordService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

@Service
@Slf4j
public class BackupRecordService
        extends ServiceImpl<BackupMapper, BackupEntity>
        implements IBackupRecordService {

    @Override
    public BackupEntity addBackupRecord(
            String databaseName,
            String backupName,
            String storageType,
            String storageLocation,
            Long sizeBytes) throws DbException {
        BackupEntity backupEntity = new BackupEntity();
        backupEntity.setDatabaseName(databaseName);
        backupEntity.setBackupName(backupName);
        backupEntity.setStorageType(storageType);
        backupEntity.setStorageLocation(storageLocation);
        backupEntity.setSizeBytes(sizeBytes);
        backupEntity.setStatus(BackupStatusEnum.COMPLETED.getStatus());
        boolean saved = this.save(backupEntity);
        if (!saved) {
            throw new DbException("addBackupRecord failed. can't write to database.");
        }
        return backupEntity;
    }

    @Override
    public List<BackupEntity> getByDatabaseName(String databaseName) {
        LambdaQueryWrapper<BackupEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(StringUtils.isNotBlank(databaseName), BackupEntity::getDatabaseName, databaseName);
        queryWrapper.orderByDesc(BackupEntity::getCreatedAt);
        return this.list(queryWrapper);
    }

    @Override
    public int deleteByStorageLocations(Collection<String> storageLocations) {
        if (CollectionUtils.isEmpty(storageLocations)) {
            return 0;
        }
        LambdaQueryWrapper<BackupEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.in(BackupEntity::getStorageLocation, storageLocations);
        return this.baseMapper.delete(queryWrapper);
    }
}
