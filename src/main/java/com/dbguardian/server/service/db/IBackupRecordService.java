package com.dbguardian.server.service.db;

import com.dbguardian.server.model.entity.BackupEntity;

import java.util.Collection;
import java.util.List;

public interface IBackupRecordService {

    BackupEntity addBackupRecord(
            String databaseName,
            String backupName,
            String storageType,
            String storageLocation,
            Long sizeBytes);

    // databaseName 为空时返回全部
    List<BackupEntity> getByDatabaseName(String databaseName);

    int deleteByStorageLocations(Collection<String> storageLocations);
}
