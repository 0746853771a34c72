package com.dbguardian.server;

import com.dbguardian.server.enums.BackupStatusEnum;
import com.dbguardian.server.exception.DbException;
import com.dbguardian.server.model.entity.BackupEntity;
import com.dbguardian.server.service.db.IBackupRecordService;
import org.apache.commons.lang3.StringUtils;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryBackupRecordStore implements IBackupRecordService {

    public final List<BackupEntity> records = new CopyOnWriteArrayList<>();

    private final AtomicLong nextId = new AtomicLong(1);

    public volatile boolean unavailable = false;

    @Override
    public BackupEntity addBackupRecord(
            String databaseName,
            String backupName,
            String storageType,
            String storageLocation,
            Long sizeBytes) {
        if (this.unavailable) {
            throw new DbException("record store unavailable");
        }
        BackupEntity backupEntity = new BackupEntity();
        backupEntity.setId(this.nextId.getAndIncrement());
        backupEntity.setDatabaseName(databaseName);
        backupEntity.setBackupName(backupName);
        backupEntity.setStorageType(storageType);
        backupEntity.setStorageLocation(storageLocation);
        backupEntity.setSizeBytes(sizeBytes);
        backupEntity.setCreatedAt(Timestamp.from(Instant.now()));
        backupEntity.setStatus(BackupStatusEnum.COMPLETED.getStatus());
        this.records.add(backupEntity);
        return backupEntity;
    }

    @Override
    public List<BackupEntity> getByDatabaseName(String databaseName) {
        if (this.unavailable) {
            throw new DbException("record store unavailable");
        }
        List<BackupEntity> result = new ArrayList<>();
        for (BackupEntity record : this.records) {
            if (StringUtils.isBlank(databaseName) || databaseName.equals(record.getDatabaseName())) {
                result.add(record);
            }
        }
        return result;
    }

    @Override
    public int deleteByStorageLocations(Collection<String> storageLocations) {
        if (this.unavailable) {
            throw new DbException("record store unavailable");
        }
        int before = this.records.size();
        this.records.removeIf(record -> storageLocations.contains(record.getStorageLocation()));
        return before - this.records.size();
    }
}
