package com.dbguardian.server.service.storage;

import com.dbguardian.server.enums.BackupStatusEnum;
import com.dbguardian.server.enums.StorageTypeEnum;
import com.dbguardian.server.exception.ValidationException;
import com.dbguardian.server.model.api.BackupArtifactRecord;
import com.dbguardian.server.model.api.DeleteBackupResult;
import com.dbguardian.server.model.entity.BackupEntity;
import com.dbguardian.server.service.db.IBackupRecordService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Listing and deletion of stored backups across the primary store and the fallback directory.
 */
@Slf4j
@Service
public class BackupCatalogService {

    // newest first, unknown creation time last, then by name
    static final Comparator<BackupArtifactRecord> LISTING_ORDER = Comparator
            .comparing(BackupArtifactRecord::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(BackupArtifactRecord::getBackupName, Comparator.nullsLast(Comparator.reverseOrder()));

    private final ObjectStore objectStore;

    private final LocalFallbackStore localFallbackStore;

    private final IBackupRecordService backupRecordService;

    @Autowired
    public BackupCatalogService(
            ObjectStore objectStore,
            LocalFallbackStore localFallbackStore,
            IBackupRecordService backupRecordService) {
        this.objectStore = objectStore;
        this.localFallbackStore = localFallbackStore;
        this.backupRecordService = backupRecordService;
    }

    public List<BackupArtifactRecord> listBackups(String databaseName) {
        String filter = StringUtils.trimToNull(databaseName);
        Map<String, BackupEntity> recordsByLocation = this.loadRecords(filter);
        List<BackupArtifactRecord> result = this.listPrimary(filter, recordsByLocation);
        if (result.isEmpty()) {
            result = this.listFallback(filter, recordsByLocation);
        }
        result.sort(LISTING_ORDER);
        return result;
    }

    public DeleteBackupResult deleteBackup(String identifier) throws ValidationException {
        if (StringUtils.isBlank(identifier)) {
            throw new ValidationException("deleteBackup failed. identifier is blank");
        }
        String fileName = BackupNaming.lastSegment(identifier);
        boolean deleted = false;
        // 先删主存储
        try {
            if (this.objectStore.stat(identifier).isPresent()) {
                this.objectStore.remove(identifier);
                deleted = true;
                log.info("backup {} removed from primary store", identifier);
            }
        } catch (Exception e) {
            log.warn("deleteBackup {}. primary store unavailable", identifier, e);
        }
        Path fallbackPath = null;
        try {
            fallbackPath = this.localFallbackStore.resolve(fileName);
            if (!deleted && this.localFallbackStore.delete(fileName)) {
                deleted = true;
                log.info("backup {} removed from fallback {}", identifier, fallbackPath);
            }
        } catch (Exception e) {
            log.warn("deleteBackup {}. fallback delete failed", identifier, e);
        }
        // 元数据清理失败只记录日志
        Set<String> locations = new LinkedHashSet<>();
        locations.add(BackupNaming.primaryLocation(identifier));
        if (fallbackPath != null) {
            locations.add(fallbackPath.toString());
        }
        try {
            int purged = this.backupRecordService.deleteByStorageLocations(locations);
            log.debug("deleteBackup {}. {} metadata rows purged", identifier, purged);
        } catch (Exception e) {
            log.warn("deleteBackup {}. metadata purge failed for {}", identifier, locations, e);
        }
        return new DeleteBackupResult(deleted, fileName);
    }

    private Map<String, BackupEntity> loadRecords(String databaseName) {
        try {
            List<BackupEntity> records = this.backupRecordService.getByDatabaseName(databaseName);
            if (CollectionUtils.isEmpty(records)) {
                return Collections.emptyMap();
            }
            Map<String, BackupEntity> result = new HashMap<>();
            for (BackupEntity record : records) {
                if (StringUtils.isNotBlank(record.getStorageLocation())) {
                    result.putIfAbsent(record.getStorageLocation(), record);
                }
            }
            return result;
        } catch (Exception e) {
            log.warn("listBackups. can't load backup metadata, list without record ids", e);
            return Collections.emptyMap();
        }
    }

    private List<BackupArtifactRecord> listPrimary(String databaseName, Map<String, BackupEntity> records) {
        List<BackupArtifactRecord> result = new ArrayList<>();
        List<ObjectStore.StoredObject> objects;
        try {
            objects = this.objectStore.list(databaseName == null ? "" : databaseName + "/");
        } catch (Exception e) {
            log.warn("listBackups. primary store unavailable, try fallback", e);
            return result;
        }
        for (ObjectStore.StoredObject object : objects) {
            String[] parts = StringUtils.split(object.key(), '/');
            if (parts.length != 2 || !BackupNaming.isBackupFile(parts[1])) {
                continue;
            }
            if (databaseName != null && !databaseName.equals(parts[0])) {
                continue;
            }
            String location = BackupNaming.primaryLocation(object.key());
            result.add(new BackupArtifactRecord()
                    .setBackupKey(object.key())
                    .setRecordId(recordId(records, location))
                    .setDatabaseName(parts[0])
                    .setBackupName(BackupNaming.stripEncryptedSuffix(parts[1]))
                    .setStorageType(StorageTypeEnum.PRIMARY.getType())
                    .setStorageLocation(location)
                    .setCreatedAt(object.lastModified())
                    .setSizeBytes(object.size())
                    .setStatus(BackupStatusEnum.COMPLETED.getStatus()));
        }
        return result;
    }

    private List<BackupArtifactRecord> listFallback(String databaseName, Map<String, BackupEntity> records) {
        List<BackupArtifactRecord> result = new ArrayList<>();
        List<Path> files;
        try {
            files = this.localFallbackStore.list();
        } catch (Exception e) {
            log.error("listBackups. can't scan fallback {}", this.localFallbackStore.getFallbackDir(), e);
            return result;
        }
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            Optional<BackupNaming.ParsedName> parsed = BackupNaming.parse(fileName);
            if (parsed.isEmpty()) {
                continue;
            }
            BackupNaming.ParsedName name = parsed.get();
            if (databaseName != null && !databaseName.equals(name.databaseName())) {
                continue;
            }
            String location = file.toAbsolutePath().toString();
            result.add(new BackupArtifactRecord()
                    .setBackupKey(fileName)
                    .setRecordId(recordId(records, location))
                    .setDatabaseName(name.databaseName())
                    .setBackupName(name.backupName())
                    .setStorageType(StorageTypeEnum.FALLBACK.getType())
                    .setStorageLocation(location)
                    .setCreatedAt(name.createdAt() == null ? null : name.createdAt().toInstant(ZoneOffset.UTC))
                    .setSizeBytes(sizeOf(file))
                    .setStatus(BackupStatusEnum.COMPLETED.getStatus()));
        }
        return result;
    }

    private static Long recordId(Map<String, BackupEntity> records, String location) {
        BackupEntity record = records.get(location);
        return record == null ? null : record.getId();
    }

    private static Long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("can't read size of {}", file, e);
            return null;
        }
    }
}
