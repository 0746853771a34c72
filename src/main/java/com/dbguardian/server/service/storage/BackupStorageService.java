package com.dbguardian.server.service.storage;

import com.dbguardian.server.enums.StorageTypeEnum;
import com.dbguardian.server.exception.StorageException;
import com.dbguardian.server.model.internal.StoredArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Upload to the primary store, or to the fallback directory when the primary refuses.
 */
@Slf4j
@Service
public class BackupStorageService {

    private final ObjectStore objectStore;

    private final LocalFallbackStore localFallbackStore;

    @Autowired
    public BackupStorageService(ObjectStore objectStore, LocalFallbackStore localFallbackStore) {
        this.objectStore = objectStore;
        this.localFallbackStore = localFallbackStore;
    }

    public StoredArtifact store(Path file, String databaseName, String fileName) throws StorageException {
        long size = sizeOf(file);
        String key = BackupNaming.primaryKey(databaseName, fileName);
        try {
            this.objectStore.put(key, file);
            log.info("backup {} uploaded to primary store", key);
            return new StoredArtifact(StorageTypeEnum.PRIMARY, BackupNaming.primaryLocation(key), size);
        } catch (Exception primaryError) {
            log.warn("upload {} to primary store failed, fall back to {}",
                    key, this.localFallbackStore.getFallbackDir(), primaryError);
            try {
                Path saved = this.localFallbackStore.save(file, fileName);
                log.info("backup {} saved to fallback {}", fileName, saved);
                return new StoredArtifact(StorageTypeEnum.FALLBACK, saved.toString(), size);
            } catch (Exception fallbackError) {
                StorageException storageException = new StorageException(
                        "store failed. primary and fallback both refused %s".formatted(fileName),
                        fallbackError);
                storageException.addSuppressed(primaryError);
                throw storageException;
            }
        }
    }

    private static long sizeOf(Path file) throws StorageException {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new StorageException("store failed. can't read size of %s".formatted(file), e);
        }
    }
}
