package com.dbguardian.server.model.internal;

import com.dbguardian.server.enums.StorageTypeEnum;

/**
 * Where a backup file ended up after upload.
 *
 * @param storageType     primary or fallback
 * @param storageLocation {@code s3://<key>} for primary, absolute path for fallback
 * @param sizeBytes       size of the uploaded bytes
 */
public record StoredArtifact(StorageTypeEnum storageType, String storageLocation, long sizeBytes) {
}
