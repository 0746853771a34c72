package com.dbguardian.server.model.api;

import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;

/**
 * A backup as seen by listing. {@code backupKey} is the storage key and the id callers pass to
 * deletion; {@code recordId} is the metadata row id, present only when a row matches.
 */
@Data
@Accessors(chain = true)
public class BackupArtifactRecord {

    private String backupKey;

    private Long recordId;

    private String databaseName;

    private String backupName;

    private String storageType;

    private String storageLocation;

    private Instant createdAt;

    private Long sizeBytes;

    private String status;
}
