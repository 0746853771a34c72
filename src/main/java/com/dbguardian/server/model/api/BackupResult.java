package com.dbguardian.server.model.api;

import com.dbguardian.server.enums.BackupStatusEnum;
import lombok.Data;
import lombok.experimental.Accessors;

@Data
@Accessors(chain = true)
public class BackupResult {

    private String status;

    private String reason;

    private String databaseName;

    private String backupName;

    private String storageType;

    private String storageLocation;

    private Long sizeBytes;

    public boolean isSkipped() {
        return BackupStatusEnum.SKIPPED.getStatus().equals(status);
    }

    public static BackupResult skipped(String reason) {
        return new BackupResult().setStatus(BackupStatusEnum.SKIPPED.getStatus()).setReason(reason);
    }
}
