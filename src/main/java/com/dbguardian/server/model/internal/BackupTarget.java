package com.dbguardian.server.model.internal;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

// schedule id or database name, never both
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BackupTarget {

    public static final String DEFAULT_DATABASE = "default";

    private final Long scheduleId;

    private final String databaseName;

    public static BackupTarget ofSchedule(long scheduleId) {
        return new BackupTarget(scheduleId, null);
    }

    public static BackupTarget ofDatabase(String databaseName) {
        return new BackupTarget(
                null,
                StringUtils.isBlank(databaseName) ? DEFAULT_DATABASE : databaseName.trim());
    }

    public boolean isSchedule() {
        return scheduleId != null;
    }
}
