package com.dbguardian.server.service.db;

import com.dbguardian.server.model.entity.BackupScheduleEntity;

import java.sql.Timestamp;
import java.util.List;

public interface IBackupScheduleService {

    List<BackupScheduleEntity> getEnabledSchedules();

    BackupScheduleEntity getByScheduleId(long scheduleId);

    void updateRunTime(long scheduleId, Timestamp lastRun, Timestamp nextRun);

    BackupScheduleEntity createSchedule(BackupScheduleEntity schedule);

    BackupScheduleEntity updateSchedule(long scheduleId, BackupScheduleEntity schedule);

    boolean deleteSchedule(long scheduleId);
}
