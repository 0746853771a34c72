package com.dbguardian.server.service.facade;

import com.dbguardian.server.enums.ScheduleTypeEnum;
import com.dbguardian.server.exception.ResourceNotFoundException;
import com.dbguardian.server.exception.ValidationException;
import com.dbguardian.server.model.api.BackupArtifactRecord;
import com.dbguardian.server.model.api.DeleteBackupResult;
import com.dbguardian.server.model.api.InvocationStatus;
import com.dbguardian.server.model.entity.BackupScheduleEntity;
import com.dbguardian.server.service.backup.BackupInvocationService;
import com.dbguardian.server.service.db.IBackupScheduleService;
import com.dbguardian.server.service.scheduler.CronRule;
import com.dbguardian.server.service.scheduler.PeriodicDispatcher;
import com.dbguardian.server.service.scheduler.TriggerEntry;
import com.dbguardian.server.service.storage.BackupCatalogService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Entry point for everything outside the engine: manual triggers, status polling, listing and
 * deletion of backups, schedule maintenance.
 */
@Slf4j
@Service
public class BackupFacadeService {

    private final PeriodicDispatcher periodicDispatcher;

    private final BackupInvocationService backupInvocationService;

    private final BackupCatalogService backupCatalogService;

    private final IBackupScheduleService backupScheduleService;

    @Autowired
    public BackupFacadeService(
            PeriodicDispatcher periodicDispatcher,
            BackupInvocationService backupInvocationService,
            BackupCatalogService backupCatalogService,
            IBackupScheduleService backupScheduleService) {
        this.periodicDispatcher = periodicDispatcher;
        this.backupInvocationService = backupInvocationService;
        this.backupCatalogService = backupCatalogService;
        this.backupScheduleService = backupScheduleService;
    }

    public boolean refreshSchedules() {
        return this.periodicDispatcher.refresh();
    }

    public String triggerSchedule(long scheduleId) throws ResourceNotFoundException {
        BackupScheduleEntity schedule = this.backupScheduleService.getByScheduleId(scheduleId);
        if (ObjectUtils.isEmpty(schedule) || !Boolean.TRUE.equals(schedule.getEnabled())) {
            throw new ResourceNotFoundException(
                    "triggerSchedule failed. schedule %s not found or disabled".formatted(scheduleId));
        }
        Instant now = Instant.now();
        TriggerEntry triggerEntry = this.periodicDispatcher.activeTriggers().get(scheduleId);
        Timestamp nextRun = null;
        if (triggerEntry != null) {
            try {
                nextRun = Timestamp.from(triggerEntry.getRule().nextFireTime(now));
            } catch (Exception e) {
                log.warn("triggerSchedule {}. can't compute next run, leave it empty", scheduleId, e);
            }
        }
        this.backupScheduleService.updateRunTime(scheduleId, Timestamp.from(now), nextRun);
        String invocationId = this.backupInvocationService.submitSchedule(scheduleId).getInvocationId();
        log.info("schedule {} triggered manually. invocation id is {}", scheduleId, invocationId);
        return invocationId;
    }

    public String triggerDatabaseBackup(String databaseName) {
        String invocationId = this.backupInvocationService.submitDatabase(databaseName).getInvocationId();
        log.info("backup of {} triggered manually. invocation id is {}", databaseName, invocationId);
        return invocationId;
    }

    public InvocationStatus getInvocationStatus(String invocationId)
            throws ValidationException, ResourceNotFoundException {
        return this.backupInvocationService.getInvocationStatus(invocationId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "getInvocationStatus failed. invocation %s not found".formatted(invocationId)));
    }

    public List<BackupArtifactRecord> listBackups(String databaseName) {
        return this.backupCatalogService.listBackups(databaseName);
    }

    public DeleteBackupResult deleteBackup(String identifier) throws ValidationException {
        return this.backupCatalogService.deleteBackup(identifier);
    }

    public BackupScheduleEntity createSchedule(BackupScheduleEntity schedule) throws ValidationException {
        checkCronExpression(schedule);
        BackupScheduleEntity created = this.backupScheduleService.createSchedule(schedule);
        this.refreshAfterChange("createSchedule", created.getId());
        return created;
    }

    public BackupScheduleEntity updateSchedule(long scheduleId, BackupScheduleEntity schedule)
            throws ValidationException, ResourceNotFoundException {
        checkCronExpression(schedule);
        BackupScheduleEntity updated = this.backupScheduleService.updateSchedule(scheduleId, schedule);
        this.refreshAfterChange("updateSchedule", scheduleId);
        return updated;
    }

    public void deleteSchedule(long scheduleId) throws ResourceNotFoundException {
        if (!this.backupScheduleService.deleteSchedule(scheduleId)) {
            throw new ResourceNotFoundException("deleteSchedule failed. schedule %s not found".formatted(scheduleId));
        }
        this.refreshAfterChange("deleteSchedule", scheduleId);
    }

    // 写入前先解析, 非法表达式不落库
    private static void checkCronExpression(BackupScheduleEntity schedule) throws ValidationException {
        if (ObjectUtils.isEmpty(schedule)) {
            throw new ValidationException("schedule is null");
        }
        if (ScheduleTypeEnum.CRON == ScheduleTypeEnum.fromType(schedule.getScheduleType())
                && StringUtils.isNotBlank(schedule.getCronExpression())) {
            CronRule.parse(schedule.getCronExpression());
        }
    }

    private void refreshAfterChange(String operation, Long scheduleId) {
        if (!this.periodicDispatcher.refresh()) {
            log.warn("{} for schedule {} saved but dispatcher refresh failed", operation, scheduleId);
        }
    }
}
