package com.dbguardian.server.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.dbguardian.server.enums.ScheduleTypeEnum;
import com.dbguardian.server.exception.DbException;
import com.dbguardian.server.exception.ResourceNotFoundException;
import com.dbguardian.server.exception.ValidationException;
import com.dbguardian.server.mapper.BackupScheduleMapper;
import com.dbguardian.server.model.entity.BackupScheduleEntity;
import com.dbguardian.server.service.db.IBackupScheduleService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.util.List;

@Service
@Slf4j
public class BackupScheduleService
        extends ServiceImpl<BackupScheduleMapper, BackupScheduleEntity>
        implements IBackupScheduleService {

    @Override
    public List<BackupScheduleEntity> getEnabledSchedules() {
        LambdaQueryWrapper<BackupScheduleEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(BackupScheduleEntity::getEnabled, true);
        queryWrapper.orderByAsc(BackupScheduleEntity::getId);
        return this.list(queryWrapper);
    }

    @Override
    public BackupScheduleEntity getByScheduleId(long scheduleId) {
        return this.getById(scheduleId);
    }

    @Override
    public void updateRunTime(long scheduleId, Timestamp lastRun, Timestamp nextRun) {
        if (ObjectUtils.allNull(lastRun, nextRun)) {
            return;
        }
        LambdaUpdateWrapper<BackupScheduleEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(BackupScheduleEntity::getId, scheduleId);
        if (ObjectUtils.isNotEmpty(lastRun)) {
            updateWrapper.set(BackupScheduleEntity::getLastRun, lastRun);
        }
        if (ObjectUtils.isNotEmpty(nextRun)) {
            updateWrapper.set(BackupScheduleEntity::getNextRun, nextRun);
        }
        this.update(updateWrapper);
    }

    @Override
    public BackupScheduleEntity createSchedule(BackupScheduleEntity schedule) throws ValidationException, DbException {
        checkSchedule(schedule);
        schedule.setId(null);
        schedule.setLastRun(null);
        schedule.setNextRun(null);
        if (ObjectUtils.isEmpty(schedule.getEnabled())) {
            schedule.setEnabled(true);
        }
        boolean saved = this.save(schedule);
        if (!saved) {
            throw new DbException("createSchedule failed. can't write to database.");
        }
        return schedule;
    }

    @Override
    public BackupScheduleEntity updateSchedule(long scheduleId, BackupScheduleEntity schedule)
            throws ValidationException, ResourceNotFoundException {
        checkSchedule(schedule);
        BackupScheduleEntity dbResult = this.getById(scheduleId);
        if (ObjectUtils.isEmpty(dbResult)) {
            throw new ResourceNotFoundException("updateSchedule failed. schedule %s not found".formatted(scheduleId));
        }
        dbResult.setDatabaseName(schedule.getDatabaseName());
        dbResult.setScheduleType(schedule.getScheduleType());
        dbResult.setIntervalMinutes(schedule.getIntervalMinutes());
        dbResult.setCronExpression(schedule.getCronExpression());
        dbResult.setEnabled(ObjectUtils.defaultIfNull(schedule.getEnabled(), true));
        // interval_minutes / cron_expression 需要能被置空, 所以用 update wrapper 全量写
        LambdaUpdateWrapper<BackupScheduleEntity> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(BackupScheduleEntity::getId, scheduleId)
                .set(BackupScheduleEntity::getDatabaseName, dbResult.getDatabaseName())
                .set(BackupScheduleEntity::getScheduleType, dbResult.getScheduleType())
                .set(BackupScheduleEntity::getIntervalMinutes, dbResult.getIntervalMinutes())
                .set(BackupScheduleEntity::getCronExpression, dbResult.getCronExpression())
                .set(BackupScheduleEntity::getEnabled, dbResult.getEnabled());
        boolean updated = this.update(updateWrapper);
        if (!updated) {
            throw new DbException("updateSchedule failed. can't write to database.");
        }
        return dbResult;
    }

    @Override
    public boolean deleteSchedule(long scheduleId) {
        return this.removeById(scheduleId);
    }

    private static void checkSchedule(BackupScheduleEntity schedule) throws ValidationException {
        if (ObjectUtils.isEmpty(schedule) || StringUtils.isBlank(schedule.getDatabaseName())) {
            throw new ValidationException("checkSchedule failed. schedule or databaseName is null");
        }
        ScheduleTypeEnum scheduleType = ScheduleTypeEnum.fromType(schedule.getScheduleType());
        switch (scheduleType) {
            case INTERVAL -> {
                if (ObjectUtils.isEmpty(schedule.getIntervalMinutes()) || schedule.getIntervalMinutes() < 1) {
                    throw new ValidationException("interval_minutes is required for interval schedules");
                }
                schedule.setCronExpression(null);
            }
            case CRON -> {
                if (StringUtils.isBlank(schedule.getCronExpression())) {
                    throw new ValidationException("cron_expression is required for crontab schedules");
                }
                schedule.setIntervalMinutes(null);
            }
            default -> throw new ValidationException(
                    "checkSchedule failed. unknown schedule type %s".formatted(schedule.getScheduleType()));
        }
        schedule.setScheduleType(scheduleType.getType());
    }
}
