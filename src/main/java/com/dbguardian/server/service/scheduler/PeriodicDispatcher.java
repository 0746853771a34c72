package com.dbguardian.server.service.scheduler;

import com.dbguardian.server.enums.ScheduleTypeEnum;
import com.dbguardian.server.exception.CronParseException;
import com.dbguardian.server.model.entity.BackupScheduleEntity;
import com.dbguardian.server.service.db.IBackupScheduleService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one timer registration per enabled schedule.
 * <p>
 * The live mapping is an immutable map behind a volatile reference, replaced as a whole on
 * every refresh. Refreshes are serialized; the registrations map is only touched under the
 * refresh lock.
 */
@Slf4j
@Service
public class PeriodicDispatcher {

    public static final int DEFAULT_INTERVAL_MINUTES = 60;

    private final IBackupScheduleService backupScheduleService;

    private final TaskScheduler dispatcherTaskScheduler;

    private final BackupLauncher backupLauncher;

    private final ZoneId zoneId;

    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile Map<Long, TriggerEntry> activeTriggers = Collections.emptyMap();

    // guarded by refreshLock
    private final Map<Long, ScheduledFuture<?>> registrations = new HashMap<>();

    @Autowired
    public PeriodicDispatcher(
            IBackupScheduleService backupScheduleService,
            @Qualifier("dispatcherTaskScheduler") TaskScheduler dispatcherTaskScheduler,
            BackupLauncher backupLauncher,
            @Value("${dbguardian.server.dispatcher.zone:UTC}") String zone) {
        this.backupScheduleService = backupScheduleService;
        this.dispatcherTaskScheduler = dispatcherTaskScheduler;
        this.backupLauncher = backupLauncher;
        this.zoneId = ZoneId.of(zone);
    }

    /**
     * Rebuild the trigger mapping from the enabled schedules.
     *
     * @return false if the schedule store could not be read; the previous mapping stays live
     */
    public boolean refresh() {
        refreshLock.lock();
        try {
            List<BackupScheduleEntity> schedules;
            try {
                schedules = this.backupScheduleService.getEnabledSchedules();
            } catch (Exception e) {
                log.error("refresh failed. can't read enabled schedules, keep {} active triggers",
                        this.activeTriggers.size(), e);
                return false;
            }
            Map<Long, TriggerEntry> previous = this.activeTriggers;
            Map<Long, TriggerEntry> rebuilt = this.buildTriggers(schedules);
            // 计算差异
            Set<Long> removed = new HashSet<>(previous.keySet());
            removed.removeAll(rebuilt.keySet());
            Set<Long> changed = new HashSet<>();
            Set<Long> added = new HashSet<>();
            for (Map.Entry<Long, TriggerEntry> entry : rebuilt.entrySet()) {
                TriggerEntry old = previous.get(entry.getKey());
                if (old == null) {
                    added.add(entry.getKey());
                } else if (!old.equals(entry.getValue())) {
                    changed.add(entry.getKey());
                }
            }
            for (Long scheduleId : removed) {
                this.cancelRegistration(scheduleId);
            }
            for (Long scheduleId : changed) {
                this.cancelRegistration(scheduleId);
            }
            this.activeTriggers = Collections.unmodifiableMap(rebuilt);
            Set<Long> unregistered = new HashSet<>();
            for (Long scheduleId : added) {
                if (!this.register(rebuilt.get(scheduleId))) {
                    unregistered.add(scheduleId);
                }
            }
            for (Long scheduleId : changed) {
                if (!this.register(rebuilt.get(scheduleId))) {
                    unregistered.add(scheduleId);
                }
            }
            // 注册失败的条目不留在映射里
            if (!unregistered.isEmpty()) {
                Map<Long, TriggerEntry> registered = new LinkedHashMap<>(rebuilt);
                registered.keySet().removeAll(unregistered);
                this.activeTriggers = Collections.unmodifiableMap(registered);
                rebuilt = registered;
            }
            int diff = removed.size() + changed.size() + added.size();
            if (diff > 0) {
                log.info("{} schedules changed. added:{}, changed:{}, removed:{}. {} active triggers",
                        diff, added, changed, removed, rebuilt.size());
            } else {
                log.debug("refresh found no schedule change. {} active triggers", rebuilt.size());
            }
            return true;
        } finally {
            refreshLock.unlock();
        }
    }

    public Map<Long, TriggerEntry> activeTriggers() {
        return this.activeTriggers;
    }

    void fire(TriggerEntry entry) {
        TriggerEntry live = this.activeTriggers.get(entry.getScheduleId());
        if (!entry.equals(live)) {
            log.debug("drop stale firing of schedule {}", entry.getScheduleId());
            return;
        }
        Instant now = Instant.now();
        try {
            this.backupScheduleService.updateRunTime(
                    entry.getScheduleId(), Timestamp.from(now), this.advisoryNextRun(entry, now));
        } catch (Exception e) {
            log.warn("fire schedule {}. can't record run time", entry.getScheduleId(), e);
        }
        try {
            String invocationId = this.backupLauncher.launch(entry.getScheduleId());
            log.info("schedule {} for database {} fired. invocation id is {}",
                    entry.getScheduleId(), entry.getDatabaseName(), invocationId);
        } catch (Exception e) {
            log.error("schedule {} fired but the backup could not be launched", entry.getScheduleId(), e);
        }
    }

    // next_run 只是参考值, 算不出来就留空
    private Timestamp advisoryNextRun(TriggerEntry entry, Instant now) {
        try {
            return Timestamp.from(entry.getRule().nextFireTime(now));
        } catch (Exception e) {
            log.warn("schedule {}. can't compute next run", entry.getScheduleId(), e);
            return null;
        }
    }

    @PreDestroy
    public void shutdown() {
        refreshLock.lock();
        try {
            for (ScheduledFuture<?> future : this.registrations.values()) {
                future.cancel(false);
            }
            this.registrations.clear();
            this.activeTriggers = Collections.emptyMap();
        } finally {
            refreshLock.unlock();
        }
    }

    // unchanged schedules keep the previous entry instance
    private Map<Long, TriggerEntry> buildTriggers(List<BackupScheduleEntity> schedules) {
        Map<Long, TriggerEntry> result = new LinkedHashMap<>();
        if (CollectionUtils.isEmpty(schedules)) {
            return result;
        }
        for (BackupScheduleEntity schedule : schedules) {
            TriggerEntry entry = this.translate(schedule);
            if (entry == null) {
                continue;
            }
            TriggerEntry existing = this.activeTriggers.get(entry.getScheduleId());
            result.put(entry.getScheduleId(), entry.equals(existing) ? existing : entry);
        }
        return result;
    }

    TriggerEntry translate(BackupScheduleEntity schedule) {
        if (schedule == null || schedule.getId() == null) {
            log.warn("skip schedule without id. {}", schedule);
            return null;
        }
        ScheduleTypeEnum scheduleType = ScheduleTypeEnum.fromType(schedule.getScheduleType());
        switch (scheduleType) {
            case INTERVAL -> {
                Integer minutes = schedule.getIntervalMinutes();
                if (minutes == null || minutes < 1) {
                    minutes = DEFAULT_INTERVAL_MINUTES;
                }
                return new TriggerEntry(
                        schedule.getId(), schedule.getDatabaseName(), new IntervalTriggerRule(minutes));
            }
            case CRON -> {
                if (StringUtils.isBlank(schedule.getCronExpression())) {
                    log.error("skip schedule {}. cron schedule has no expression", schedule.getId());
                    return null;
                }
                try {
                    CronRule cronRule = CronRule.parse(schedule.getCronExpression());
                    return new TriggerEntry(
                            schedule.getId(),
                            schedule.getDatabaseName(),
                            new CronTriggerRule(cronRule, this.zoneId));
                } catch (CronParseException e) {
                    log.error("skip schedule {}. {}", schedule.getId(), e.getMessage());
                    return null;
                }
            }
            default -> {
                log.error("skip schedule {}. unknown schedule type {}",
                        schedule.getId(), schedule.getScheduleType());
                return null;
            }
        }
    }

    private boolean register(TriggerEntry entry) {
        try {
            ScheduledFuture<?> future = this.dispatcherTaskScheduler.schedule(
                    () -> this.fire(entry), entry.getRule());
            if (future == null) {
                log.error("schedule {} has no next execution, not registered", entry.getScheduleId());
                return false;
            }
            this.registrations.put(entry.getScheduleId(), future);
            return true;
        } catch (Exception e) {
            log.error("can't register trigger for schedule {}", entry.getScheduleId(), e);
            return false;
        }
    }

    private void cancelRegistration(Long scheduleId) {
        ScheduledFuture<?> future = this.registrations.remove(scheduleId);
        if (future != null) {
            future.cancel(false);
        }
    }
}
