package com.dbguardian.server.service.scheduler;

import com.dbguardian.server.InMemoryScheduleStore;
import com.dbguardian.server.model.entity.BackupScheduleEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PeriodicDispatcherTest {

    private InMemoryScheduleStore scheduleStore;

    private List<Registration> registrations;

    private List<Long> launched;

    private PeriodicDispatcher dispatcher;

    private record Registration(Runnable task, Trigger trigger, ScheduledFuture<?> future) {
    }

    @BeforeEach
    void setUp() {
        this.scheduleStore = new InMemoryScheduleStore();
        this.registrations = new CopyOnWriteArrayList<>();
        this.launched = new CopyOnWriteArrayList<>();
        TaskScheduler taskScheduler = mock(TaskScheduler.class);
        when(taskScheduler.schedule(any(Runnable.class), any(Trigger.class))).thenAnswer(invocation -> {
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            this.registrations.add(new Registration(invocation.getArgument(0), invocation.getArgument(1), future));
            return future;
        });
        BackupLauncher launcher = scheduleId -> {
            this.launched.add(scheduleId);
            return "invocation-" + scheduleId;
        };
        this.dispatcher = new PeriodicDispatcher(this.scheduleStore, taskScheduler, launcher, "UTC");
    }

    @Test
    void ShouldCoverExactlyEnabledSchedulesWhenRefresh() {
        BackupScheduleEntity interval = this.scheduleStore.addInterval("orders", 15, true);
        BackupScheduleEntity cron = this.scheduleStore.addCron("users", "0 3 * * *", true);
        this.scheduleStore.addInterval("disabled", 5, false);

        assertTrue(this.dispatcher.refresh());

        Map<Long, TriggerEntry> active = this.dispatcher.activeTriggers();
        assertEquals(Set.of(interval.getId(), cron.getId()), active.keySet());
        assertEquals(new IntervalTriggerRule(15), active.get(interval.getId()).getRule());
        assertInstanceOf(CronTriggerRule.class, active.get(cron.getId()).getRule());
        assertEquals("users", active.get(cron.getId()).getDatabaseName());
        assertEquals(2, this.registrations.size());
    }

    @Test
    void ShouldUseSixtyMinutesWhenIntervalIsMissing() {
        BackupScheduleEntity schedule = this.scheduleStore.addInterval("orders", null, true);

        this.dispatcher.refresh();

        IntervalTriggerRule rule = (IntervalTriggerRule) this.dispatcher.activeTriggers().get(schedule.getId()).getRule();
        assertEquals(PeriodicDispatcher.DEFAULT_INTERVAL_MINUTES, rule.getPeriodMinutes());
        assertEquals(Duration.ofMinutes(60), rule.getPeriod());
    }

    @Test
    void ShouldKeepRegistrationsWhenRefreshIsRepeated() {
        this.scheduleStore.addInterval("orders", 15, true);
        this.scheduleStore.addCron("users", "5 * * * *", true);

        this.dispatcher.refresh();
        Map<Long, TriggerEntry> first = this.dispatcher.activeTriggers();
        this.dispatcher.refresh();
        Map<Long, TriggerEntry> second = this.dispatcher.activeTriggers();

        assertEquals(first, second);
        assertEquals(2, this.registrations.size());
        for (Registration registration : this.registrations) {
            verify(registration.future(), never()).cancel(anyBoolean());
        }
    }

    @Test
    void ShouldSkipOnlyTheBrokenScheduleWhenCronIsMalformed() {
        BackupScheduleEntity good = this.scheduleStore.addInterval("orders", 10, true);
        this.scheduleStore.addCron("users", "not a cron", true);
        this.scheduleStore.addCron("blank", "", true);
        BackupScheduleEntity unknown = this.scheduleStore.addInterval("weird", 10, true);
        unknown.setScheduleType("hourly");

        assertTrue(this.dispatcher.refresh());

        assertEquals(Set.of(good.getId()), this.dispatcher.activeTriggers().keySet());
    }

    @Test
    void ShouldKeepPreviousMappingWhenStoreIsUnavailable() {
        BackupScheduleEntity schedule = this.scheduleStore.addInterval("orders", 10, true);
        this.dispatcher.refresh();
        Map<Long, TriggerEntry> before = this.dispatcher.activeTriggers();

        this.scheduleStore.unavailable = true;
        assertFalse(this.dispatcher.refresh());

        assertSame(before, this.dispatcher.activeTriggers());
        assertTrue(this.dispatcher.activeTriggers().containsKey(schedule.getId()));
        verify(this.registrations.get(0).future(), never()).cancel(anyBoolean());
    }

    @Test
    void ShouldCancelRegistrationWhenScheduleIsDeletedOrChanged() {
        BackupScheduleEntity deleted = this.scheduleStore.addInterval("orders", 10, true);
        BackupScheduleEntity changed = this.scheduleStore.addInterval("users", 10, true);
        this.dispatcher.refresh();
        Registration deletedRegistration = this.registrations.get(0);
        Registration changedRegistration = this.registrations.get(1);

        this.scheduleStore.remove(deleted.getId());
        changed.setIntervalMinutes(30);
        assertTrue(this.dispatcher.refresh());

        assertFalse(this.dispatcher.activeTriggers().containsKey(deleted.getId()));
        assertEquals(new IntervalTriggerRule(30), this.dispatcher.activeTriggers().get(changed.getId()).getRule());
        verify(deletedRegistration.future()).cancel(false);
        verify(changedRegistration.future()).cancel(false);
        assertEquals(3, this.registrations.size());
    }

    @Test
    void ShouldLaunchAndRecordRunTimeWhenTriggerFires() {
        BackupScheduleEntity schedule = this.scheduleStore.addInterval("orders", 10, true);
        this.dispatcher.refresh();

        this.registrations.get(0).task().run();

        assertEquals(List.of(schedule.getId()), this.launched);
        BackupScheduleEntity stored = this.scheduleStore.get(schedule.getId());
        assertNotNull(stored.getLastRun());
        assertEquals(Duration.ofMinutes(10),
                Duration.between(stored.getLastRun().toInstant(), stored.getNextRun().toInstant()));
    }

    @Test
    void ShouldDropStaleFiringWhenEntryIsNoLongerLive() {
        BackupScheduleEntity schedule = this.scheduleStore.addInterval("orders", 10, true);
        this.dispatcher.refresh();
        Runnable staleTask = this.registrations.get(0).task();

        schedule.setEnabled(false);
        this.dispatcher.refresh();
        staleTask.run();

        assertTrue(this.launched.isEmpty());
        assertNull(this.scheduleStore.get(schedule.getId()).getLastRun());
    }

    @Test
    void ShouldComputeNextFireTimeFromRule() {
        BackupScheduleEntity schedule = this.scheduleStore.addCron("orders", "0 3 * * *", true);
        this.dispatcher.refresh();

        ScheduleTriggerRule rule = this.dispatcher.activeTriggers().get(schedule.getId()).getRule();

        assertEquals(Instant.parse("2024-01-02T03:00:00Z"), rule.nextFireTime(Instant.parse("2024-01-01T03:00:00Z")));
    }

    @Test
    void ShouldCancelEverythingWhenShutdown() {
        this.scheduleStore.addInterval("orders", 10, true);
        this.dispatcher.refresh();

        this.dispatcher.shutdown();

        assertTrue(this.dispatcher.activeTriggers().isEmpty());
        verify(this.registrations.get(0).future()).cancel(false);
    }

    @Test
    void ShouldSkipScheduleWhenCronDayNeverOccursInMonth() {
        BackupScheduleEntity good = this.scheduleStore.addInterval("orders", 10, true);
        this.scheduleStore.addCron("users", "0 0 30 2 *", true);

        assertTrue(this.dispatcher.refresh());

        assertEquals(Set.of(good.getId()), this.dispatcher.activeTriggers().keySet());
        assertEquals(1, this.registrations.size());
    }

    @Test
    void ShouldLeaveEntryOutWhenRegistrationFails() {
        TaskScheduler rejecting = mock(TaskScheduler.class);
        when(rejecting.schedule(any(Runnable.class), any(Trigger.class))).thenReturn(null);
        PeriodicDispatcher periodicDispatcher = new PeriodicDispatcher(
                this.scheduleStore, rejecting, scheduleId -> "unused", "UTC");
        this.scheduleStore.addInterval("orders", 10, true);

        assertTrue(periodicDispatcher.refresh());

        assertTrue(periodicDispatcher.activeTriggers().isEmpty());
    }

    @Test
    void ShouldHandleNullScheduleWhenTranslating() {
        assertNull(this.dispatcher.translate(null));
        assertNull(this.dispatcher.translate(new BackupScheduleEntity()));
    }
}
