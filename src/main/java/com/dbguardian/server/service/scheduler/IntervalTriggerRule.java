package com.dbguardian.server.service.scheduler;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.TriggerContext;

import java.time.Duration;
import java.time.Instant;

@Getter
@EqualsAndHashCode
public class IntervalTriggerRule implements ScheduleTriggerRule {

    private final int periodMinutes;

    public IntervalTriggerRule(int periodMinutes) {
        if (periodMinutes < 1) {
            throw new IllegalArgumentException("periodMinutes must be positive. got " + periodMinutes);
        }
        this.periodMinutes = periodMinutes;
    }

    public Duration getPeriod() {
        return Duration.ofMinutes(periodMinutes);
    }

    @Override
    public Instant nextFireTime(Instant reference) {
        return reference.plus(getPeriod());
    }

    // fixed rate: the next slot is measured from the previous slot, not from completion
    @Override
    public Instant nextExecution(@NonNull TriggerContext triggerContext) {
        Instant lastScheduled = triggerContext.lastScheduledExecution();
        if (lastScheduled == null) {
            return nextFireTime(triggerContext.getClock().instant());
        }
        return nextFireTime(lastScheduled);
    }

    @Override
    public String toString() {
        return "every %s minutes".formatted(periodMinutes);
    }
}
