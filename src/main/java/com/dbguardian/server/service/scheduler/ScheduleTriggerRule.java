package com.dbguardian.server.service.scheduler;

import org.springframework.lang.NonNull;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Instant;

/**
 * Live timing rule of one schedule. Implementations are value objects: two rules built from
 * the same schedule row are equal, which is what lets a refresh keep an unchanged registration.
 */
public interface ScheduleTriggerRule extends Trigger {

    Instant nextFireTime(Instant reference);

    @Override
    default Instant nextExecution(@NonNull TriggerContext triggerContext) {
        Instant now = triggerContext.getClock().instant();
        Instant lastScheduled = triggerContext.lastScheduledExecution();
        Instant reference = lastScheduled != null && lastScheduled.isAfter(now) ? lastScheduled : now;
        return nextFireTime(reference);
    }
}
