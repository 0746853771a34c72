package com.dbguardian.server.service.scheduler;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;
import java.time.ZoneId;

@Getter
@EqualsAndHashCode
public class CronTriggerRule implements ScheduleTriggerRule {

    private final CronRule cronRule;

    private final ZoneId zoneId;

    public CronTriggerRule(CronRule cronRule, ZoneId zoneId) {
        this.cronRule = cronRule;
        this.zoneId = zoneId;
    }

    @Override
    public Instant nextFireTime(Instant reference) {
        return cronRule.next(reference.atZone(zoneId)).toInstant();
    }

    @Override
    public String toString() {
        return "cron '%s' (%s)".formatted(cronRule.getExpression(), zoneId);
    }
}
