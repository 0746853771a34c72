package com.dbguardian.server.service.scheduler;

import lombok.Value;

@Value
public class TriggerEntry {

    long scheduleId;

    String databaseName;

    ScheduleTriggerRule rule;
}
