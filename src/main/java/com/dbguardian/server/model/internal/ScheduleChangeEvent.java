package com.dbguardian.server.model.internal;

import com.dbguardian.server.enums.ChangeActionEnum;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

// payload published by notify_schedule_change()
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleChangeEvent {

    @JsonProperty(value = "action", required = true)
    private ChangeActionEnum action;

    @JsonProperty(value = "schedule_id", required = true)
    private Long scheduleId;

    @JsonProperty("database_name")
    private String databaseName;

    @JsonProperty("enabled")
    private Boolean enabled;

    // only present for updates
    @JsonProperty("old_enabled")
    private Boolean oldEnabled;
}
