package com.dbguardian.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

@AllArgsConstructor
@Getter
public enum ScheduleTypeEnum {

    INTERVAL("interval"),

    // 持久化值沿用 crontab, 读取时同时接受 cron
    CRON("crontab"),

    UNKNOWN("unknown")
    ;

    private final String type;

    public static ScheduleTypeEnum fromType(String type) {
        if (StringUtils.isBlank(type)) {
            return UNKNOWN;
        }
        String normalized = type.trim().toLowerCase();
        if ("cron".equals(normalized)) {
            return CRON;
        }
        for (ScheduleTypeEnum value : values()) {
            if (value.type.equals(normalized)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
