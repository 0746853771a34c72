package com.dbguardian.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum BackupStatusEnum {

    COMPLETED("completed"),

    SKIPPED("skipped"),

    SUCCESS("success")
    ;

    private final String status;
}
