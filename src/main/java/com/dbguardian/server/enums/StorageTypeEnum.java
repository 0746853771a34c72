package com.dbguardian.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum StorageTypeEnum {

    PRIMARY("minio"),

    FALLBACK("local"),

    UNKNOWN("unknown")
    ;

    private final String type;

    public static StorageTypeEnum fromType(String type) {
        for (StorageTypeEnum value : values()) {
            if (value.type.equals(type)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
