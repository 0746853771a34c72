package com.dbguardian.server.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ChangeActionEnum {

    INSERTED("inserted"),

    UPDATED("updated"),

    DELETED("deleted")
    ;

    @JsonValue
    private final String action;

    @JsonCreator
    public static ChangeActionEnum fromAction(String action) {
        for (ChangeActionEnum value : values()) {
            if (value.action.equals(action)) {
                return value;
            }
        }
        throw new IllegalArgumentException("unknown schedule change action: " + action);
    }
}
