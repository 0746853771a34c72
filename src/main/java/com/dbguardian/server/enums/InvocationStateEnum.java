package com.dbguardian.server.enums;

public enum InvocationStateEnum {

    PENDING,

    PROGRESS,

    SUCCESS,

    FAILURE
    ;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }
}
