package com.dbguardian.server.service.backup;

import com.dbguardian.server.enums.InvocationStateEnum;

@FunctionalInterface
public interface InvocationProgress {

    InvocationProgress NOOP = (state, message) -> { };

    void updateState(InvocationStateEnum state, String message);
}
