package com.dbguardian.server.model.api;

import com.dbguardian.server.enums.InvocationStateEnum;
import lombok.Data;
import lombok.experimental.Accessors;

// snapshot of one invocation; message while running, result on success, error on failure
@Data
@Accessors(chain = true)
public class InvocationStatus {

    private String invocationId;

    private InvocationStateEnum state;

    private String message;

    private BackupResult result;

    private String error;
}
