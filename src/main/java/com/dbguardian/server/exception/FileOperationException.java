package com.dbguardian.server.exception;

import lombok.EqualsAndHashCode;


@EqualsAndHashCode(callSuper = false)
public class FileOperationException extends DbGuardianException {

    public FileOperationException(String message) {
        super(message);
    }

    public FileOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
