package com.dbguardian.server.exception;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Failure of the backup pipeline itself, typically the dump tool exiting non-zero.
 * {@code toolOutput} holds the diagnostic output of the external tool when there is one.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class BackupException extends DbGuardianException {

    private final int exitCode;

    private final String toolOutput;

    public BackupException(String message) {
        this(message, -1, null);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.toolOutput = null;
    }

    public BackupException(String message, int exitCode, String toolOutput) {
        super(message);
        this.exitCode = exitCode;
        this.toolOutput = toolOutput;
    }
}
