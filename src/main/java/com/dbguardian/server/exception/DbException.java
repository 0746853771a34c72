package com.dbguardian.server.exception;

import lombok.EqualsAndHashCode;


@EqualsAndHashCode(callSuper = false)
public class DbException extends DbGuardianException {

    public DbException(String message) {
        super(message);
    }

    public DbException(String message, Throwable cause) {
        super(message, cause);
    }
}
