package com.dbguardian.server.exception;

import lombok.EqualsAndHashCode;


@EqualsAndHashCode(callSuper = false)
public class JsonException extends DbGuardianException {

    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
