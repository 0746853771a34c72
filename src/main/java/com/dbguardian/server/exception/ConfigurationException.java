package com.dbguardian.server.exception;

import lombok.EqualsAndHashCode;


@EqualsAndHashCode(callSuper = false)
public class ConfigurationException extends DbGuardianException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
