package com.dbguardian.server.exception;

import lombok.EqualsAndHashCode;
import lombok.Getter;


@Getter
@EqualsAndHashCode(callSuper = false)
public class CronParseException extends ValidationException {

    private final String expression;

    public CronParseException(String expression, String reason) {
        super("Invalid cron expression: '%s'. %s".formatted(expression, reason));
        this.expression = expression;
    }
}
