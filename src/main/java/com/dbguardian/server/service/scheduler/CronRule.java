package com.dbguardian.server.service.scheduler;

import com.dbguardian.server.exception.CronParseException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Month;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Five-field cron rule: minute, hour, day-of-month, month, day-of-week. Each field is either a
 * single non-negative integer or {@code *}. Restricted fields must all match (AND); day-of-week
 * uses 0-6 with Sunday as 0, and 7 is accepted as Sunday too.
 */
@Getter
@EqualsAndHashCode(exclude = "expression")
public final class CronRule {

    public static final int ANY = -1;

    private static final String WILDCARD = "*";

    // Feb 29 on a given weekday repeats every 28 years
    private static final int MAX_SEARCH_DAYS = 366 * 29;

    private final String expression;

    private final int minute;

    private final int hour;

    private final int dayOfMonth;

    private final int month;

    private final int dayOfWeek;

    private CronRule(String expression, int minute, int hour, int dayOfMonth, int month, int dayOfWeek) {
        this.expression = expression;
        this.minute = minute;
        this.hour = hour;
        this.dayOfMonth = dayOfMonth;
        this.month = month;
        this.dayOfWeek = dayOfWeek;
    }

    public static CronRule parse(String expression) throws CronParseException {
        if (StringUtils.isBlank(expression)) {
            throw new CronParseException(expression, "expression is blank");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new CronParseException(expression, "expected 5 fields but got %s".formatted(parts.length));
        }
        int minute = parseField(expression, parts[0], "minute", 0, 59);
        int hour = parseField(expression, parts[1], "hour", 0, 23);
        int dayOfMonth = parseField(expression, parts[2], "day-of-month", 1, 31);
        int month = parseField(expression, parts[3], "month", 1, 12);
        int dayOfWeek = parseField(expression, parts[4], "day-of-week", 0, 7);
        if (dayOfWeek == 7) {
            dayOfWeek = 0;
        }
        // 30 2 这种组合永远不会触发
        if (dayOfMonth != ANY && month != ANY && dayOfMonth > Month.of(month).maxLength()) {
            throw new CronParseException(expression,
                    "day-of-month %s never occurs in month %s".formatted(dayOfMonth, month));
        }
        return new CronRule(expression.trim(), minute, hour, dayOfMonth, month, dayOfWeek);
    }

    private static int parseField(String expression, String token, String fieldName, int min, int max) {
        if (WILDCARD.equals(token)) {
            return ANY;
        }
        if (!StringUtils.isNumeric(token)) {
            throw new CronParseException(expression,
                    "%s field '%s' is neither a non-negative integer nor '*'".formatted(fieldName, token));
        }
        int value;
        try {
            value = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new CronParseException(expression, "%s field '%s' is too large".formatted(fieldName, token));
        }
        if (value < min || value > max) {
            throw new CronParseException(expression,
                    "%s field %s is out of range [%s, %s]".formatted(fieldName, value, min, max));
        }
        return value;
    }

    public boolean isUnrestricted(int fieldValue) {
        return fieldValue == ANY;
    }

    public boolean matches(ZonedDateTime time) {
        return isDayMatch(time.toLocalDate())
                && fieldMatch(hour, time.getHour())
                && fieldMatch(minute, time.getMinute());
    }

    /**
     * First matching minute strictly after {@code after}, in the zone of {@code after}.
     */
    public ZonedDateTime next(ZonedDateTime after) {
        ZonedDateTime start = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDate day = start.toLocalDate();
        for (int i = 0; i < MAX_SEARCH_DAYS; i++, day = day.plusDays(1)) {
            if (!isDayMatch(day)) {
                continue;
            }
            LocalTime from = i == 0 ? start.toLocalTime() : LocalTime.MIDNIGHT;
            LocalTime time = nextTimeInDay(from);
            if (time != null) {
                ZonedDateTime candidate = ZonedDateTime.of(day, time, after.getZone());
                // DST gap can push the candidate back before the reference
                if (candidate.isAfter(after)) {
                    return candidate;
                }
            }
        }
        throw new IllegalStateException("cron expression '%s' never fires".formatted(expression));
    }

    private LocalTime nextTimeInDay(LocalTime from) {
        for (int h = from.getHour(); h < 24; h++) {
            if (!fieldMatch(hour, h)) {
                continue;
            }
            int firstMinute = h == from.getHour() ? from.getMinute() : 0;
            for (int m = firstMinute; m < 60; m++) {
                if (fieldMatch(minute, m)) {
                    return LocalTime.of(h, m);
                }
            }
        }
        return null;
    }

    private boolean isDayMatch(LocalDate day) {
        return fieldMatch(month, day.getMonthValue())
                && fieldMatch(dayOfMonth, day.getDayOfMonth())
                && fieldMatch(dayOfWeek, day.getDayOfWeek().getValue() % 7);
    }

    private static boolean fieldMatch(int fieldValue, int actual) {
        return fieldValue == ANY || fieldValue == actual;
    }

    @Override
    public String toString() {
        return expression;
    }
}
