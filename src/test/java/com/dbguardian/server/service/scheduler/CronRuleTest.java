package com.dbguardian.server.service.scheduler;

import com.dbguardian.server.exception.CronParseException;
import com.dbguardian.server.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CronRuleTest {

    private static ZonedDateTime utc(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, ZoneOffset.UTC);
    }

    @Test
    void ShouldFireEveryMinuteWhenAllFieldsAreWildcards() {
        CronRule rule = CronRule.parse("* * * * *");
        ZonedDateTime after = utc(2024, 1, 1, 10, 0).plusSeconds(30);
        assertEquals(utc(2024, 1, 1, 10, 1), rule.next(after));
        assertTrue(rule.matches(utc(2031, 7, 19, 23, 59)));
    }

    @Test
    void ShouldFireNextDayWhenTodaysSlotIsTheReference() {
        CronRule rule = CronRule.parse("0 3 * * *");
        assertEquals(utc(2024, 1, 2, 3, 0), rule.next(utc(2024, 1, 1, 3, 0)));
        assertEquals(utc(2024, 1, 1, 3, 0), rule.next(utc(2024, 1, 1, 2, 59)));
    }

    @Test
    void ShouldOnlyFireOnMondayWhenDayOfWeekIsOne() {
        CronRule rule = CronRule.parse("30 * * * 1");
        // 2024-01-01 is a Monday
        assertEquals(utc(2024, 1, 1, 0, 30), rule.next(utc(2024, 1, 1, 0, 0)));
        assertEquals(utc(2024, 1, 8, 0, 30), rule.next(utc(2024, 1, 1, 23, 45)));
    }

    @Test
    void ShouldCombineDayOfMonthAndDayOfWeekWithAnd() {
        CronRule rule = CronRule.parse("0 0 13 * 5");
        assertEquals(utc(2024, 9, 13, 0, 0), rule.next(utc(2024, 1, 1, 0, 0)));
    }

    @Test
    void ShouldFindLeapDayWhenMonthAndDayAreFixed() {
        CronRule rule = CronRule.parse("0 0 29 2 *");
        assertEquals(utc(2024, 2, 29, 0, 0), rule.next(utc(2023, 3, 1, 0, 0)));
    }

    @Test
    void ShouldTreatSevenAsSundayWhenParsingDayOfWeek() {
        CronRule seven = CronRule.parse("0 0 * * 7");
        CronRule zero = CronRule.parse("0 0 * * 0");
        assertEquals(0, seven.getDayOfWeek());
        assertEquals(zero, seven);
        // 2024-01-07 is a Sunday
        assertEquals(utc(2024, 1, 7, 0, 0), seven.next(utc(2024, 1, 1, 0, 0)));
    }

    @Test
    void ShouldKeepWildcardFieldsUnrestricted() {
        CronRule rule = CronRule.parse(" 5   4 * 12 * ");
        assertEquals(5, rule.getMinute());
        assertEquals(4, rule.getHour());
        assertTrue(rule.isUnrestricted(rule.getDayOfMonth()));
        assertEquals(12, rule.getMonth());
        assertTrue(rule.isUnrestricted(rule.getDayOfWeek()));
        assertEquals("5   4 * 12 *", rule.getExpression());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "* * * *",
            "* * * * * *",
            "*/5 * * * *",
            "1-5 * * * *",
            "1,2 * * * *",
            "a * * * *",
            "-1 * * * *",
            "60 * * * *",
            "0 0 30 2 *",
            "0 0 31 4 *",
            "* 24 * * *",
            "* * 0 * *",
            "* * 32 * *",
            "* * * 13 *",
            "* * * * 8",
            "99999999999 * * * *"
    })
    void ShouldThrowCronParseExceptionWhenExpressionIsInvalid(String expression) {
        CronParseException exception = assertThrows(CronParseException.class, () -> CronRule.parse(expression));
        assertEquals(expression, exception.getExpression());
        assertTrue(exception.getMessage().contains(expression));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void ShouldThrowValidationExceptionWhenExpressionIsBlank(String expression) {
        assertThrows(ValidationException.class, () -> CronRule.parse(expression));
    }
}
