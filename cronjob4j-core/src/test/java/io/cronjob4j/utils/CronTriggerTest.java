package io.cronjob4j.utils;

import io.cronjob4j.errors.InvalidCronExpressionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronTriggerTest {

    private final CronTrigger trigger = CronTrigger.utc();

    @Test
    void dailyMidnightShouldFireOnNextDay() {
        Instant next = trigger.next("0 0 * * *", Instant.parse("2024-01-01T10:00:00Z"));
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), next);
    }

    @Test
    void stepMinutesShouldFireOnNextQuarterHour() {
        Instant next = trigger.next("*/15 * * * *", Instant.parse("2024-01-01T10:07:00Z"));
        assertEquals(Instant.parse("2024-01-01T10:15:00Z"), next);
    }

    @Test
    void nextShouldBeStrictlyAfterReference() {
        Instant next = trigger.next("0 0 * * *", Instant.parse("2024-01-02T00:00:00Z"));
        assertEquals(Instant.parse("2024-01-03T00:00:00Z"), next);
    }

    @Test
    void dayOfWeekShouldUseStandardNumbering() {
        // 2024-01-01 is a Monday
        Instant monday = trigger.next("0 9 * * 1", Instant.parse("2024-01-01T10:00:00Z"));
        assertEquals(Instant.parse("2024-01-08T09:00:00Z"), monday);

        Instant sundayAsZero = trigger.next("0 9 * * 0", Instant.parse("2024-01-01T10:00:00Z"));
        Instant sundayAsSeven = trigger.next("0 9 * * 7", Instant.parse("2024-01-01T10:00:00Z"));
        assertEquals(Instant.parse("2024-01-07T09:00:00Z"), sundayAsZero);
        assertEquals(sundayAsZero, sundayAsSeven);
    }

    @Test
    void dayOfWeekRangeEndingOnSundayShouldWrap() {
        Instant next = trigger.next("0 9 * * 5-7", Instant.parse("2024-01-01T10:00:00Z"));
        assertEquals(Instant.parse("2024-01-05T09:00:00Z"), next);
        assertEquals("0 0 9 ? * 6-1", CronTrigger.toQuartzExpression("0 9 * * 5-7"));
    }

    @Test
    void namedDaysShouldBeAccepted() {
        // Saturday afternoon -> Monday noon
        Instant next = trigger.next("0 12 * * MON-FRI", Instant.parse("2024-01-06T13:00:00Z"));
        assertEquals(Instant.parse("2024-01-08T12:00:00Z"), next);
    }

    @Test
    void sixFieldExpressionShouldSupportSeconds() {
        Instant next = trigger.next("*/10 * * * * *", Instant.parse("2024-01-01T10:00:03Z"));
        assertEquals(Instant.parse("2024-01-01T10:00:10Z"), next);
    }

    @Test
    void zoneShouldApplyToFieldEvaluation() {
        CronTrigger tokyo = new CronTrigger(ZoneId.of("Asia/Tokyo"));
        Instant next = tokyo.next("0 9 * * *", Instant.parse("2023-12-31T23:00:00Z"));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), next);
    }

    @Test
    void toQuartzExpressionShouldPlaceQuestionMark() {
        assertEquals("0 0 0 * * ?", CronTrigger.toQuartzExpression("0 0 * * *"));
        assertEquals("0 0 9 ? * 2-6", CronTrigger.toQuartzExpression("0 9 * * 1-5"));
        assertEquals("0 30 6 1 * ?", CronTrigger.toQuartzExpression("30 6 1 * *"));
    }

    @Test
    void malformedExpressionsShouldBeRejected() {
        assertThrows(InvalidCronExpressionException.class, () -> trigger.next("not a cron", Instant.now()));
        assertThrows(InvalidCronExpressionException.class, () -> trigger.next("* * * *", Instant.now()));
        assertThrows(InvalidCronExpressionException.class, () -> trigger.next("61 * * * *", Instant.now()));
        assertThrows(InvalidCronExpressionException.class, () -> trigger.next("0 9 * * 8", Instant.now()));
        assertThrows(InvalidCronExpressionException.class, () -> trigger.next("", Instant.now()));
        assertThrows(InvalidCronExpressionException.class, () -> trigger.next(null, Instant.now()));
    }

    @Test
    void restrictingBothDayFieldsShouldBeRejected() {
        InvalidCronExpressionException e = assertThrows(InvalidCronExpressionException.class,
                () -> trigger.validate("0 0 1 * 1"));
        assertEquals("0 0 1 * 1", e.getExpression());
    }

    @Test
    void isValidShouldReportWithoutThrowing() {
        assertTrue(trigger.isValid("0 3 * * *"));
        assertFalse(trigger.isValid("0 3 * *"));
    }
}
