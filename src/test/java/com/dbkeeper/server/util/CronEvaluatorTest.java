package com.dbkeeper.server.util;

import com.dbkeeper.server.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CronEvaluatorTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Istanbul");

    private static ZonedDateTime at(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, ZONE);
    }

    @Test
    void dailyExpressionFiresNextDayWhenTimeHasPassed() {
        ZonedDateTime next = CronEvaluator.nextFireTime("0 2 * * *", at(2024, 1, 1, 10, 0));
        assertEquals(at(2024, 1, 2, 2, 0), next);
    }

    @Test
    void resultIsStrictlyAfterTheGivenInstant() {
        ZonedDateTime next = CronEvaluator.nextFireTime("0 2 * * *", at(2024, 1, 1, 2, 0));
        assertEquals(at(2024, 1, 2, 2, 0), next);
        // seconds inside the matching minute still move on to the next one
        ZonedDateTime next2 = CronEvaluator.nextFireTime("* * * * *", at(2024, 1, 1, 2, 0).plusSeconds(30));
        assertEquals(at(2024, 1, 1, 2, 1), next2);
    }

    @Test
    void stepsListsAndRanges() {
        assertEquals(at(2024, 1, 1, 10, 15),
                CronEvaluator.nextFireTime("*/15 * * * *", at(2024, 1, 1, 10, 7)));
        assertEquals(at(2024, 1, 1, 12, 5),
                CronEvaluator.nextFireTime("5 9,12,18 * * *", at(2024, 1, 1, 9, 5)));
        assertEquals(at(2024, 1, 1, 14, 0),
                CronEvaluator.nextFireTime("0 8-20/3 * * *", at(2024, 1, 1, 11, 0)));
        // "a/n" runs to the top of the field
        assertEquals(at(2024, 1, 1, 10, 50),
                CronEvaluator.nextFireTime("20/15 * * * *", at(2024, 1, 1, 10, 36)));
    }

    @Test
    void namesAndSundayAsSeven() {
        // 2024-01-01 is a Monday
        assertEquals(at(2024, 1, 7, 12, 0),
                CronEvaluator.nextFireTime("0 12 * * 7", at(2024, 1, 1, 0, 0)));
        assertEquals(at(2024, 1, 7, 12, 0),
                CronEvaluator.nextFireTime("0 12 * * SUN", at(2024, 1, 1, 0, 0)));
        assertEquals(at(2024, 3, 4, 3, 30),
                CronEvaluator.nextFireTime("30 3 * MAR mon", at(2024, 1, 1, 0, 0)));
    }

    @Test
    void restrictedDayFieldsAreOred() {
        // Sunday 2024-09-01, the first Friday comes before the 13th
        assertEquals(at(2024, 9, 6, 0, 0),
                CronEvaluator.nextFireTime("0 0 13 * 5", at(2024, 9, 1, 0, 0)));
        // after that Friday the next Friday, the 13th
        assertEquals(at(2024, 9, 13, 0, 0),
                CronEvaluator.nextFireTime("0 0 13 * 5", at(2024, 9, 6, 0, 0)));
    }

    @Test
    void wildcardDayOfMonthLeavesDayOfWeekInCharge() {
        assertEquals(at(2024, 1, 6, 4, 0),
                CronEvaluator.nextFireTime("0 4 * * 6", at(2024, 1, 1, 0, 0)));
        assertEquals(at(2024, 1, 6, 4, 0),
                CronEvaluator.nextFireTime("0 4 */1 * 6", at(2024, 1, 1, 0, 0)));
    }

    @Test
    void leapDayIsFound() {
        assertEquals(at(2028, 2, 29, 0, 0),
                CronEvaluator.nextFireTime("0 0 29 2 *", at(2024, 3, 1, 0, 0)));
    }

    @Test
    void malformedExpressionsAreRejected() {
        for (String cron : new String[]{
                "", "* * * *", "* * * * * *", "60 * * * *", "* 24 * * *", "* * 0 * *",
                "* * * 13 *", "* * * * 8", "*/0 * * * *", "5-1 * * * *", "a * * * *",
                "1,,2 * * * *", "1-2-3 * * * *", "-1 * * * *"}) {
            assertThrows(ValidationException.class, () -> CronEvaluator.validate(cron, ZONE), cron);
            assertFalse(CronEvaluator.isValid(cron, ZONE), cron);
        }
    }

    @Test
    void expressionThatNeverFiresIsRejected() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CronEvaluator.nextFireTime("0 0 31 2 *", at(2024, 1, 1, 0, 0)));
        assertTrue(e.getMessage().contains("0 0 31 2 *") || e.getMessage().contains("never fires"));
        assertFalse(CronEvaluator.isValid("0 0 30 2 *", ZONE));
    }

    @Test
    void validExpressionsPass() {
        assertTrue(CronEvaluator.isValid("0 6 * * 0", ZONE));
        assertTrue(CronEvaluator.isValid("15 22 * * 1-5", ZONE));
        assertTrue(CronEvaluator.isValid("0 0 1 JAN-DEC/3 *", ZONE));
    }
}
