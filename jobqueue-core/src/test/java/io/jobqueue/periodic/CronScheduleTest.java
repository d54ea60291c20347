package io.jobqueue.periodic;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CronScheduleTest {

    @Test
    void fiveFieldExpressionGetsSecondsAndQuestionMark() {
        assertEquals("0 */15 * * * ?", CronSchedule.toQuartz("*/15 * * * *"));
        assertEquals("0 30 2 ? * 2-6", CronSchedule.toQuartz("30 2 * * 1-5"));
        assertEquals("0 0 0 1 * ?", CronSchedule.toQuartz("0 0 1 * *"));
    }

    @Test
    void sundayIsZeroOrSeven() {
        assertEquals("0 0 9 ? * 1", CronSchedule.toQuartz("0 9 * * 0"));
        assertEquals("0 0 9 ? * 1", CronSchedule.toQuartz("0 9 * * 7"));
        assertEquals("0 0 9 ? * 2,4,6", CronSchedule.toQuartz("0 9 * * 1,3,5"));
        assertEquals("0 0 9 ? * MON-FRI", CronSchedule.toQuartz("0 9 * * MON-FRI"));
    }

    @Test
    void nthOccurrenceShiftsOnlyTheDay() {
        assertEquals("0 0 9 ? * 6#3", CronSchedule.toQuartz("0 9 * * 5#3"));
        assertEquals("0 0 9 ? * 1#1", CronSchedule.toQuartz("0 9 * * 0#1"));
        assertEquals("0 0 9 ? * 2-6/2", CronSchedule.toQuartz("0 9 * * 1-5/2"));
    }

    @Test
    void nthOccurrenceFiresOnThirdFriday() {
        CronSchedule schedule = new CronSchedule("0 9 * * 5#3", ZoneOffset.UTC);

        // Fridays in November 2024 fall on the 1st, 8th and 15th
        Instant next = schedule.next(Instant.parse("2024-11-01T00:00:00Z"));

        assertEquals(Instant.parse("2024-11-15T09:00:00Z"), next);
    }

    @Test
    void sixFieldExpressionPassesThrough() {
        assertEquals("0/5 * * * * ?", CronSchedule.toQuartz("0/5 * * * * ?"));
    }

    @Test
    void nextFiresOnQuarterHours() {
        CronSchedule schedule = new CronSchedule("*/15 * * * *", ZoneOffset.UTC);

        Instant next = schedule.next(Instant.parse("2024-03-01T10:07:12Z"));

        assertEquals(Instant.parse("2024-03-01T10:15:00Z"), next);
        assertEquals(Instant.parse("2024-03-01T10:30:00Z"), schedule.next(next));
    }

    @Test
    void weekdayScheduleSkipsWeekend() {
        CronSchedule schedule = new CronSchedule("0 9 * * 1-5", ZoneOffset.UTC);

        // 2024-03-02 is a Saturday
        Instant next = schedule.next(Instant.parse("2024-03-02T00:00:00Z"));

        assertEquals(Instant.parse("2024-03-04T09:00:00Z"), next);
    }

    @Test
    void invalidExpressionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CronSchedule("not a cron", ZoneOffset.UTC));
    }
}
