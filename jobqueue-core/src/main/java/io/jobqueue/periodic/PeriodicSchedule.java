package io.jobqueue.periodic;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * When a periodic job fires.
 *
 * @see #every(Duration)
 * @see #cron(String)
 */
public interface PeriodicSchedule {

    /**
     * Returns the first fire time strictly after {@code after}, or {@code null} if the
     * schedule never fires again.
     */
    Instant next(Instant after);

    /**
     * Fixed interval schedule.
     */
    static PeriodicSchedule every(Duration interval) {
        return new IntervalSchedule(interval);
    }

    /**
     * Cron schedule in the system default time zone. Accepts Quartz expressions (6 or 7
     * fields, seconds first) and classic 5-field expressions.
     */
    static PeriodicSchedule cron(String expression) {
        return new CronSchedule(expression, ZoneId.systemDefault());
    }

    static PeriodicSchedule cron(String expression, ZoneId zone) {
        return new CronSchedule(expression, zone);
    }
}
