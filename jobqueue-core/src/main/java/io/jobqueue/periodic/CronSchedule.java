package io.jobqueue.periodic;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cron schedule backed by Quartz's {@link CronExpression}.
 *
 * <p>Five-field expressions ({@code min hour dom month dow}) are converted to Quartz syntax
 * by prepending a zero seconds field and replacing the unused day field with {@code ?}.
 * Numeric days of week follow Unix numbering ({@code 0} or {@code 7} is Sunday) and are
 * shifted to Quartz's ({@code 1} is Sunday).
 */
public final class CronSchedule implements PeriodicSchedule {
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final String expression;
    private final CronExpression cron;

    public CronSchedule(String expression, ZoneId zone) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(zone, "zone");
        String quartz = toQuartz(expression.trim());
        try {
            this.cron = new CronExpression(quartz);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression, e);
        }
        this.cron.setTimeZone(TimeZone.getTimeZone(zone));
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }

    @Override
    public synchronized Instant next(Instant after) {
        Date next = cron.getNextValidTimeAfter(Date.from(after));
        return next == null ? null : next.toInstant();
    }

    static String toQuartz(String expression) {
        String[] fields = expression.split("\\s+");
        if (fields.length != 5) {
            return expression;
        }
        String dom = fields[2];
        String dow = fields[4];
        if ("*".equals(dow) || "?".equals(dow)) {
            dow = "?";
        } else {
            dow = shiftDaysOfWeek(dow);
            if ("*".equals(dom)) {
                dom = "?";
            }
        }
        return String.join(" ", "0", fields[0], fields[1], dom, fields[3], dow);
    }

    private static String shiftDaysOfWeek(String field) {
        StringBuilder out = new StringBuilder();
        for (String part : field.split(",", -1)) {
            if (out.length() > 0) {
                out.append(',');
            }
            // step and nth-occurrence suffixes are counts, not days
            int cut = suffixStart(part);
            String range = part.substring(0, cut);
            String step = part.substring(cut);
            Matcher m = DIGITS.matcher(range);
            StringBuilder shifted = new StringBuilder();
            while (m.find()) {
                int day = Integer.parseInt(m.group());
                m.appendReplacement(shifted, Integer.toString(day % 7 + 1));
            }
            m.appendTail(shifted);
            out.append(shifted).append(step);
        }
        return out.toString();
    }

    private static int suffixStart(String part) {
        int slash = part.indexOf('/');
        int hash = part.indexOf('#');
        if (slash < 0) {
            return hash < 0 ? part.length() : hash;
        }
        return hash < 0 ? slash : Math.min(slash, hash);
    }

    @Override
    public String toString() {
        return "CronSchedule[" + expression + "]";
    }
}
