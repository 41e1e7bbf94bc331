package io.cronjob4j.utils;

import io.cronjob4j.errors.InvalidCronExpressionException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes fire times of cron expressions.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Standard 5-field cron: {@code minute hour day-of-month month day-of-week}, day-of-week 0-7 with 0 and 7
 *       meaning Sunday, names such as {@code MON} or {@code JAN} accepted</li>
 *   <li>6-field cron with a leading seconds field</li>
 * </ul>
 * <p>
 * Expressions are evaluated with Quartz {@link CronExpression} after translating the day-of-week numbering
 * and the {@code ?} placeholder Quartz requires. Restricting both day-of-month and day-of-week is not supported.
 * <p>
 * Note: {@link #next} always returns the first occurrence strictly after the reference instant, so occurrences
 * missed while the scheduler was offline are skipped, never replayed.
 */
public final class CronTrigger {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)(.*)$");

    private final ZoneId zone;

    public CronTrigger(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public static CronTrigger utc() {
        return new CronTrigger(ZoneOffset.UTC);
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Next fire time strictly after {@code after}.
     *
     * @throws InvalidCronExpressionException if the expression is malformed or never fires after {@code after}
     */
    public Instant next(String cronExpression, Instant after) {
        Objects.requireNonNull(after, "after must not be null");

        CronExpression exp = parse(cronExpression);
        Date nextDate = exp.getNextValidTimeAfter(Date.from(after));
        if (nextDate == null) {
            throw new InvalidCronExpressionException(cronExpression, "expression produced no next execution time");
        }
        return nextDate.toInstant();
    }

    /**
     * Throws {@link InvalidCronExpressionException} unless the expression parses and has a future occurrence.
     */
    public void validate(String cronExpression) {
        next(cronExpression, Instant.now());
    }

    public boolean isValid(String cronExpression) {
        try {
            validate(cronExpression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    private CronExpression parse(String cronExpression) {
        String quartz = toQuartzExpression(cronExpression);
        try {
            CronExpression exp = new CronExpression(quartz);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new InvalidCronExpressionException(cronExpression, ex.getMessage(), ex);
        }
    }

    /**
     * Normalize a 5- or 6-field cron expression into Quartz syntax:
     * - prepends seconds "0" to 5-field expressions
     * - shifts day-of-week numbers from 0-7 (Sunday = 0 or 7) to Quartz 1-7 (Sunday = 1)
     * - places "?" in whichever day field is unrestricted
     */
    public static String toQuartzExpression(String expression) {
        if (expression == null) {
            throw new InvalidCronExpressionException(null, "expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new InvalidCronExpressionException(expression, "expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        String sec;
        int offset;
        if (parts.length == 5) {
            sec = "0";
            offset = 0;
        } else if (parts.length == 6) {
            sec = parts[0];
            offset = 1;
        } else {
            throw new InvalidCronExpressionException(expression,
                    "expected 5 fields (minute hour day-of-month month day-of-week) or 6 with leading seconds, got "
                            + parts.length);
        }

        String min = parts[offset];
        String hour = parts[offset + 1];
        String dom = parts[offset + 2].toUpperCase(Locale.ROOT);
        String month = parts[offset + 3].toUpperCase(Locale.ROOT);
        String dow = translateDayOfWeek(expression, parts[offset + 4].toUpperCase(Locale.ROOT));

        boolean domAny = "*".equals(dom) || "?".equals(dom);
        boolean dowAny = "*".equals(dow) || "?".equals(dow);

        if (domAny && dowAny) {
            dom = "*";
            dow = "?";
        } else if (domAny) {
            dom = "?";
        } else if (dowAny) {
            dow = "?";
        } else {
            throw new InvalidCronExpressionException(expression,
                    "restricting both day-of-month and day-of-week is not supported");
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static String translateDayOfWeek(String expression, String field) {
        String[] items = field.split(",", -1);
        StringBuilder out = new StringBuilder(field.length() + 4);
        for (int i = 0; i < items.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(translateDayOfWeekItem(expression, items[i]));
        }
        return out.toString();
    }

    private static String translateDayOfWeekItem(String expression, String item) {
        String base = item;
        String step = null;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            base = item.substring(0, slash);
            step = item.substring(slash);
        }

        String translated;
        int dash = base.indexOf('-');
        if (dash > 0) {
            translated = translateDay(expression, base.substring(0, dash)) + "-"
                    + translateDay(expression, base.substring(dash + 1));
        } else {
            translated = translateDay(expression, base);
        }
        return step == null ? translated : translated + step;
    }

    // "0".."7" -> Quartz "1".."7" (Sunday = 1); names, "*", "?" and "L" pass through, "5L" / "5#3" keep their suffix.
    private static String translateDay(String expression, String token) {
        Matcher m = LEADING_NUMBER.matcher(token);
        if (!m.matches()) {
            return token;
        }
        int day;
        try {
            day = Integer.parseInt(m.group(1));
        } catch (NumberFormatException ex) {
            throw new InvalidCronExpressionException(expression, "day-of-week out of range: " + token);
        }
        if (day > 7) {
            throw new InvalidCronExpressionException(expression, "day-of-week out of range: " + token);
        }
        return (day % 7 + 1) + m.group(2);
    }
}
