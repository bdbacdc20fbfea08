package io.pingjob.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.ZoneId;
import java.util.StringJoiner;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes cron specs into Quartz {@link CronExpression} syntax.
 * <p>
 * Accepted formats:
 * <ul>
 *   <li>6-field, seconds first: "*&#47;10 * * * * *"</li>
 *   <li>5-field: "*&#47;5 * * * *" (runs at second 0)</li>
 *   <li>Quartz 6/7-field with {@code ?}, passed through unchanged</li>
 * </ul>
 * <p>Without a {@code ?}, numeric days of week are read Unix-style (0 = Sunday, 6 = Saturday)
 * and renumbered for Quartz, so {@code "0 0 9 * * 1-5"} fires Monday to Friday.</p>
 */
public final class CronExpressions {
    private static final Pattern NUMERIC_DAY_OF_WEEK = Pattern.compile("[0-9*,/\\-]+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private CronExpressions() {
    }

    public static String normalize(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("cron expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    // Unix-style fields: Quartz needs '?' in exactly one of day-of-month / day-of-week,
    // and counts weekdays from 1 = Sunday instead of 0 = Sunday.
    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        if ("?".equals(dayOfMonth) || "?".equals(dayOfWeek)) {
            return String.join(" ", sec, min, hour, dayOfMonth, month, dayOfWeek);
        }

        String dom = dayOfMonth;
        String dow = shiftDayOfWeek(dayOfWeek);
        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        }
        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Renumber weekday values 0-6 to Quartz's 1-7. Step sizes after {@code /} are counts and
     * stay as they are. Names ({@code MON-FRI}) and Quartz-only forms ({@code L}, {@code #}) are
     * left untouched.
     */
    static String shiftDayOfWeek(String field) {
        if (!NUMERIC_DAY_OF_WEEK.matcher(field).matches()) {
            return field;
        }
        StringJoiner out = new StringJoiner(",");
        for (String item : field.split(",", -1)) {
            int slash = item.indexOf('/');
            String range = slash < 0 ? item : item.substring(0, slash);
            String step = slash < 0 ? "" : item.substring(slash);
            Matcher m = DIGITS.matcher(range);
            StringBuilder shifted = new StringBuilder();
            while (m.find()) {
                int day = Integer.parseInt(m.group());
                m.appendReplacement(shifted, day <= 6 ? String.valueOf(day + 1) : m.group());
            }
            m.appendTail(shifted);
            out.add(shifted + step);
        }
        return out.toString();
    }

    public static boolean isValid(String expression) {
        try {
            return CronExpression.isValidExpression(normalize(expression));
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    /**
     * Parse {@code expression} into a Quartz expression evaluated in {@code zone}.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static CronExpression parse(String expression, ZoneId zone) {
        String cron = normalize(expression);
        try {
            CronExpression exp = new CronExpression(cron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression + " (" + e.getMessage() + ")", e);
        }
    }
}
