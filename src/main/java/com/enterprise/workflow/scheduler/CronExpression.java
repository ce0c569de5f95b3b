package com.enterprise.workflow.scheduler;

import com.enterprise.workflow.exception.SchedulerException;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Five-field cron expression: minute, hour, day of month, month, day of week.
 * <p>
 * Each field accepts {@code *}, a single value, a range {@code a-b}, a step
 * {@code *}{@code /n}, {@code a/n} or {@code a-b/n}, and comma lists of these.
 * Day of week runs 0-6 with 0 for Sunday. A time matches when every field
 * matches; unlike POSIX cron, a restricted day of month and day of week are
 * not OR-ed.
 */
public final class CronExpression {
    
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    
    private final String expression;
    private final List<Integer> minutes;
    private final List<Integer> hours;
    private final List<Integer> daysOfMonth;
    private final List<Integer> months;
    private final List<Integer> daysOfWeek;
    
    private CronExpression(String expression, List<Integer> minutes, List<Integer> hours,
                           List<Integer> daysOfMonth, List<Integer> months, List<Integer> daysOfWeek) {
        this.expression = expression;
        this.minutes = minutes;
        this.hours = hours;
        this.daysOfMonth = daysOfMonth;
        this.months = months;
        this.daysOfWeek = daysOfWeek;
    }
    
    /**
     * Parse an expression
     *
     * @throws SchedulerException of kind INVALID_CRON on a malformed or out-of-range field
     */
    public static CronExpression parse(String expression) throws SchedulerException {
        if (expression == null) {
            throw SchedulerException.invalidCron("expression is null");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw SchedulerException.invalidCron("Expected 5 fields (minute hour day month weekday), got '"
                    + expression + "'");
        }
        return new CronExpression(expression,
                parseField(parts[0], 0, 59),
                parseField(parts[1], 0, 23),
                parseField(parts[2], 1, 31),
                parseField(parts[3], 1, 12),
                parseField(parts[4], 0, 6));
    }
    
    private static List<Integer> parseField(String field, int min, int max) throws SchedulerException {
        TreeSet<Integer> values = new TreeSet<>();
        for (String part : field.split(",", -1)) {
            int slash = part.indexOf('/');
            String range = slash >= 0 ? part.substring(0, slash) : part;
            int step = 1;
            if (slash >= 0) {
                step = parseNumber(part.substring(slash + 1), part);
                if (step <= 0) {
                    throw SchedulerException.invalidCron("Invalid step: " + part);
                }
            }
            
            int start;
            int end;
            if (range.equals("*")) {
                start = min;
                end = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw SchedulerException.invalidCron("Invalid range: " + part);
                }
                start = parseNumber(bounds[0], part);
                end = parseNumber(bounds[1], part);
                if (start > end) {
                    throw SchedulerException.invalidCron("Reversed range: " + part);
                }
            } else {
                start = parseNumber(range, part);
                end = slash >= 0 ? max : start;
            }
            
            if (start < min || start > max || end > max) {
                throw SchedulerException.invalidCron("Value out of range " + min + "-" + max + ": " + part);
            }
            for (long value = start; value <= end; value += step) {
                values.add((int) value);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }
    
    private static int parseNumber(String text, String part) throws SchedulerException {
        if (!DIGITS.matcher(text).matches()) {
            throw SchedulerException.invalidCron("Invalid value: " + part);
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw SchedulerException.invalidCron("Invalid value: " + part);
        }
    }
    
    /**
     * Whether the minute containing {@code time} matches, in the time's own zone
     */
    public boolean matches(ZonedDateTime time) {
        return minutes.contains(time.getMinute())
                && hours.contains(time.getHour())
                && daysOfMonth.contains(time.getDayOfMonth())
                && months.contains(time.getMonthValue())
                && daysOfWeek.contains(time.getDayOfWeek().getValue() % 7);
    }
    
    public String getExpression() { return expression; }
    
    public List<Integer> getMinutes() { return minutes; }
    
    public List<Integer> getHours() { return hours; }
    
    public List<Integer> getDaysOfMonth() { return daysOfMonth; }
    
    public List<Integer> getMonths() { return months; }
    
    public List<Integer> getDaysOfWeek() { return daysOfWeek; }
    
    @Override
    public String toString() {
        return expression;
    }
}
