package org.croniq.monitoring;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a UNIX cron expression (5 fields, or 6 with leading seconds) into Quartz syntax.
 *
 * Quartz differs from UNIX cron in three ways that matter here:
 *  - it always has a seconds field,
 *  - exactly one of day-of-month / day-of-week must be '?',
 *  - days of week are numbered 1 (SUN) .. 7 (SAT) instead of 0/7 (SUN) .. 6 (SAT).
 *
 * UNIX cron fires when either day field matches if both are restricted. Quartz cannot say that
 * in one expression, so such input becomes two expressions, one per day field.
 */
final class UnixCronTranslator {

    private static final Map<String, Integer> DAY_NAMES = Map.of(
            "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6);

    private static final Pattern LAST_WEEKDAY = Pattern.compile("^([0-7]|[A-Z]{3})L$");
    private static final Pattern NTH_WEEKDAY = Pattern.compile("^([0-7]|[A-Z]{3})#([1-5])$");

    private UnixCronTranslator() {}

    static List<String> toQuartz(String expression) throws ScheduleException {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleException("cron expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");

        String seconds;
        int offset;
        if (fields.length == 5) {
            seconds = "0";
            offset = 0;
        } else if (fields.length == 6) {
            seconds = fields[0];
            offset = 1;
        } else {
            throw new ScheduleException("Invalid cron expression '" + expression
                    + "': expected 5 or 6 fields, got " + fields.length);
        }

        String minutes = fields[offset];
        String hours = fields[offset + 1];
        String dayOfMonth = fields[offset + 2];
        String month = fields[offset + 3];
        String dayOfWeek = fields[offset + 4];

        boolean domWildcard = isWildcard(dayOfMonth);
        boolean dowWildcard = isWildcard(dayOfWeek);

        if (dowWildcard) {
            return List.of(join(seconds, minutes, hours, "?".equals(dayOfMonth) ? "*" : dayOfMonth, month, "?"));
        }
        String quartzDayOfWeek = translateDayOfWeek(dayOfWeek, expression);
        if (domWildcard) {
            return List.of(join(seconds, minutes, hours, "?", month, quartzDayOfWeek));
        }
        return List.of(
                join(seconds, minutes, hours, dayOfMonth, month, "?"),
                join(seconds, minutes, hours, "?", month, quartzDayOfWeek));
    }

    private static String join(String... fields) {
        return String.join(" ", fields);
    }

    private static boolean isWildcard(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static String translateDayOfWeek(String field, String expression) throws ScheduleException {
        String upper = field.toUpperCase(Locale.ROOT);

        Matcher last = LAST_WEEKDAY.matcher(upper);
        if (last.matches()) {
            return quartzDay(day(last.group(1), expression)) + "L";
        }
        Matcher nth = NTH_WEEKDAY.matcher(upper);
        if (nth.matches()) {
            return quartzDay(day(nth.group(1), expression)) + "#" + nth.group(2);
        }

        TreeSet<Integer> days = new TreeSet<>();
        for (String item : upper.split(",")) {
            if (item.isEmpty()) {
                throw new ScheduleException("Invalid day-of-week list in '" + expression + "'");
            }
            String base = item;
            int step = 1;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                base = item.substring(0, slash);
                step = number(item.substring(slash + 1), expression);
                if (step <= 0) {
                    throw new ScheduleException("Invalid day-of-week step in '" + expression + "'");
                }
            }

            int start;
            int end;
            if ("*".equals(base)) {
                start = 0;
                end = 6;
            } else if (base.contains("-")) {
                String[] bounds = base.split("-", 2);
                start = day(bounds[0], expression);
                end = day(bounds[1], expression);
                if (start > end) {
                    throw new ScheduleException("Invalid day-of-week range '" + base + "' in '" + expression + "'");
                }
            } else {
                start = day(base, expression);
                end = slash >= 0 ? 6 : start;
            }

            for (int d = start; d <= end; d += step) {
                days.add(d % 7);
            }
        }

        StringJoiner joiner = new StringJoiner(",");
        for (int d : days) {
            joiner.add(String.valueOf(quartzDay(d)));
        }
        return joiner.toString();
    }

    private static int quartzDay(int unixDay) {
        return (unixDay % 7) + 1;
    }

    private static int day(String token, String expression) throws ScheduleException {
        Integer named = DAY_NAMES.get(token);
        if (named != null) {
            return named;
        }
        int value = number(token, expression);
        if (value < 0 || value > 7) {
            throw new ScheduleException("Day-of-week value " + value + " out of range in '" + expression + "'");
        }
        return value;
    }

    private static int number(String token, String expression) throws ScheduleException {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new ScheduleException("Invalid number '" + token + "' in cron expression '" + expression + "'", e);
        }
    }
}
