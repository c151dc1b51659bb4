package org.croniq.monitoring;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes due times from a schedule definition. Stateless apart from the clock used
 * by {@link #nominalPeriod}.
 */
public class ScheduleCalculator {

    private static final Pattern INTERVAL = Pattern.compile("^(\\d+)([mhd])$");

    private final Clock clock;
    private final TimeZone cronZone;

    public ScheduleCalculator() {
        this(Clock.systemUTC(), ZoneOffset.UTC);
    }

    public ScheduleCalculator(Clock clock, ZoneId cronZone) {
        this.clock = clock;
        this.cronZone = TimeZone.getTimeZone(cronZone);
    }

    /**
     * First time strictly after {@code from} at which the job is expected to ping.
     */
    public Instant nextPing(ScheduleType type, String value, Instant from) throws ScheduleException {
        if (type == null) {
            throw new ScheduleException("schedule type is required");
        }
        switch (type) {
            case INTERVAL:
                Duration interval = parseInterval(value);
                try {
                    return from.plus(interval);
                } catch (DateTimeException | ArithmeticException e) {
                    throw new ScheduleException("Interval '" + value + "' is out of range", e);
                }
            case CRON:
                Date start = Date.from(from);
                Date next = null;
                for (CronExpression expression : compile(value)) {
                    Date candidate = expression.getNextValidTimeAfter(start);
                    if (candidate != null && (next == null || candidate.before(next))) {
                        next = candidate;
                    }
                }
                if (next == null) {
                    throw new ScheduleException("Cron expression '" + value + "' has no future occurrence");
                }
                return next.toInstant();
            default:
                throw new ScheduleException("Unsupported schedule type " + type);
        }
    }

    /**
     * Typical gap between two pings. For cron this is the distance between the next two
     * occurrences, which is only an estimate for irregular expressions.
     */
    public Duration nominalPeriod(ScheduleType type, String value) throws ScheduleException {
        if (type == ScheduleType.INTERVAL) {
            return parseInterval(value);
        }
        Instant first = nextPing(type, value, clock.instant());
        Instant second = nextPing(type, value, first);
        return Duration.between(first, second);
    }

    public void validate(ScheduleType type, String value) throws ScheduleException {
        nextPing(type, value, clock.instant());
    }

    static Duration parseInterval(String value) throws ScheduleException {
        if (value == null) {
            throw new ScheduleException("interval value is required");
        }
        Matcher m = INTERVAL.matcher(value);
        if (!m.matches()) {
            throw new ScheduleException("Invalid interval format '" + value + "'. Expected format like \"5m\", \"1h\", \"2d\".");
        }
        long unitSeconds = switch (m.group(2)) {
            case "m" -> 60L;
            case "h" -> 3_600L;
            default -> 86_400L;
        };
        try {
            return Duration.ofSeconds(Math.multiplyExact(Long.parseLong(m.group(1)), unitSeconds));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ScheduleException("Interval '" + value + "' is out of range", e);
        }
    }

    /** One expression, or two when both day fields are restricted; the job is due at the earlier match. */
    private List<CronExpression> compile(String value) throws ScheduleException {
        List<CronExpression> expressions = new ArrayList<>();
        for (String quartz : UnixCronTranslator.toQuartz(value)) {
            try {
                CronExpression expression = new CronExpression(quartz);
                expression.setTimeZone(cronZone);
                expressions.add(expression);
            } catch (ParseException | RuntimeException e) {
                // quartz reports some malformed fields as unchecked exceptions
                throw new ScheduleException("Invalid cron expression '" + value + "': " + e.getMessage(), e);
            }
        }
        return expressions;
    }
}
