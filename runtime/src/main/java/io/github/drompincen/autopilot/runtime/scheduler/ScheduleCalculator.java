package io.github.drompincen.autopilot.runtime.scheduler;

import io.github.drompincen.autopilot.protocol.api.IntervalUnit;
import io.github.drompincen.autopilot.protocol.api.ScheduleType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a schedule config into the next fire instant. Stateless apart from the zone
 * cron expressions and local timestamps are evaluated in.
 *
 * <p>Config shapes:
 * <ul>
 *   <li>cron: {@code {"expression": "<minute> <hour> <day-of-month> <month> <day-of-week>"}}</li>
 *   <li>interval: {@code {"value": 60, "unit": "minutes"}}</li>
 *   <li>once: {@code {"datetime": "2025-10-13T09:00:00Z"}}</li>
 * </ul>
 */
@Component
public class ScheduleCalculator {

    private final ZoneId zone;

    public ScheduleCalculator(@Value("${autopilot.scheduler.timezone:UTC}") String timezone) {
        try {
            this.zone = ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid scheduler timezone: " + timezone, e);
        }
    }

    public ZoneId zone() { return zone; }

    public Optional<Instant> computeNextFire(String scheduleType, Map<String, Object> config, Instant reference) {
        return computeNextFire(requireType(scheduleType), config, reference);
    }

    public Optional<Instant> computeNextFire(ScheduleType type, Map<String, Object> config, Instant reference) {
        Map<String, Object> cfg = config != null ? config : Map.of();
        return switch (type) {
            case CRON -> {
                ZonedDateTime next = parseCron(cfg).next(reference.atZone(zone));
                yield Optional.ofNullable(next).map(ZonedDateTime::toInstant);
            }
            case INTERVAL -> {
                Interval interval = parseInterval(cfg);
                try {
                    yield Optional.of(reference.plus(interval.unit().times(interval.value())));
                } catch (ArithmeticException | DateTimeException e) {
                    throw new InvalidScheduleConfigException("Interval is too large: " + interval.value()
                            + " " + interval.unit().wireName(), e);
                }
            }
            case ONCE -> {
                Instant at = parseOnce(cfg);
                yield at.isAfter(reference) ? Optional.of(at) : Optional.empty();
            }
        };
    }

    /**
     * Parses the config without computing anything; throws on the same inputs
     * {@link #computeNextFire} would.
     */
    public void validate(String scheduleType, Map<String, Object> config) {
        validate(requireType(scheduleType), config);
    }

    public void validate(ScheduleType type, Map<String, Object> config) {
        Map<String, Object> cfg = config != null ? config : Map.of();
        switch (type) {
            case CRON -> parseCron(cfg);
            case INTERVAL -> parseInterval(cfg);
            case ONCE -> parseOnce(cfg);
        }
    }

    public static ScheduleType requireType(String scheduleType) {
        ScheduleType type = ScheduleType.fromWire(scheduleType);
        if (type == null) {
            throw new InvalidScheduleConfigException(
                    "Invalid schedule_type '" + scheduleType + "'. Must be one of: cron, interval, once");
        }
        return type;
    }

    private CronExpression parseCron(Map<String, Object> config) {
        Object raw = config.get("expression");
        if (!(raw instanceof String expression) || expression.isBlank()) {
            throw new InvalidScheduleConfigException("Cron schedule requires an 'expression'");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidScheduleConfigException("Cron expression must have 5 fields "
                    + "(minute hour day-of-month month day-of-week): '" + expression + "'");
        }
        try {
            // Seconds are always 0
            return CronExpression.parse("0 " + String.join(" ", fields));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleConfigException("Invalid cron expression '" + expression + "': "
                    + e.getMessage(), e);
        }
    }

    private Interval parseInterval(Map<String, Object> config) {
        Object rawValue = config.get("value");
        if (!(rawValue instanceof Number number)) {
            throw new InvalidScheduleConfigException("Interval schedule requires an integer 'value'");
        }
        long value;
        try {
            // Exact: rejects fractions and anything outside long range instead of truncating
            value = new BigDecimal(number.toString()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidScheduleConfigException("Interval value must be an integer within range: " + number);
        }
        if (value <= 0) {
            throw new InvalidScheduleConfigException("Interval value must be positive: " + value);
        }
        Object rawUnit = config.get("unit");
        IntervalUnit unit = IntervalUnit.fromWire(rawUnit != null ? rawUnit.toString() : null)
                .orElseThrow(() -> new InvalidScheduleConfigException("Invalid interval unit '" + rawUnit
                        + "'. Must be one of: seconds, minutes, hours, days, weeks"));
        return new Interval(value, unit);
    }

    private Instant parseOnce(Map<String, Object> config) {
        Object raw = config.get("datetime");
        if (raw == null) raw = config.get("run_at");
        if (!(raw instanceof String text) || text.isBlank()) {
            throw new InvalidScheduleConfigException("Once schedule requires a 'datetime'");
        }
        String iso = text.trim();
        if (iso.length() > 10 && iso.charAt(10) == ' ') {
            iso = iso.substring(0, 10) + 'T' + iso.substring(11);
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(iso,
                    ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeException e) {
            throw new InvalidScheduleConfigException("Invalid datetime '" + text + "': " + e.getMessage(), e);
        }
    }

    private record Interval(long value, IntervalUnit unit) {}
}
