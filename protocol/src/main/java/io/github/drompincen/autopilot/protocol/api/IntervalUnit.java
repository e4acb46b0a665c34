package io.github.drompincen.autopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

public enum IntervalUnit {
    SECONDS("seconds", Duration.ofSeconds(1)),
    MINUTES("minutes", Duration.ofMinutes(1)),
    HOURS("hours", Duration.ofHours(1)),
    DAYS("days", Duration.ofDays(1)),
    WEEKS("weeks", Duration.ofDays(7));

    private final String wireName;
    private final Duration unitDuration;

    IntervalUnit(String wireName, Duration unitDuration) {
        this.wireName = wireName;
        this.unitDuration = unitDuration;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public Duration times(long value) {
        return unitDuration.multipliedBy(value);
    }

    public static Optional<IntervalUnit> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(u -> u.wireName.equals(value.trim().toLowerCase()))
                .findFirst();
    }
}
