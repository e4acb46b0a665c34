package io.github.drompincen.autopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ScheduleType {
    CRON("cron"),
    INTERVAL("interval"),
    ONCE("once");

    private final String wireName;

    ScheduleType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public boolean isRecurring() { return this != ONCE; }

    /**
     * Resolves the lowercase tag used on the wire and in storage.
     * Returns null for an unknown tag so callers can report it with context.
     */
    @JsonCreator
    public static ScheduleType fromWire(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(null);
    }
}
