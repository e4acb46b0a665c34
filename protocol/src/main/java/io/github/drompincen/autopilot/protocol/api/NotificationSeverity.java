package io.github.drompincen.autopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationSeverity {
    INFO, SUCCESS, WARNING, ERROR;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }

    /** Unknown or missing tags fall back to {@link #INFO}. */
    @JsonCreator
    public static NotificationSeverity fromWire(String value) {
        if (value == null || value.isBlank()) return INFO;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return INFO;
        }
    }
}
