package io.github.drompincen.autopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Partial update: every null component leaves the stored value unchanged.
 */
public record ScheduledActionUpdateRequest(
        String name,
        String description,
        @JsonProperty("action_config") Map<String, Object> actionConfig,
        @JsonProperty("schedule_type") String scheduleType,
        @JsonProperty("schedule_config") Map<String, Object> scheduleConfig,
        Boolean enabled
) {}
