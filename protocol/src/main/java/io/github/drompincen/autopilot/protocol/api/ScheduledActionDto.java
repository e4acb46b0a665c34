package io.github.drompincen.autopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record ScheduledActionDto(
        String id,
        @JsonProperty("user_id") String ownerId,
        String name,
        String description,
        @JsonProperty("action_type") String actionType,
        @JsonProperty("action_config") Map<String, Object> actionConfig,
        @JsonProperty("schedule_type") String scheduleType,
        @JsonProperty("schedule_config") Map<String, Object> scheduleConfig,
        boolean enabled,
        @JsonProperty("last_run_at") Instant lastRunAt,
        @JsonProperty("next_run_at") Instant nextRunAt,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {}
