package io.github.drompincen.autopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record JobStatusDto(
        String id,
        String name,
        @JsonProperty("next_run_time") Instant nextRunTime,
        String trigger
) {}
