package io.github.drompincen.autopilot.runtime.scheduler;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * What one pipeline run did. {@code nextRunAt} is the value persisted with the run,
 * null when the action retired or was skipped.
 */
public record FireOutcome(
        String actionId,
        Status status,
        JsonNode output,
        String error,
        Instant nextRunAt
) {
    public enum Status { SKIPPED, SUCCEEDED, FAILED }

    public static FireOutcome skipped(String actionId, String reason) {
        return new FireOutcome(actionId, Status.SKIPPED, null, reason, null);
    }

    public static FireOutcome succeeded(String actionId, JsonNode output, Instant nextRunAt) {
        return new FireOutcome(actionId, Status.SUCCEEDED, output, null, nextRunAt);
    }

    public static FireOutcome failed(String actionId, String error, Instant nextRunAt) {
        return new FireOutcome(actionId, Status.FAILED, null, error, nextRunAt);
    }
}
