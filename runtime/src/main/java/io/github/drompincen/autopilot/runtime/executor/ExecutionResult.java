package io.github.drompincen.autopilot.runtime.executor;

import com.fasterxml.jackson.databind.JsonNode;

public record ExecutionResult(JsonNode output) {

    public static ExecutionResult of(JsonNode output) {
        return new ExecutionResult(output);
    }
}
