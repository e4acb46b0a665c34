package io.github.drompincen.autopilot.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

public record TestRunResponse(
        String status,
        JsonNode result,
        String error
) {
    public static TestRunResponse success(JsonNode result) {
        return new TestRunResponse("success", result, null);
    }

    public static TestRunResponse failure(String error) {
        return new TestRunResponse("error", null, error);
    }
}
