package io.github.drompincen.autopilot.executors;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.autopilot.runtime.executor.ExecutionFailedException;

import java.util.Map;

final class ExecutorConfigs {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ExecutorConfigs() {}

    static <T> T read(Map<String, Object> config, Class<T> type) {
        try {
            return MAPPER.convertValue(config != null ? config : Map.of(), type);
        } catch (IllegalArgumentException e) {
            throw new ExecutionFailedException("Invalid action_config: " + e.getMessage(), e);
        }
    }
}
