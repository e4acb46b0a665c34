package io.github.drompincen.autopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebSearchActionConfig(
        String query,
        String engine,
        @JsonProperty("max_results") Integer maxResults,
        @JsonProperty("save_to_memory") boolean saveToMemory,
        @JsonProperty("notify") boolean notifyOwner
) {
    public static final int DEFAULT_MAX_RESULTS = 10;

    public int maxResultsOrDefault() {
        return maxResults != null && maxResults > 0 ? maxResults : DEFAULT_MAX_RESULTS;
    }
}
