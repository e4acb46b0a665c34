package io.github.drompincen.autopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionActionConfig(
        String model,
        String prompt,
        @JsonProperty("system_prompt") String systemPrompt,
        @JsonProperty("save_to_memory") boolean saveToMemory,
        @JsonProperty("notify") boolean notifyOwner
) {}
