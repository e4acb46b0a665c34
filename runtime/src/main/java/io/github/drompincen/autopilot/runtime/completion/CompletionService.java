package io.github.drompincen.autopilot.runtime.completion;

import java.util.Set;

public interface CompletionService {

    /** Model identifiers that may be requested from {@link #complete}. */
    Set<String> availableModels();

    /**
     * Returns the assistant's reply. {@code systemPrompt} may be null.
     */
    String complete(String model, String systemPrompt, String prompt);
}
