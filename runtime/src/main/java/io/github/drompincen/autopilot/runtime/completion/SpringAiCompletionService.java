package io.github.drompincen.autopilot.runtime.completion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Completion backed by whichever Spring AI {@link ChatModel} is configured. The model id
 * from the action config is passed per request through {@link ChatOptions}.
 */
@Service
public class SpringAiCompletionService implements CompletionService {

    private static final Logger log = LoggerFactory.getLogger(SpringAiCompletionService.class);

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final Set<String> models;

    public SpringAiCompletionService(ObjectProvider<ChatModel> chatModelProvider,
                                     @Value("${autopilot.completion.models:gpt-4o,gpt-4o-mini}") String[] models) {
        this.chatModelProvider = chatModelProvider;
        Set<String> configured = new LinkedHashSet<>();
        for (String m : models) {
            if (!m.isBlank()) configured.add(m.trim());
        }
        this.models = Collections.unmodifiableSet(configured);
        log.info("Completion models available: {}", this.models);
    }

    @Override
    public Set<String> availableModels() {
        return models;
    }

    @Override
    public String complete(String model, String systemPrompt, String prompt) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new IllegalStateException("No chat model is configured");
        }
        List<Message> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new SystemMessage(systemPrompt));
        }
        messages.add(new UserMessage(prompt));

        ChatResponse response = chatModel.call(new Prompt(messages, ChatOptions.builder().model(model).build()));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new IllegalStateException("Model " + model + " returned no output");
        }
        String text = response.getResult().getOutput().getText();
        return text != null ? text : "";
    }
}
