package io.github.drompincen.autopilot.executors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.autopilot.protocol.api.ActionTypes;
import io.github.drompincen.autopilot.protocol.api.ChatCompletionActionConfig;
import io.github.drompincen.autopilot.runtime.completion.CompletionService;
import io.github.drompincen.autopilot.runtime.executor.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeSet;

@Component
public class ChatCompletionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionExecutor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CompletionService completionService;
    private final ActionFollowUp followUp;

    public ChatCompletionExecutor(CompletionService completionService, ActionFollowUp followUp) {
        this.completionService = completionService;
        this.followUp = followUp;
    }

    @Override public String actionType() { return ActionTypes.CHAT_COMPLETION; }

    @Override
    public ExecutionResult execute(Map<String, Object> config, ExecutionContext ctx) {
        ChatCompletionActionConfig cfg = ExecutorConfigs.read(config, ChatCompletionActionConfig.class);
        try {
            ExecutionResult result = complete(cfg, ctx);
            if (cfg.notifyOwner()) {
                followUp.notifyCompleted(ctx, "success");
            }
            return result;
        } catch (ExecutionFailedException e) {
            if (cfg.notifyOwner()) {
                followUp.notifyCompleted(ctx, "error");
            }
            throw e;
        }
    }

    private ExecutionResult complete(ChatCompletionActionConfig cfg, ExecutionContext ctx) {
        if (cfg.prompt() == null || cfg.prompt().isBlank()) {
            throw new ExecutionFailedException("No prompt provided");
        }
        if (cfg.model() == null || cfg.model().isBlank()) {
            throw new ExecutionFailedException("No model provided");
        }
        if (!completionService.availableModels().contains(cfg.model())) {
            throw new ExecutionFailedException("Model '" + cfg.model() + "' not available. Available: "
                    + new TreeSet<>(completionService.availableModels()));
        }

        String response;
        try {
            response = completionService.complete(cfg.model(), cfg.systemPrompt(), cfg.prompt());
        } catch (RuntimeException e) {
            throw new ExecutionFailedException("Chat completion failed: " + e.getMessage(), e);
        }
        log.info("Chat completion with {} returned {} chars (action={})",
                cfg.model(), response.length(), ctx.actionId());

        if (cfg.saveToMemory()) {
            followUp.remember(ctx, "Automated chat:\nQ: " + cfg.prompt() + "\nA: " + response, "scheduled-chat");
        }
        ObjectNode output = MAPPER.createObjectNode();
        output.put("status", "success");
        output.put("model", cfg.model());
        output.put("prompt", cfg.prompt());
        output.put("response", response);
        return ExecutionResult.of(output);
    }
}
