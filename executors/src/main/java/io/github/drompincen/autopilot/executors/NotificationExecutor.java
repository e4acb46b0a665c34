package io.github.drompincen.autopilot.executors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.autopilot.persistence.document.NotificationDocument;
import io.github.drompincen.autopilot.protocol.api.ActionTypes;
import io.github.drompincen.autopilot.protocol.api.NotificationActionConfig;
import io.github.drompincen.autopilot.runtime.executor.*;
import io.github.drompincen.autopilot.runtime.notification.NotificationRejectedException;
import io.github.drompincen.autopilot.runtime.notification.NotificationService;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class NotificationExecutor implements ActionExecutor {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final NotificationService notificationService;

    public NotificationExecutor(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Override public String actionType() { return ActionTypes.NOTIFICATION; }

    @Override
    public ExecutionResult execute(Map<String, Object> config, ExecutionContext ctx) {
        NotificationActionConfig cfg = ExecutorConfigs.read(config, NotificationActionConfig.class);
        NotificationDocument sent;
        try {
            sent = notificationService.deliver(ctx.ownerId(), cfg.titleOrDefault(), cfg.messageOrDefault(),
                    cfg.severityOrDefault(), ctx.actionId());
        } catch (NotificationRejectedException e) {
            throw new ExecutionFailedException("Notification rejected: " + e.getMessage(), e);
        }

        ObjectNode output = MAPPER.createObjectNode();
        output.put("status", "success");
        output.put("title", cfg.titleOrDefault());
        output.put("message", cfg.messageOrDefault());
        output.put("type", cfg.severityOrDefault().wireName());
        output.put("notification_id", sent != null ? sent.getNotificationId() : null);
        return ExecutionResult.of(output);
    }
}
