package io.github.drompincen.autopilot.runtime.executor;

import io.github.drompincen.autopilot.protocol.api.NotificationSeverity;
import io.github.drompincen.autopilot.runtime.memory.MemoryService;
import io.github.drompincen.autopilot.runtime.notification.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Optional steps executors run around their main side effect. Failures here
 * are logged and never fail the action.
 */
@Component
public class ActionFollowUp {

    private static final Logger log = LoggerFactory.getLogger(ActionFollowUp.class);

    private final MemoryService memoryService;
    private final NotificationService notificationService;

    public ActionFollowUp(MemoryService memoryService, NotificationService notificationService) {
        this.memoryService = memoryService;
        this.notificationService = notificationService;
    }

    public void remember(ExecutionContext ctx, String content, String tag) {
        try {
            memoryService.remember(ctx.ownerId(), content, ctx.actionId(), List.of(tag));
        } catch (RuntimeException e) {
            log.warn("Failed to save memory for action {} (owner={}): {}",
                    ctx.actionId(), ctx.ownerId(), e.getMessage());
        }
    }

    public void notifyCompleted(ExecutionContext ctx, String status) {
        try {
            notificationService.deliver(ctx.ownerId(),
                    "Scheduled Action Complete: " + ctx.actionName(),
                    "Status: " + status,
                    "success".equals(status) ? NotificationSeverity.SUCCESS : NotificationSeverity.WARNING,
                    ctx.actionId());
        } catch (RuntimeException e) {
            log.warn("Failed to send completion notification for action {} (owner={}): {}",
                    ctx.actionId(), ctx.ownerId(), e.getMessage());
        }
    }
}
