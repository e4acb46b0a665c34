package io.github.drompincen.autopilot.gateway.controller;

import io.github.drompincen.autopilot.persistence.document.ScheduledActionDocument;
import io.github.drompincen.autopilot.protocol.api.*;
import io.github.drompincen.autopilot.runtime.action.ScheduledActionService;
import io.github.drompincen.autopilot.runtime.executor.ExecutionFailedException;
import io.github.drompincen.autopilot.runtime.executor.ExecutionResult;
import io.github.drompincen.autopilot.runtime.scheduler.ActionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Caller identity comes from the {@code X-User-Id} header; {@code X-User-Role: admin}
 * grants access to every owner's actions.
 */
@RestController
@RequestMapping("/api/scheduled-actions")
public class ScheduledActionController {

    private static final Logger log = LoggerFactory.getLogger(ScheduledActionController.class);
    static final String USER_HEADER = "X-User-Id";
    static final String ROLE_HEADER = "X-User-Role";

    private final ScheduledActionService actionService;

    public ScheduledActionController(ScheduledActionService actionService) {
        this.actionService = actionService;
    }

    @GetMapping
    public List<ScheduledActionDto> listOwn(@RequestHeader(USER_HEADER) String userId) {
        return actionService.list(userId).stream().map(this::toDto).toList();
    }

    @GetMapping("/all")
    public ResponseEntity<?> listAll(@RequestHeader(USER_HEADER) String userId,
                                     @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        if (!isAdmin(role)) {
            return error(HttpStatus.FORBIDDEN, "Access denied");
        }
        return ResponseEntity.ok(actionService.listAll().stream().map(this::toDto).toList());
    }

    @GetMapping("/{actionId}")
    public ResponseEntity<?> get(@PathVariable String actionId,
                                 @RequestHeader(USER_HEADER) String userId,
                                 @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        return withAccess(actionId, userId, role, () -> ResponseEntity.ok(toDto(actionService.get(actionId).orElseThrow(
                () -> new ActionNotFoundException(actionId)))));
    }

    @PostMapping("/create")
    public ResponseEntity<?> create(@RequestHeader(USER_HEADER) String userId,
                                    @RequestBody ScheduledActionRequest req) {
        try {
            return ResponseEntity.ok(toDto(actionService.create(userId, req)));
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error creating scheduled action for {}", userId, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @PostMapping("/{actionId}/update")
    public ResponseEntity<?> update(@PathVariable String actionId,
                                    @RequestHeader(USER_HEADER) String userId,
                                    @RequestHeader(value = ROLE_HEADER, required = false) String role,
                                    @RequestBody ScheduledActionUpdateRequest req) {
        return withAccess(actionId, userId, role, () -> ResponseEntity.ok(toDto(actionService.update(actionId, req))));
    }

    @PostMapping("/{actionId}/toggle")
    public ResponseEntity<?> toggle(@PathVariable String actionId,
                                    @RequestHeader(USER_HEADER) String userId,
                                    @RequestHeader(value = ROLE_HEADER, required = false) String role,
                                    @RequestBody ToggleRequest req) {
        return withAccess(actionId, userId, role,
                () -> ResponseEntity.ok(toDto(actionService.toggle(actionId, req.enabled()))));
    }

    @DeleteMapping("/{actionId}")
    public ResponseEntity<?> delete(@PathVariable String actionId,
                                    @RequestHeader(USER_HEADER) String userId,
                                    @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        return withAccess(actionId, userId, role, () -> {
            actionService.delete(actionId);
            return ResponseEntity.ok(true);
        });
    }

    @PostMapping("/{actionId}/test")
    public ResponseEntity<?> test(@PathVariable String actionId,
                                  @RequestHeader(USER_HEADER) String userId,
                                  @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        return withAccess(actionId, userId, role, () -> {
            try {
                ExecutionResult result = actionService.test(actionId);
                return ResponseEntity.ok(TestRunResponse.success(result.output()));
            } catch (ExecutionFailedException e) {
                log.warn("Test run of action {} failed: {}", actionId, e.getMessage());
                return ResponseEntity.ok(TestRunResponse.failure(e.getMessage()));
            }
        });
    }

    @GetMapping("/{actionId}/status")
    public ResponseEntity<?> status(@PathVariable String actionId,
                                    @RequestHeader(USER_HEADER) String userId,
                                    @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        return withAccess(actionId, userId, role, () -> actionService.jobStatus(actionId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> error(HttpStatus.NOT_FOUND, "Action is not scheduled")));
    }

    // --- helpers ---

    private ResponseEntity<?> withAccess(String actionId, String userId, String role,
                                         Supplier<ResponseEntity<?>> body) {
        try {
            Optional<ScheduledActionDocument> action = actionService.get(actionId);
            if (action.isEmpty()) {
                return error(HttpStatus.NOT_FOUND, "Scheduled action not found");
            }
            if (!userId.equals(action.get().getOwnerId()) && !isAdmin(role)) {
                return error(HttpStatus.FORBIDDEN, "Access denied");
            }
            return body.get();
        } catch (ActionNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, "Scheduled action not found");
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error handling scheduled action {}", actionId, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private static boolean isAdmin(String role) {
        return "admin".equalsIgnoreCase(role);
    }

    private static ResponseEntity<?> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }

    private ScheduledActionDto toDto(ScheduledActionDocument doc) {
        return new ScheduledActionDto(doc.getId(), doc.getOwnerId(), doc.getName(), doc.getDescription(),
                doc.getActionType(), doc.getActionConfig(), doc.getScheduleType(), doc.getScheduleConfig(),
                doc.isEnabled(), doc.getLastRunAt(), doc.getNextRunAt(), doc.getCreatedAt(), doc.getUpdatedAt());
    }
}
