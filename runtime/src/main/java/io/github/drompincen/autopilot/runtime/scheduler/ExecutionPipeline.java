package io.github.drompincen.autopilot.runtime.scheduler;

import io.github.drompincen.autopilot.persistence.document.ScheduledActionDocument;
import io.github.drompincen.autopilot.protocol.api.ScheduleType;
import io.github.drompincen.autopilot.runtime.executor.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Runs a single firing of an action to completion and writes its bookkeeping.
 * Never throws for executor failures; those are logged and reported in the outcome.
 */
@Service
public class ExecutionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPipeline.class);

    private final ScheduledActionStore store;
    private final ExecutorRegistry executorRegistry;
    private final ScheduleCalculator calculator;
    private final Clock clock;

    public ExecutionPipeline(ScheduledActionStore store,
                             ExecutorRegistry executorRegistry,
                             ScheduleCalculator calculator,
                             Clock clock) {
        this.store = store;
        this.executorRegistry = executorRegistry;
        this.calculator = calculator;
        this.clock = clock;
    }

    public FireOutcome fire(String actionId) {
        // Reload: the config captured at arm time may be stale
        ScheduledActionDocument action = store.get(actionId).orElse(null);
        if (action == null) {
            log.warn("Action {} not found, skipping fire", actionId);
            return FireOutcome.skipped(actionId, "action not found");
        }
        if (!action.isEnabled()) {
            log.info("Action {} is disabled, skipping fire", actionId);
            return FireOutcome.skipped(actionId, "action disabled");
        }

        log.info("Executing scheduled action: {} (id={}, type={}, user={})",
                action.getName(), actionId, action.getActionType(), action.getOwnerId());

        ExecutionResult result = null;
        String error = null;
        try {
            result = invoke(action, clock.instant(), false);
        } catch (UnknownActionTypeException | ExecutionFailedException e) {
            error = e.getMessage();
            log.error("Action {} failed (type={}, user={}): {}",
                    actionId, action.getActionType(), action.getOwnerId(), error);
        } catch (RuntimeException e) {
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Action {} failed unexpectedly (type={}, user={})",
                    actionId, action.getActionType(), action.getOwnerId(), e);
        }

        Instant finishedAt = clock.instant();
        Instant nextRunAt = null;
        Boolean enabled = null;
        ScheduleType scheduleType = ScheduleType.fromWire(action.getScheduleType());
        if (scheduleType == ScheduleType.ONCE) {
            enabled = false;
        } else if (scheduleType != null) {
            try {
                nextRunAt = calculator.computeNextFire(scheduleType, action.getScheduleConfig(), finishedAt)
                        .orElse(null);
            } catch (InvalidScheduleConfigException e) {
                log.error("Action {} has an invalid schedule and will not re-arm: {}", actionId, e.getMessage());
            }
        } else {
            log.error("Action {} has unknown schedule type '{}' and will not re-arm",
                    actionId, action.getScheduleType());
        }

        // Every attempt is recorded, success or not
        try {
            if (!store.recordRun(actionId, finishedAt, nextRunAt, enabled)) {
                log.warn("Action {} was deleted while running; run not recorded", actionId);
            }
        } catch (RuntimeException e) {
            log.error("Failed to record run of action {}", actionId, e);
        }

        if (scheduleType == ScheduleType.ONCE) {
            log.info("One-time action {} completed and disabled", actionId);
        }
        if (error != null) {
            return FireOutcome.failed(actionId, error, nextRunAt);
        }
        log.info("Action {} succeeded, next run: {}", actionId, nextRunAt != null ? nextRunAt : "none");
        return FireOutcome.succeeded(actionId, result != null ? result.output() : null, nextRunAt);
    }

    /**
     * On-demand run that ignores the enabled flag and writes no bookkeeping.
     *
     * @throws ActionNotFoundException     if the action does not exist
     * @throws UnknownActionTypeException  if no executor handles the action type
     * @throws ExecutionFailedException    if the executor fails
     */
    public ExecutionResult test(String actionId) {
        ScheduledActionDocument action = store.get(actionId)
                .orElseThrow(() -> new ActionNotFoundException(actionId));
        log.info("Test run of action {} (type={}, user={})", actionId, action.getActionType(), action.getOwnerId());
        return invoke(action, clock.instant(), true);
    }

    private ExecutionResult invoke(ScheduledActionDocument action, Instant firedAt, boolean testRun) {
        ActionExecutor executor = executorRegistry.require(action.getActionType());
        ExecutionContext ctx = new ExecutionContext(action.getOwnerId(), action.getId(),
                action.getName(), firedAt, testRun);
        Map<String, Object> config = action.getActionConfig() != null ? action.getActionConfig() : Map.of();
        return executor.execute(config, ctx);
    }
}
