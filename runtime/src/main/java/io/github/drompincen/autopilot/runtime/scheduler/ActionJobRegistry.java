package io.github.drompincen.autopilot.runtime.scheduler;

import io.github.drompincen.autopilot.persistence.document.ScheduledActionDocument;
import io.github.drompincen.autopilot.protocol.api.JobStatusDto;
import io.github.drompincen.autopilot.runtime.executor.ExecutionResult;
import io.github.drompincen.autopilot.runtime.executor.ExecutorRegistry;
import io.github.drompincen.autopilot.runtime.executor.UnknownActionTypeException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the live timers: at most one per enabled action, none for anything else.
 *
 * <p>Every change to the timer set happens under {@code lock}. Timers are one-shot; when
 * one fires its entry is removed and the id is marked in flight until the
 * {@link ExecutionPipeline} has written the run's bookkeeping, after which the action is
 * re-armed from the {@code nextRunAt} that run persisted. Reconciling an in-flight id only
 * marks it stale, so it is re-read from the store when the fire completes.
 */
@Service
public class ActionJobRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionJobRegistry.class);

    private final ScheduledActionStore store;
    private final ScheduleCalculator calculator;
    private final ExecutorRegistry executorRegistry;
    private final ExecutionPipeline pipeline;
    private final TaskScheduler timerScheduler;
    private final Executor workerPool;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, ArmedJob> armed = new HashMap<>();
    private final Set<String> inFlight = new HashSet<>();
    private final Set<String> staleWhileFiring = new HashSet<>();
    private long nextToken;
    private boolean shutdown;

    public ActionJobRegistry(ScheduledActionStore store,
                             ScheduleCalculator calculator,
                             ExecutorRegistry executorRegistry,
                             ExecutionPipeline pipeline,
                             TaskScheduler timerScheduler,
                             @Qualifier("actionWorkerPool") Executor workerPool,
                             Clock clock) {
        this.store = store;
        this.calculator = calculator;
        this.executorRegistry = executorRegistry;
        this.pipeline = pipeline;
        this.timerScheduler = timerScheduler;
        this.workerPool = workerPool;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("Starting action scheduler...");
        ReconcileReport report = reconcileAll();
        log.info("Action scheduler started ({})", report);
    }

    // Safety net for mutations that bypassed reconcileOne
    @Scheduled(fixedDelayString = "${autopilot.scheduler.reconcile-interval-ms:300000}",
            initialDelayString = "${autopilot.scheduler.reconcile-interval-ms:300000}")
    public void periodicSweep() {
        ReconcileReport report = reconcileAll();
        if (report.hasChanges() || !report.getFailures().isEmpty()) {
            log.info("Periodic reconcile: {}", report);
        }
    }

    /**
     * Brings the live timer set in line with every enabled action in the store.
     */
    public ReconcileReport reconcileAll() {
        ReconcileReport report = new ReconcileReport();
        synchronized (lock) {
            if (shutdown) return report;
            List<ScheduledActionDocument> enabled;
            try {
                enabled = store.listEnabled();
            } catch (RuntimeException e) {
                log.error("Reconcile aborted: could not list enabled actions", e);
                return report;
            }
            Map<String, ScheduledActionDocument> byId = new LinkedHashMap<>();
            for (ScheduledActionDocument action : enabled) {
                byId.put(action.getId(), action);
            }

            for (String actionId : new ArrayList<>(armed.keySet())) {
                if (!byId.containsKey(actionId)) {
                    disarmLocked(actionId);
                    clearStoredNextRun(actionId);
                    report.disarmed(actionId);
                }
            }
            for (String actionId : inFlight) {
                if (!byId.containsKey(actionId)) {
                    staleWhileFiring.add(actionId);
                    report.deferred(actionId);
                }
            }
            for (ScheduledActionDocument action : byId.values()) {
                applyLocked(action, report);
            }
        }
        log.debug("Reconciled all actions: {}", report);
        return report;
    }

    /**
     * Reconciles a single action; call after every create, update or toggle.
     */
    public ReconcileReport reconcileOne(String actionId) {
        ReconcileReport report = new ReconcileReport();
        synchronized (lock) {
            if (shutdown) return report;
            reconcileOneLocked(actionId, report);
        }
        log.debug("Reconciled action {}: {}", actionId, report);
        return report;
    }

    /**
     * Cancels the action's timer, if any. Used once the record has been deleted.
     */
    public boolean disarm(String actionId) {
        synchronized (lock) {
            if (inFlight.contains(actionId)) {
                staleWhileFiring.add(actionId);
            }
            return disarmLocked(actionId);
        }
    }

    /**
     * Executes the action immediately on the caller's thread, bypassing its timer.
     * The armed schedule and bookkeeping are left untouched.
     */
    public ExecutionResult runNow(String actionId) {
        return pipeline.test(actionId);
    }

    public Optional<JobStatusDto> jobStatus(String actionId) {
        synchronized (lock) {
            ArmedJob job = armed.get(actionId);
            if (job == null) return Optional.empty();
            return Optional.of(new JobStatusDto("action_" + actionId, job.name(), job.fireAt(),
                    job.fingerprint().describeTrigger()));
        }
    }

    public Set<String> armedIds() {
        synchronized (lock) {
            return Set.copyOf(armed.keySet());
        }
    }

    public boolean isArmed(String actionId) {
        synchronized (lock) {
            return armed.containsKey(actionId);
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            if (shutdown) return;
            shutdown = true;
            armed.values().forEach(job -> job.handle().cancel(false));
            log.info("Action scheduler stopped, cancelled {} timers", armed.size());
            armed.clear();
        }
    }

    // --- internals, all called with lock held ---

    private void reconcileOneLocked(String actionId, ReconcileReport report) {
        ScheduledActionDocument action;
        try {
            action = store.get(actionId).orElse(null);
        } catch (RuntimeException e) {
            log.error("Could not load action {} for reconcile", actionId, e);
            report.failed(actionId, "load failed: " + e.getMessage());
            return;
        }
        if (action == null || !action.isEnabled()) {
            if (inFlight.contains(actionId)) {
                staleWhileFiring.add(actionId);
            }
            disarmLocked(actionId);
            if (action != null && action.getNextRunAt() != null) {
                store.updateNextRun(actionId, null);
            }
            report.disarmed(actionId);
            return;
        }
        applyLocked(action, report);
    }

    private void applyLocked(ScheduledActionDocument action, ReconcileReport report) {
        String actionId = action.getId();
        if (inFlight.contains(actionId)) {
            staleWhileFiring.add(actionId);
            report.deferred(actionId);
            return;
        }
        ScheduleFingerprint fingerprint = ScheduleFingerprint.of(action);
        ArmedJob current = armed.get(actionId);
        if (current != null && current.fingerprint().equals(fingerprint)) {
            report.unchanged(actionId);
            return;
        }
        disarmLocked(actionId);

        try {
            executorRegistry.require(action.getActionType());
            Instant now = clock.instant();
            Instant reference = action.getLastRunAt() != null && action.getLastRunAt().isAfter(now)
                    ? action.getLastRunAt() : now;
            Optional<Instant> next = calculator.computeNextFire(
                    action.getScheduleType(), action.getScheduleConfig(), reference);
            if (next.isEmpty()) {
                log.info("Action '{}' ({}) has no upcoming run, leaving it disarmed", action.getName(), actionId);
                if (action.getNextRunAt() != null) {
                    store.updateNextRun(actionId, null);
                }
                report.disarmed(actionId);
                return;
            }
            armLocked(actionId, action.getName(), fingerprint, next.get());
            if (!next.get().equals(action.getNextRunAt())) {
                store.updateNextRun(actionId, next.get());
            }
            log.info("Scheduled action '{}' (ID: {}) - Next run: {}", action.getName(), actionId, next.get());
            report.armed(actionId);
        } catch (InvalidScheduleConfigException | UnknownActionTypeException e) {
            log.error("Cannot schedule action '{}' ({}, user={}): {}",
                    action.getName(), actionId, action.getOwnerId(), e.getMessage());
            disarmLocked(actionId);
            clearStoredNextRun(action);
            report.failed(actionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error scheduling action {}", actionId, e);
            disarmLocked(actionId);
            report.failed(actionId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void armLocked(String actionId, String name, ScheduleFingerprint fingerprint, Instant fireAt) {
        long token = ++nextToken;
        ScheduledFuture<?> handle = timerScheduler.schedule(() -> onTimer(actionId, token), fireAt);
        armed.put(actionId, new ArmedJob(name, fingerprint, fireAt, token, handle));
    }

    private boolean disarmLocked(String actionId) {
        ArmedJob job = armed.remove(actionId);
        if (job == null) return false;
        job.handle().cancel(false);
        log.info("Disarmed action {}", actionId);
        return true;
    }

    private void clearStoredNextRun(String actionId) {
        try {
            store.get(actionId).ifPresent(this::clearStoredNextRun);
        } catch (RuntimeException e) {
            log.warn("Could not clear next run of action {}: {}", actionId, e.getMessage());
        }
    }

    private void clearStoredNextRun(ScheduledActionDocument action) {
        if (action.getNextRunAt() == null) return;
        try {
            store.updateNextRun(action.getId(), null);
        } catch (RuntimeException e) {
            log.warn("Could not clear next run of action {}: {}", action.getId(), e.getMessage());
        }
    }

    // --- fire path ---

    private void onTimer(String actionId, long token) {
        ArmedJob job;
        synchronized (lock) {
            job = armed.get(actionId);
            if (shutdown || job == null || job.token() != token) {
                log.debug("Ignoring superseded timer for action {}", actionId);
                return;
            }
            armed.remove(actionId);
            inFlight.add(actionId);
        }
        try {
            workerPool.execute(() -> runFire(actionId, job));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected fire of action {}; it will be re-armed on the next reconcile", actionId);
            synchronized (lock) {
                inFlight.remove(actionId);
                staleWhileFiring.remove(actionId);
            }
        }
    }

    private void runFire(String actionId, ArmedJob job) {
        FireOutcome outcome = null;
        try {
            outcome = pipeline.fire(actionId);
        } catch (RuntimeException e) {
            log.error("Error in fire of action {}", actionId, e);
        } finally {
            afterFire(actionId, job, outcome);
        }
    }

    private void afterFire(String actionId, ArmedJob job, FireOutcome outcome) {
        synchronized (lock) {
            inFlight.remove(actionId);
            boolean stale = staleWhileFiring.remove(actionId);
            if (shutdown) return;
            try {
                if (stale || outcome == null || outcome.status() == FireOutcome.Status.SKIPPED) {
                    reconcileOneLocked(actionId, new ReconcileReport());
                } else if (outcome.nextRunAt() != null) {
                    armLocked(actionId, job.name(), job.fingerprint(), outcome.nextRunAt());
                    log.debug("Re-armed action {} for {}", actionId, outcome.nextRunAt());
                } else {
                    log.info("Action {} retired after firing", actionId);
                }
            } catch (RuntimeException e) {
                log.error("Could not re-arm action {} after firing", actionId, e);
            }
        }
    }

    private record ArmedJob(String name, ScheduleFingerprint fingerprint, Instant fireAt,
                            long token, ScheduledFuture<?> handle) {}

    /**
     * The parts of an action that decide when and what it fires. A change in any of
     * them forces the timer to be rebuilt.
     */
    record ScheduleFingerprint(String actionType, Map<String, Object> actionConfig,
                               String scheduleType, Map<String, Object> scheduleConfig) {

        static ScheduleFingerprint of(ScheduledActionDocument action) {
            return new ScheduleFingerprint(action.getActionType(), copy(action.getActionConfig()),
                    action.getScheduleType(), copy(action.getScheduleConfig()));
        }

        String describeTrigger() {
            return scheduleType + scheduleConfig;
        }

        private static Map<String, Object> copy(Map<String, Object> source) {
            return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
        }
    }
}
