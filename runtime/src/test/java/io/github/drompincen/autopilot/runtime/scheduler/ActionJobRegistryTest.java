package io.github.drompincen.autopilot.runtime.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.autopilot.persistence.document.ScheduledActionDocument;
import io.github.drompincen.autopilot.protocol.api.JobStatusDto;
import io.github.drompincen.autopilot.runtime.executor.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ActionJobRegistryTest {

    private static final Instant T0 = Instant.parse("2025-10-13T08:00:00Z");

    @Mock private TaskScheduler taskScheduler;

    private final List<Timer> timers = new ArrayList<>();
    private final List<Runnable> workerQueue = new ArrayList<>();
    private InMemoryActionStore store;
    private MutableClock clock;
    private RecordingExecutor executor;
    private ActionJobRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryActionStore();
        clock = new MutableClock(T0);
        executor = new RecordingExecutor();
        ScheduleCalculator calculator = new ScheduleCalculator("UTC");
        ExecutorRegistry executorRegistry = new ExecutorRegistry(List.of(executor));
        ExecutionPipeline pipeline = new ExecutionPipeline(store, executorRegistry, calculator, clock);

        when(taskScheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(inv -> {
            ScheduledFuture<?> handle = mock(ScheduledFuture.class);
            timers.add(new Timer(inv.getArgument(0), inv.getArgument(1), handle));
            return handle;
        });

        registry = new ActionJobRegistry(store, calculator, executorRegistry, pipeline,
                taskScheduler, workerQueue::add, clock);
    }

    @Test
    void reconcileArmsEnabledCronAction() {
        store.put(InMemoryActionStore.action("a1", "notification", "cron", Map.of("expression", "0 9 * * *")));

        ReconcileReport report = registry.reconcileAll();

        assertThat(report.getArmed()).containsExactly("a1");
        assertThat(registry.isArmed("a1")).isTrue();
        assertThat(lastTimer().fireAt()).isEqualTo(Instant.parse("2025-10-13T09:00:00Z"));
        assertThat(store.actions.get("a1").getNextRunAt()).isEqualTo(Instant.parse("2025-10-13T09:00:00Z"));
    }

    @Test
    void reconcileIsIdempotent() {
        store.put(InMemoryActionStore.action("a1", "notification", "interval", Map.of("value", 5, "unit", "minutes")));
        registry.reconcileAll();

        ReconcileReport second = registry.reconcileAll();

        assertThat(second.getUnchanged()).containsExactly("a1");
        assertThat(second.hasChanges()).isFalse();
        assertThat(timers).hasSize(1);
        verify(timers.get(0).handle(), never()).cancel(anyBoolean());
    }

    @Test
    void changedScheduleReplacesTimer() {
        ScheduledActionDocument action = InMemoryActionStore.action("a1", "notification", "interval",
                Map.of("value", 5, "unit", "minutes"));
        store.put(action);
        registry.reconcileAll();

        action.setScheduleConfig(Map.of("value", 2, "unit", "hours"));
        ReconcileReport report = registry.reconcileOne("a1");

        assertThat(report.getArmed()).containsExactly("a1");
        verify(timers.get(0).handle()).cancel(false);
        assertThat(lastTimer().fireAt()).isEqualTo(T0.plus(Duration.ofHours(2)));
        assertThat(registry.armedIds()).containsExactly("a1");
    }

    @Test
    void disableCancelsAndReenableRearmsFromNow() {
        ScheduledActionDocument action = InMemoryActionStore.action("a1", "notification", "cron",
                Map.of("expression", "0 9 * * *"));
        store.put(action);
        registry.reconcileAll();
        Timer first = lastTimer();

        action.setEnabled(false);
        ReconcileReport disabled = registry.reconcileAll();

        assertThat(disabled.getDisarmed()).containsExactly("a1");
        verify(first.handle()).cancel(false);
        assertThat(registry.isArmed("a1")).isFalse();
        assertThat(action.getNextRunAt()).isNull();

        clock.set(Instant.parse("2025-10-13T10:30:00Z"));
        action.setEnabled(true);
        registry.reconcileOne("a1");

        assertThat(registry.isArmed("a1")).isTrue();
        assertThat(action.getNextRunAt()).isEqualTo(Instant.parse("2025-10-14T09:00:00Z"));
    }

    @Test
    void deletedActionIsNotRearmedBySweep() {
        store.put(InMemoryActionStore.action("a1", "notification", "cron", Map.of("expression", "0 9 * * *")));
        registry.reconcileAll();
        Timer armed = lastTimer();

        store.actions.remove("a1");
        registry.disarm("a1");
        ReconcileReport sweep = registry.reconcileAll();

        assertThat(sweep.hasChanges()).isFalse();
        assertThat(registry.armedIds()).isEmpty();
        assertThat(registry.jobStatus("a1")).isEmpty();
        verify(armed.handle()).cancel(false);
        assertThat(timers).hasSize(1);
    }

    @Test
    void sweepBeforeDisarmOfDeletedActionIsUndone() {
        store.put(InMemoryActionStore.action("a1", "notification", "cron", Map.of("expression", "0 9 * * *")));
        registry.reconcileAll();

        store.actions.remove("a1");
        registry.reconcileAll();
        registry.disarm("a1");

        assertThat(registry.isArmed("a1")).isFalse();
    }

    @Test
    void pastOnceActionStaysDisarmed() {
        clock.set(Instant.parse("2025-10-14T00:00:00Z"));
        store.put(InMemoryActionStore.action("a1", "notification", "once",
                Map.of("datetime", "2025-10-13T09:00:00Z")));

        ReconcileReport report = registry.reconcileAll();

        assertThat(report.getDisarmed()).containsExactly("a1");
        assertThat(registry.isArmed("a1")).isFalse();
        assertThat(timers).isEmpty();
    }

    @Test
    void invalidScheduleDoesNotAbortSweep() {
        store.put(InMemoryActionStore.action("bad", "notification", "cron", Map.of("expression", "not a cron")));
        store.put(InMemoryActionStore.action("good", "notification", "interval", Map.of("value", 1, "unit", "hours")));
        store.put(InMemoryActionStore.action("odd", "fax", "interval", Map.of("value", 1, "unit", "hours")));

        ReconcileReport report = registry.reconcileAll();

        assertThat(report.getArmed()).containsExactly("good");
        assertThat(report.getFailures()).containsOnlyKeys("bad", "odd");
        assertThat(report.getFailures().get("odd")).contains("fax");
        assertThat(registry.armedIds()).containsExactly("good");
    }

    @Test
    void fireRecordsRunAndRearmsFromCompletion() {
        store.put(InMemoryActionStore.action("a1", "notification", "interval", Map.of("value", 60, "unit", "minutes")));
        registry.reconcileAll();

        clock.set(T0.plus(Duration.ofMinutes(60)));
        fire(lastTimer());

        ScheduledActionDocument action = store.actions.get("a1");
        assertThat(executor.contexts).hasSize(1);
        assertThat(executor.contexts.get(0).testRun()).isFalse();
        assertThat(action.getLastRunAt()).isEqualTo(T0.plus(Duration.ofMinutes(60)));
        assertThat(action.getNextRunAt()).isEqualTo(T0.plus(Duration.ofMinutes(120)));
        assertThat(lastTimer().fireAt()).isEqualTo(T0.plus(Duration.ofMinutes(120)));
        assertThat(registry.isArmed("a1")).isTrue();
    }

    @Test
    void failingExecutorStillRecordsAndRearms() {
        executor.failWith = new ExecutionFailedException("boom");
        store.put(InMemoryActionStore.action("a1", "notification", "interval", Map.of("value", 10, "unit", "minutes")));
        registry.reconcileAll();

        clock.set(T0.plus(Duration.ofMinutes(10)));
        fire(lastTimer());

        ScheduledActionDocument action = store.actions.get("a1");
        assertThat(action.getLastRunAt()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
        assertThat(action.getNextRunAt()).isEqualTo(T0.plus(Duration.ofMinutes(20)));
        assertThat(registry.isArmed("a1")).isTrue();
    }

    @Test
    void onceActionRetiresAfterFiring() {
        store.put(InMemoryActionStore.action("a1", "notification", "once", Map.of("datetime", "2025-10-13T09:00:00Z")));
        registry.reconcileAll();

        clock.set(Instant.parse("2025-10-13T09:00:00Z"));
        fire(lastTimer());

        ScheduledActionDocument action = store.actions.get("a1");
        assertThat(executor.contexts).hasSize(1);
        assertThat(action.isEnabled()).isFalse();
        assertThat(action.getNextRunAt()).isNull();
        assertThat(registry.isArmed("a1")).isFalse();
        assertThat(timers).hasSize(1);
    }

    @Test
    void disarmedTimerIsIgnoredIfItStillRuns() {
        store.put(InMemoryActionStore.action("a1", "notification", "interval", Map.of("value", 1, "unit", "minutes")));
        registry.reconcileAll();
        Timer timer = lastTimer();

        assertThat(registry.disarm("a1")).isTrue();
        store.actions.remove("a1");
        fire(timer);

        verify(timer.handle()).cancel(false);
        assertThat(executor.contexts).isEmpty();
        assertThat(registry.disarm("a1")).isFalse();
    }

    @Test
    void supersededTimerDoesNotFire() {
        ScheduledActionDocument action = InMemoryActionStore.action("a1", "notification", "interval",
                Map.of("value", 1, "unit", "minutes"));
        store.put(action);
        registry.reconcileAll();
        Timer old = lastTimer();
        action.setScheduleConfig(Map.of("value", 5, "unit", "minutes"));
        registry.reconcileOne("a1");

        fire(old);

        assertThat(executor.contexts).isEmpty();
        assertThat(registry.isArmed("a1")).isTrue();
    }

    @Test
    void reconcileDuringFireIsDeferredUntilCompletion() {
        ScheduledActionDocument action = InMemoryActionStore.action("a1", "notification", "interval",
                Map.of("value", 60, "unit", "minutes"));
        store.put(action);
        registry.reconcileAll();
        clock.set(T0.plus(Duration.ofMinutes(60)));
        lastTimer().task().run();
        assertThat(workerQueue).hasSize(1);

        action.setScheduleConfig(Map.of("value", 30, "unit", "minutes"));
        ReconcileReport report = registry.reconcileOne("a1");
        assertThat(report.getDeferred()).containsExactly("a1");
        assertThat(registry.isArmed("a1")).isFalse();

        drainWorkers();

        assertThat(action.getNextRunAt()).isEqualTo(T0.plus(Duration.ofMinutes(90)));
        assertThat(lastTimer().fireAt()).isEqualTo(T0.plus(Duration.ofMinutes(90)));
        assertThat(registry.isArmed("a1")).isTrue();
    }

    @Test
    void disableDuringFireLeavesActionDisarmed() {
        ScheduledActionDocument action = InMemoryActionStore.action("a1", "notification", "interval",
                Map.of("value", 60, "unit", "minutes"));
        store.put(action);
        registry.reconcileAll();
        clock.set(T0.plus(Duration.ofMinutes(60)));
        lastTimer().task().run();

        action.setEnabled(false);
        registry.reconcileOne("a1");
        drainWorkers();

        assertThat(registry.isArmed("a1")).isFalse();
        assertThat(action.getNextRunAt()).isNull();
    }

    @Test
    void runNowOnDisabledActionLeavesBookkeepingAlone() {
        ScheduledActionDocument action = InMemoryActionStore.action("a1", "notification", "cron",
                Map.of("expression", "0 9 * * *"));
        action.setEnabled(false);
        action.setNextRunAt(null);
        store.put(action);

        ExecutionResult result = registry.runNow("a1");

        assertThat(result.output().get("ran").asBoolean()).isTrue();
        assertThat(executor.contexts).hasSize(1);
        assertThat(executor.contexts.get(0).testRun()).isTrue();
        assertThat(action.isEnabled()).isFalse();
        assertThat(action.getNextRunAt()).isNull();
        assertThat(action.getLastRunAt()).isNull();
        assertThat(store.recordRunCalls).isZero();
        assertThat(timers).isEmpty();
    }

    @Test
    void jobStatusDescribesArmedTimer() {
        store.put(InMemoryActionStore.action("a1", "notification", "cron", Map.of("expression", "0 9 * * *")));
        registry.reconcileAll();

        JobStatusDto status = registry.jobStatus("a1").orElseThrow();

        assertThat(status.id()).isEqualTo("action_a1");
        assertThat(status.name()).isEqualTo("action a1");
        assertThat(status.nextRunTime()).isEqualTo(Instant.parse("2025-10-13T09:00:00Z"));
        assertThat(status.trigger()).contains("cron").contains("0 9 * * *");
        assertThat(registry.jobStatus("missing")).isEmpty();
    }

    @Test
    void shutdownCancelsTimersAndStopsReconciling() {
        store.put(InMemoryActionStore.action("a1", "notification", "interval", Map.of("value", 1, "unit", "hours")));
        registry.reconcileAll();

        registry.shutdown();

        verify(lastTimer().handle()).cancel(false);
        assertThat(registry.armedIds()).isEmpty();
        assertThat(registry.reconcileAll().hasChanges()).isFalse();
    }

    // --- helpers ---

    private Timer lastTimer() {
        assertThat(timers).isNotEmpty();
        return timers.get(timers.size() - 1);
    }

    private void fire(Timer timer) {
        timer.task().run();
        drainWorkers();
    }

    private void drainWorkers() {
        while (!workerQueue.isEmpty()) {
            workerQueue.remove(0).run();
        }
    }

    private record Timer(Runnable task, Instant fireAt, ScheduledFuture<?> handle) {}

    static class RecordingExecutor implements ActionExecutor {
        final List<ExecutionContext> contexts = new ArrayList<>();
        RuntimeException failWith;

        @Override public String actionType() { return "notification"; }

        @Override
        public ExecutionResult execute(Map<String, Object> config, ExecutionContext context) {
            contexts.add(context);
            if (failWith != null) throw failWith;
            return ExecutionResult.of(new ObjectMapper().createObjectNode().put("ran", true));
        }
    }
}
