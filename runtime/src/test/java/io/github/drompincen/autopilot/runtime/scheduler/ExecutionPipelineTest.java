package io.github.drompincen.autopilot.runtime.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.autopilot.persistence.document.ScheduledActionDocument;
import io.github.drompincen.autopilot.runtime.executor.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ExecutionPipelineTest {

    private static final Instant NOW = Instant.parse("2025-10-13T09:00:00Z");

    @Mock private ScheduledActionStore store;
    @Mock private ActionExecutor executor;

    private ExecutionPipeline pipeline;

    @BeforeEach
    void setUp() {
        when(executor.actionType()).thenReturn("notification");
        when(executor.execute(any(), any())).thenReturn(
                ExecutionResult.of(new ObjectMapper().createObjectNode().put("status", "success")));
        when(store.recordRun(any(), any(), any(), any())).thenReturn(true);
        pipeline = new ExecutionPipeline(store, new ExecutorRegistry(List.of(executor)),
                new ScheduleCalculator("UTC"), new MutableClock(NOW));
    }

    @Test
    void missingActionIsSkipped() {
        when(store.get("gone")).thenReturn(Optional.empty());

        FireOutcome outcome = pipeline.fire("gone");

        assertThat(outcome.status()).isEqualTo(FireOutcome.Status.SKIPPED);
        verify(executor, never()).execute(any(), any());
        verify(store, never()).recordRun(any(), any(), any(), any());
    }

    @Test
    void disabledActionIsSkipped() {
        ScheduledActionDocument action = action("cron", Map.of("expression", "0 9 * * *"));
        action.setEnabled(false);
        when(store.get("a1")).thenReturn(Optional.of(action));

        FireOutcome outcome = pipeline.fire("a1");

        assertThat(outcome.status()).isEqualTo(FireOutcome.Status.SKIPPED);
        verify(executor, never()).execute(any(), any());
    }

    @Test
    void successfulCronFireRecordsNextDay() {
        when(store.get("a1")).thenReturn(Optional.of(action("cron", Map.of("expression", "0 9 * * *"))));

        FireOutcome outcome = pipeline.fire("a1");

        assertThat(outcome.status()).isEqualTo(FireOutcome.Status.SUCCEEDED);
        assertThat(outcome.output().get("status").asText()).isEqualTo("success");
        assertThat(outcome.nextRunAt()).isEqualTo(Instant.parse("2025-10-14T09:00:00Z"));
        verify(store).recordRun("a1", NOW, Instant.parse("2025-10-14T09:00:00Z"), null);
    }

    @Test
    void executorReceivesConfigAndContext() {
        when(store.get("a1")).thenReturn(Optional.of(action("interval", Map.of("value", 1, "unit", "hours"))));

        pipeline.fire("a1");

        ArgumentCaptor<ExecutionContext> ctx = ArgumentCaptor.forClass(ExecutionContext.class);
        verify(executor).execute(eq(Map.of("title", "Hello")), ctx.capture());
        assertThat(ctx.getValue().ownerId()).isEqualTo("user-1");
        assertThat(ctx.getValue().actionId()).isEqualTo("a1");
        assertThat(ctx.getValue().firedAt()).isEqualTo(NOW);
        assertThat(ctx.getValue().testRun()).isFalse();
    }

    @Test
    void failureStillRecordsRunAndNextFire() {
        when(store.get("a1")).thenReturn(Optional.of(action("interval", Map.of("value", 1, "unit", "hours"))));
        when(executor.execute(any(), any())).thenThrow(new ExecutionFailedException("upstream down"));

        FireOutcome outcome = pipeline.fire("a1");

        assertThat(outcome.status()).isEqualTo(FireOutcome.Status.FAILED);
        assertThat(outcome.error()).isEqualTo("upstream down");
        assertThat(outcome.nextRunAt()).isEqualTo(NOW.plusSeconds(3600));
        verify(store).recordRun("a1", NOW, NOW.plusSeconds(3600), null);
    }

    @Test
    void unexpectedExceptionIsContained() {
        when(store.get("a1")).thenReturn(Optional.of(action("interval", Map.of("value", 1, "unit", "hours"))));
        when(executor.execute(any(), any())).thenThrow(new IllegalStateException());

        FireOutcome outcome = pipeline.fire("a1");

        assertThat(outcome.status()).isEqualTo(FireOutcome.Status.FAILED);
        assertThat(outcome.error()).isEqualTo("IllegalStateException");
    }

    @Test
    void onceFireDisablesAction() {
        when(store.get("a1")).thenReturn(Optional.of(action("once", Map.of("datetime", "2025-10-13T09:00:00Z"))));

        FireOutcome outcome = pipeline.fire("a1");

        assertThat(outcome.nextRunAt()).isNull();
        verify(store).recordRun("a1", NOW, null, false);
    }

    @Test
    void unknownActionTypeFailsButIsRecorded() {
        ScheduledActionDocument action = action("interval", Map.of("value", 1, "unit", "hours"));
        action.setActionType("teleport");
        when(store.get("a1")).thenReturn(Optional.of(action));

        FireOutcome outcome = pipeline.fire("a1");

        assertThat(outcome.status()).isEqualTo(FireOutcome.Status.FAILED);
        assertThat(outcome.error()).contains("teleport");
        verify(store).recordRun(eq("a1"), eq(NOW), any(), isNull());
    }

    @Test
    void storeFailureWhileRecordingDoesNotThrow() {
        when(store.get("a1")).thenReturn(Optional.of(action("interval", Map.of("value", 1, "unit", "hours"))));
        when(store.recordRun(any(), any(), any(), any())).thenThrow(new RuntimeException("mongo down"));

        FireOutcome outcome = pipeline.fire("a1");

        assertThat(outcome.status()).isEqualTo(FireOutcome.Status.SUCCEEDED);
    }

    @Test
    void testRunIgnoresEnabledAndWritesNothing() {
        ScheduledActionDocument action = action("cron", Map.of("expression", "0 9 * * *"));
        action.setEnabled(false);
        when(store.get("a1")).thenReturn(Optional.of(action));

        ExecutionResult result = pipeline.test("a1");

        assertThat(result.output().get("status").asText()).isEqualTo("success");
        ArgumentCaptor<ExecutionContext> ctx = ArgumentCaptor.forClass(ExecutionContext.class);
        verify(executor).execute(any(), ctx.capture());
        assertThat(ctx.getValue().testRun()).isTrue();
        verify(store, never()).recordRun(any(), any(), any(), any());
        verify(store, never()).updateNextRun(any(), any());
    }

    @Test
    void testRunPropagatesFailures() {
        when(store.get("a1")).thenReturn(Optional.of(action("cron", Map.of("expression", "0 9 * * *"))));
        when(executor.execute(any(), any())).thenThrow(new ExecutionFailedException("No query provided"));

        assertThatThrownBy(() -> pipeline.test("a1"))
                .isInstanceOf(ExecutionFailedException.class)
                .hasMessage("No query provided");
        assertThatThrownBy(() -> pipeline.test("missing"))
                .isInstanceOf(ActionNotFoundException.class);
    }

    private static ScheduledActionDocument action(String scheduleType, Map<String, Object> scheduleConfig) {
        ScheduledActionDocument doc = new ScheduledActionDocument();
        doc.setId("a1");
        doc.setOwnerId("user-1");
        doc.setName("Morning ping");
        doc.setActionType("notification");
        doc.setActionConfig(Map.of("title", "Hello"));
        doc.setScheduleType(scheduleType);
        doc.setScheduleConfig(scheduleConfig);
        doc.setEnabled(true);
        return doc;
    }
}
