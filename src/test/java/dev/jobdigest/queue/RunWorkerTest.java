package dev.jobdigest.queue;

import dev.jobdigest.config.QueueProperties;
import dev.jobdigest.metrics.PipelineMetrics;
import dev.jobdigest.model.RunKind;
import dev.jobdigest.model.RunPayload;
import dev.jobdigest.model.TriggerSource;
import dev.jobdigest.notify.Notifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunWorkerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T02:00:00Z");
    private static final TaskExecutor SAME_THREAD = Runnable::run;

    @Mock
    private WorkQueue queue;

    @Mock
    private Notifier notifier;

    @Mock
    private PipelineMetrics metrics;

    private QueueProperties properties;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new QueueProperties();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private RunWorker worker(TaskExecutor executor, RunHandler... handlers) {
        return new RunWorker(queue, List.of(handlers), executor, notifier, properties, metrics, clock);
    }

    private static RunHandler handler(RunKind kind, Function<RunContext, Mono<String>> body) {
        return new RunHandler() {
            @Override
            public RunKind kind() {
                return kind;
            }

            @Override
            public Mono<String> execute(RunContext context) {
                return body.apply(context);
            }
        };
    }

    private static ClaimedRun claimed(String id, RunKind kind, RunPayload payload) {
        return new ClaimedRun(id, kind, TriggerSource.CRON, payload, 1);
    }

    @Test
    @DisplayName("Should do nothing when the worker is disabled")
    void shouldSkipWhenDisabled() {
        properties.setWorkerEnabled(false);

        worker(SAME_THREAD).poll();

        verifyNoInteractions(queue);
    }

    @Test
    @DisplayName("Should recover leases, claim and complete runs")
    void shouldExecuteClaimedRuns() {
        RunWorker worker = worker(SAME_THREAD, handler(RunKind.ALERT_SCAN, context -> Mono.just("2 new")));
        when(queue.recoverExpiredLeases(NOW, Set.of())).thenReturn(0);
        when(queue.claimRunnable(NOW, Set.of()))
                .thenReturn(List.of(claimed("run-1", RunKind.ALERT_SCAN, RunPayload.empty())));

        worker.poll();

        verify(queue).complete("run-1", "2 new");
        verify(metrics).recordRunOutcome(eq(RunKind.ALERT_SCAN), eq("completed"), any(Duration.class));
        assertThat(worker.runningKinds()).isEmpty();
    }

    @Test
    @DisplayName("Should fail the attempt when the handler errors")
    void shouldFailOnHandlerError() {
        IllegalStateException error = new IllegalStateException("No resume profile available");
        RunWorker worker = worker(SAME_THREAD, handler(RunKind.ALERT_SCAN, context -> Mono.error(error)));
        when(queue.fail("run-1", error)).thenReturn(FailureOutcome.RETRY_SCHEDULED);

        worker.execute(claimed("run-1", RunKind.ALERT_SCAN, RunPayload.empty()));

        verify(queue, never()).complete(any(), any());
        verify(metrics).recordRunOutcome(eq(RunKind.ALERT_SCAN), eq("retried"), any(Duration.class));
    }

    @Test
    @DisplayName("Should count a permanent failure as failed")
    void shouldRecordPermanentFailure() {
        RunWorker worker = worker(SAME_THREAD,
                handler(RunKind.DAILY_SUMMARY, context -> Mono.error(new IllegalStateException("not delivered"))));
        when(queue.fail(eq("run-2"), isA(IllegalStateException.class))).thenReturn(FailureOutcome.FAILED_PERMANENTLY);

        worker.execute(claimed("run-2", RunKind.DAILY_SUMMARY, RunPayload.empty()));

        verify(metrics).recordRunOutcome(eq(RunKind.DAILY_SUMMARY), eq("failed"), any(Duration.class));
    }

    @Test
    @DisplayName("Should fail runs of a kind without a handler")
    void shouldFailWithoutHandler() {
        RunWorker worker = worker(SAME_THREAD);

        worker.execute(claimed("run-3", RunKind.RETENTION_PRUNE, RunPayload.empty()));

        verify(queue).fail(eq("run-3"), isA(IllegalStateException.class));
    }

    @Test
    @DisplayName("Should refuse two handlers for one kind")
    void shouldRejectDuplicateHandlers() {
        RunHandler first = handler(RunKind.ALERT_SCAN, context -> Mono.just("a"));
        RunHandler second = handler(RunKind.ALERT_SCAN, context -> Mono.just("b"));

        assertThatThrownBy(() -> worker(SAME_THREAD, first, second))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ALERT_SCAN");
    }

    @Test
    @DisplayName("Should forward progress to the queue and the progress message")
    void shouldForwardProgress() {
        RunWorker worker = worker(SAME_THREAD, handler(RunKind.ALERT_SCAN, context -> {
            context.progress().onProgress(50, "Processed 2/4 emails...");
            return Mono.just("done");
        }));
        when(notifier.updateProgressMessage("h-1", "Processed 2/4 emails... (50%)")).thenReturn(Mono.empty());

        worker.execute(claimed("run-1", RunKind.ALERT_SCAN, new RunPayload(null, "h-1")));

        verify(queue).reportProgress("run-1", 50, "Processed 2/4 emails...");
        verify(notifier).updateProgressMessage("h-1", "Processed 2/4 emails... (50%)");
    }

    @Test
    @DisplayName("Should apply progress edits in order and before the run completes")
    void shouldApplyProgressEditsInOrder() {
        List<String> applied = Collections.synchronizedList(new ArrayList<>());
        when(notifier.updateProgressMessage(eq("h-1"), anyString())).thenAnswer(invocation -> {
            String text = invocation.getArgument(1);
            Mono<Void> record = Mono.fromRunnable(() -> applied.add(text));
            return text.startsWith("Checking")
                    ? Mono.delay(Duration.ofMillis(200)).then(record)
                    : record;
        });
        RunWorker worker = worker(SAME_THREAD, handler(RunKind.ALERT_SCAN, context -> {
            context.progress().onProgress(10, "Checking resume profile...");
            context.progress().onProgress(90, "Finishing up...");
            return Mono.just("done");
        }));

        worker.execute(claimed("run-1", RunKind.ALERT_SCAN, new RunPayload(null, "h-1")));

        assertThat(applied).containsExactly("Checking resume profile... (10%)", "Finishing up... (90%)");
        InOrder inOrder = inOrder(notifier, queue);
        inOrder.verify(notifier).updateProgressMessage("h-1", "Finishing up... (90%)");
        inOrder.verify(queue).complete("run-1", "done");
    }

    @Test
    @DisplayName("Should complete the run when a progress edit fails")
    void shouldTolerateProgressEditFailure() {
        when(notifier.updateProgressMessage(eq("h-1"), anyString()))
                .thenReturn(Mono.error(new IllegalStateException("message to edit not found")));
        RunWorker worker = worker(SAME_THREAD, handler(RunKind.ALERT_SCAN, context -> {
            context.progress().onProgress(20, "Fetching emails...");
            return Mono.just("done");
        }));

        worker.execute(claimed("run-1", RunKind.ALERT_SCAN, new RunPayload(null, "h-1")));

        verify(queue).complete("run-1", "done");
    }

    @Test
    @DisplayName("Should keep running when progress cannot be recorded")
    void shouldTolerateProgressFailure() {
        RunWorker worker = worker(SAME_THREAD, handler(RunKind.ALERT_SCAN, context -> {
            context.progress().onProgress(10, "Checking resume profile...");
            return Mono.just("done");
        }));
        doThrow(new IllegalStateException("database is locked"))
                .when(queue).reportProgress("run-1", 10, "Checking resume profile...");

        worker.execute(claimed("run-1", RunKind.ALERT_SCAN, RunPayload.empty()));

        verify(queue).complete("run-1", "done");
        verifyNoInteractions(notifier);
    }

    @Test
    @DisplayName("Should release the kind and fail the run when the executor is saturated")
    void shouldHandleRejectedExecution() {
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("pool exhausted");
        };
        RunWorker worker = worker(saturated, handler(RunKind.ALERT_SCAN, context -> Mono.just("done")));

        worker.dispatch(claimed("run-1", RunKind.ALERT_SCAN, RunPayload.empty()));

        verify(queue).fail(eq("run-1"), isA(TaskRejectedException.class));
        assertThat(worker.runningKinds()).isEmpty();
    }

    @Test
    @DisplayName("Should not start a kind that is still executing")
    void shouldNotDoubleDispatch() {
        TaskExecutor parked = task -> { };
        RunWorker worker = worker(parked, handler(RunKind.ALERT_SCAN, context -> Mono.just("done")));

        worker.dispatch(claimed("run-1", RunKind.ALERT_SCAN, RunPayload.empty()));
        worker.dispatch(claimed("run-2", RunKind.ALERT_SCAN, RunPayload.empty()));

        assertThat(worker.runningKinds()).containsExactly(RunKind.ALERT_SCAN);
        verify(queue).fail(eq("run-2"), isA(IllegalStateException.class));
        verify(queue, never()).fail(eq("run-1"), any());
    }

    @Test
    @DisplayName("Should survive a failing poll")
    void shouldSurvivePollFailure() {
        RunWorker worker = worker(SAME_THREAD);
        when(queue.recoverExpiredLeases(NOW, Set.of())).thenThrow(new IllegalStateException("database is locked"));

        worker.poll();

        verify(queue, never()).claimRunnable(any(), any());
    }
}
