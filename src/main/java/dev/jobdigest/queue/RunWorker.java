package dev.jobdigest.queue;

import dev.jobdigest.config.QueueProperties;
import dev.jobdigest.metrics.PipelineMetrics;
import dev.jobdigest.model.RunKind;
import dev.jobdigest.notify.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Polls the {@link WorkQueue} and executes claimed runs on the run worker executor.
 * Runs of different kinds execute concurrently; a kind is never executed twice at once.
 */
@Slf4j
@Component
public class RunWorker {

    private static final String SEPARATOR = "========================================";
    private static final Duration PROGRESS_EDIT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration PROGRESS_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final WorkQueue queue;
    private final Map<RunKind, RunHandler> handlers = new EnumMap<>(RunKind.class);
    private final TaskExecutor executor;
    private final Notifier notifier;
    private final QueueProperties properties;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final Set<RunKind> running = ConcurrentHashMap.newKeySet();

    public RunWorker(WorkQueue queue, List<RunHandler> runHandlers,
                     @Qualifier("runWorkerExecutor") TaskExecutor runWorkerExecutor,
                     Notifier notifier, QueueProperties properties, PipelineMetrics metrics, Clock clock) {
        this.queue = queue;
        this.executor = runWorkerExecutor;
        this.notifier = notifier;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        for (RunHandler handler : runHandlers) {
            RunHandler previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.kind());
            }
        }
        log.info("Run worker ready with handlers for {}", handlers.keySet());
    }

    @Scheduled(fixedDelayString = "${queue.poll-interval-ms:5000}", initialDelayString = "${queue.poll-interval-ms:5000}")
    public void poll() {
        if (!properties.isWorkerEnabled()) {
            return;
        }
        try {
            Instant now = clock.instant();
            Set<RunKind> busy = Set.copyOf(running);
            int recovered = queue.recoverExpiredLeases(now, busy);
            if (recovered > 0) {
                log.warn("Recovered {} runs with expired leases", recovered);
            }
            queue.claimRunnable(now, busy).forEach(this::dispatch);
        } catch (RuntimeException e) {
            log.error("Work queue poll failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Hand a claimed run to the executor.
     */
    void dispatch(ClaimedRun run) {
        if (!running.add(run.kind())) {
            log.warn("Run {} ({}) claimed while the kind is still executing", run.id(), run.kind().getLabel());
            queue.fail(run.id(), new IllegalStateException("Kind already executing on this worker"));
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    execute(run);
                } finally {
                    running.remove(run.kind());
                }
            });
        } catch (TaskRejectedException e) {
            running.remove(run.kind());
            log.error("Executor rejected run {}: {}", run.id(), e.getMessage());
            queue.fail(run.id(), e);
        }
    }

    /**
     * Execute one run on the calling thread and report its outcome to the queue.
     */
    void execute(ClaimedRun run) {
        RunHandler handler = handlers.get(run.kind());
        Instant startedAt = clock.instant();

        log.info(SEPARATOR);
        log.info("Run {} ({}) starting, attempt {}, triggered by {}", run.id(), run.kind().getLabel(),
                run.attempt(), run.triggeredBy());
        log.info(SEPARATOR);

        if (handler == null) {
            queue.fail(run.id(), new IllegalStateException("No handler for " + run.kind().getLabel()));
            return;
        }

        String handle = run.payload().progressHandle();
        ProgressEdits edits = handle != null ? new ProgressEdits(run.id(), handle) : null;
        RunContext context = new RunContext(run.id(), run.triggeredBy(), run.payload(), progressListener(run, edits));
        try {
            String summary;
            try {
                summary = handler.execute(context).block();
            } finally {
                if (edits != null) {
                    edits.drain();
                }
            }
            queue.complete(run.id(), summary);
            metrics.recordRunOutcome(run.kind(), "completed", Duration.between(startedAt, clock.instant()));

            log.info(SEPARATOR);
            log.info("Run {} ({}) completed: {}", run.id(), run.kind().getLabel(), summary);
            log.info(SEPARATOR);
        } catch (Exception e) {
            log.error("Run {} ({}) failed: {}", run.id(), run.kind().getLabel(), e.getMessage(), e);
            FailureOutcome outcome = queue.fail(run.id(), e);
            metrics.recordRunOutcome(run.kind(), outcome == FailureOutcome.RETRY_SCHEDULED ? "retried" : "failed",
                    Duration.between(startedAt, clock.instant()));
        }
    }

    /**
     * Progress goes to the queue as a lease heartbeat and, when the run carries one,
     * to the editable progress message.
     */
    private ProgressListener progressListener(ClaimedRun run, ProgressEdits edits) {
        return (percent, status) -> {
            log.debug("Run {} progress {}%: {}", run.id(), percent, status);
            try {
                queue.reportProgress(run.id(), percent, status);
            } catch (RuntimeException e) {
                log.warn("Failed to record progress for run {}: {}", run.id(), e.getMessage());
            }
            if (edits != null) {
                edits.submit(status + " (" + percent + "%)");
            }
        };
    }

    /**
     * Applies the progress edits of one run one after another, in submission order.
     * Checkpoints may fire on I/O threads, so submitting never blocks; the worker thread
     * waits for the edits in {@link #drain()} once the handler is done.
     */
    private final class ProgressEdits {

        private final String runId;
        private final Sinks.Many<String> pending = Sinks.many().unicast().onBackpressureBuffer();
        private final Mono<Void> applied;

        ProgressEdits(String runId, String handle) {
            this.runId = runId;
            this.applied = pending.asFlux()
                    .concatMap(text -> notifier.updateProgressMessage(handle, text)
                            .timeout(PROGRESS_EDIT_TIMEOUT)
                            .onErrorResume(e -> {
                                log.warn("Progress edit for run {} dropped: {}", runId, e.getMessage());
                                return Mono.empty();
                            }))
                    .then()
                    .cache();
            this.applied.subscribe();
        }

        void submit(String text) {
            Sinks.EmitResult result = pending.tryEmitNext(text);
            if (result.isFailure()) {
                log.warn("Progress edit for run {} not queued: {}", runId, result);
            }
        }

        void drain() {
            pending.tryEmitComplete();
            try {
                applied.block(PROGRESS_DRAIN_TIMEOUT);
            } catch (IllegalStateException e) {
                log.warn("Progress edits for run {} still pending after {}s", runId, PROGRESS_DRAIN_TIMEOUT.toSeconds());
            }
        }
    }

    Set<RunKind> runningKinds() {
        return Set.copyOf(running);
    }
}
