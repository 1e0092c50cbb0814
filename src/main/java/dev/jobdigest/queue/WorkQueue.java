package dev.jobdigest.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobdigest.config.QueueProperties;
import dev.jobdigest.entity.PipelineRun;
import dev.jobdigest.entity.RetryPolicy;
import dev.jobdigest.model.QueueStats;
import dev.jobdigest.model.RunKind;
import dev.jobdigest.model.RunPayload;
import dev.jobdigest.model.RunSnapshot;
import dev.jobdigest.model.RunStatus;
import dev.jobdigest.model.TriggerSource;
import dev.jobdigest.notify.Notifier;
import dev.jobdigest.repository.PipelineRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable, single-flight queue of pipeline runs.
 * At most one run per {@link RunKind} is queued or active at any time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkQueue {

    static final List<RunStatus> IN_FLIGHT = List.of(RunStatus.QUEUED, RunStatus.ACTIVE);
    static final List<RunStatus> FINISHED = List.of(RunStatus.COMPLETED, RunStatus.FAILED);

    static final int PRIORITY_MANUAL = 1;
    static final int PRIORITY_CRON = 10;
    static final int PRIORITY_HOUSEKEEPING = 20;

    private static final int MAX_ERROR_LENGTH = 2000;

    private final PipelineRunRepository repository;
    private final QueueProperties properties;
    private final ObjectMapper objectMapper;
    private final Notifier notifier;
    private final Clock clock;

    /**
     * Add a run unless one of the same kind is already queued or active.
     *
     * @return id of the new run
     * @throws AlreadyInFlightException if the kind is in flight
     */
    public synchronized String enqueue(RunKind kind, TriggerSource trigger, RunPayload payload) {
        if (repository.existsByKindAndStatusIn(kind, IN_FLIGHT)) {
            throw new AlreadyInFlightException(kind);
        }

        Instant now = clock.instant();
        PipelineRun run = PipelineRun.builder()
                .id(UUID.randomUUID().toString())
                .kind(kind)
                .inflightKind(kind)
                .triggeredBy(trigger)
                .priority(priorityFor(kind, trigger))
                .payload(writePayload(payload != null ? payload : RunPayload.empty()))
                .status(RunStatus.QUEUED)
                .retryPolicy(defaultRetryPolicy())
                .createdAt(now)
                .build();

        try {
            repository.saveAndFlush(run);
        } catch (DataIntegrityViolationException e) {
            // Another process won the race on the in-flight slot.
            throw new AlreadyInFlightException(kind);
        }
        log.info("Enqueued {} run {} ({}, priority {})", kind.getLabel(), run.getId(), trigger, run.getPriority());
        return run.getId();
    }

    public Optional<RunSnapshot> currentRun(RunKind kind) {
        return repository.findFirstByKindAndStatusInOrderByCreatedAtDesc(kind, IN_FLIGHT)
                .map(PipelineRun::toSnapshot);
    }

    public List<RunSnapshot> currentRuns() {
        return repository.findByStatusInOrderByPriorityAscCreatedAtAsc(IN_FLIGHT).stream()
                .map(PipelineRun::toSnapshot)
                .toList();
    }

    public QueueStats stats() {
        return new QueueStats(
                repository.countByStatus(RunStatus.QUEUED),
                repository.countByStatus(RunStatus.ACTIVE),
                repository.countByStatus(RunStatus.COMPLETED),
                repository.countByStatus(RunStatus.FAILED));
    }

    /**
     * Move every due queued run to ACTIVE, in priority order, stamping attempt count and lease.
     *
     * @param now       Current time
     * @param busyKinds Kinds the caller is still executing; their runs stay queued
     */
    public List<ClaimedRun> claimRunnable(Instant now, Set<RunKind> busyKinds) {
        List<ClaimedRun> claimed = new ArrayList<>();
        for (PipelineRun run : repository.findRunnable(now)) {
            if (busyKinds.contains(run.getKind())) {
                continue;
            }
            run.setStatus(RunStatus.ACTIVE);
            run.setAttempts(run.getAttempts() + 1);
            run.setNextAttemptAt(null);
            run.setLeaseExpiresAt(now.plus(properties.getLeaseTimeout()));
            if (run.getStartedAt() == null) {
                run.setStartedAt(now);
            }
            repository.save(run);
            claimed.add(new ClaimedRun(run.getId(), run.getKind(), run.getTriggeredBy(),
                    readPayload(run), run.getAttempts()));
            log.debug("Claimed {} run {} (attempt {})", run.getKind().getLabel(), run.getId(), run.getAttempts());
        }
        return claimed;
    }

    /**
     * Record progress of an active run and renew its lease.
     */
    public void reportProgress(String runId, int percent, String status) {
        repository.findById(runId)
                .filter(run -> run.getStatus() == RunStatus.ACTIVE)
                .ifPresent(run -> {
                    run.setProgress(Math.max(0, Math.min(100, percent)));
                    run.setProgressStatus(status);
                    run.setLeaseExpiresAt(clock.instant().plus(properties.getLeaseTimeout()));
                    repository.save(run);
                });
    }

    /**
     * Mark an active run completed and release its in-flight slot.
     *
     * @return false if the run was not active any more
     */
    public boolean complete(String runId, String summary) {
        Optional<PipelineRun> found = repository.findById(runId);
        if (found.isEmpty() || found.get().getStatus() != RunStatus.ACTIVE) {
            log.warn("Cannot complete run {}: not active", runId);
            return false;
        }
        PipelineRun run = found.get();
        run.setStatus(RunStatus.COMPLETED);
        run.setInflightKind(null);
        run.setProgress(100);
        run.setResultSummary(truncate(summary));
        run.setLeaseExpiresAt(null);
        run.setFinishedAt(clock.instant());
        repository.save(run);
        log.info("Run {} ({}) completed: {}", runId, run.getKind().getLabel(), summary);
        return true;
    }

    /**
     * Record a failed attempt. Retries with the run's backoff until its attempt ceiling,
     * then marks the run FAILED and notifies the operator once.
     */
    public FailureOutcome fail(String runId, Throwable cause) {
        Optional<PipelineRun> found = repository.findById(runId);
        if (found.isEmpty() || found.get().getStatus() != RunStatus.ACTIVE) {
            log.warn("Cannot fail run {}: not active", runId);
            return FailureOutcome.IGNORED;
        }
        return applyFailure(found.get(), describe(cause), clock.instant());
    }

    /**
     * Treat active runs whose lease has expired as failed attempts.
     *
     * @param now        Current time
     * @param localKinds Kinds the caller is executing right now; never recovered
     * @return number of runs recovered
     */
    public int recoverExpiredLeases(Instant now, Set<RunKind> localKinds) {
        int recovered = 0;
        for (PipelineRun run : repository.findByStatusAndLeaseExpiresAtBefore(RunStatus.ACTIVE, now)) {
            if (localKinds.contains(run.getKind())) {
                continue;
            }
            log.warn("Run {} ({}) lost its lease at {}", run.getId(), run.getKind().getLabel(), run.getLeaseExpiresAt());
            applyFailure(run, "Lease expired without progress (worker crashed or stalled)", now);
            recovered++;
        }
        return recovered;
    }

    /**
     * Delete finished runs older than the retention window.
     *
     * @return number of runs deleted
     */
    @Transactional
    public int pruneFinished(Instant now) {
        Instant cutoff = now.minus(properties.getRetention());
        int deleted = repository.deleteFinishedBefore(FINISHED, cutoff);
        log.info("Pruned {} finished runs older than {}", deleted, cutoff);
        return deleted;
    }

    static int priorityFor(RunKind kind, TriggerSource trigger) {
        if (kind == RunKind.RETENTION_PRUNE) {
            return PRIORITY_HOUSEKEEPING;
        }
        return trigger == TriggerSource.MANUAL ? PRIORITY_MANUAL : PRIORITY_CRON;
    }

    private FailureOutcome applyFailure(PipelineRun run, String error, Instant now) {
        int failedAttempts = run.getAttempts();
        RetryPolicy policy = run.getRetryPolicy() != null ? run.getRetryPolicy() : defaultRetryPolicy();
        run.setLastError(truncate(error));
        run.setLeaseExpiresAt(null);

        if (policy.allowsRetryAfter(failedAttempts)) {
            Duration delay = policy.delayAfter(failedAttempts);
            run.setStatus(RunStatus.QUEUED);
            run.setNextAttemptAt(now.plus(delay));
            repository.save(run);
            log.warn("Run {} ({}) failed attempt {}/{}: {} - retrying in {}s", run.getId(), run.getKind().getLabel(),
                    failedAttempts, policy.getMaxAttempts(), error, delay.toSeconds());
            return FailureOutcome.RETRY_SCHEDULED;
        }

        run.setStatus(RunStatus.FAILED);
        run.setInflightKind(null);
        run.setFinishedAt(now);
        repository.save(run);
        log.error("Run {} ({}) failed permanently after {} attempts: {}", run.getId(), run.getKind().getLabel(),
                failedAttempts, error);
        notifier.sendError(String.format("Run %s (%s) failed after %d attempt(s): %s",
                run.getId(), run.getKind().getLabel(), failedAttempts, error)).block();
        return FailureOutcome.FAILED_PERMANENTLY;
    }

    private RetryPolicy defaultRetryPolicy() {
        return RetryPolicy.builder()
                .maxAttempts(Math.max(1, properties.getMaxAttempts()))
                .backoffKind(properties.getBackoffKind())
                .baseDelayMs(properties.getBaseDelay().toMillis())
                .build();
    }

    private String writePayload(RunPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Run payload is not serializable", e);
        }
    }

    private RunPayload readPayload(PipelineRun run) {
        if (run.getPayload() == null || run.getPayload().isBlank()) {
            return RunPayload.empty();
        }
        try {
            return objectMapper.readValue(run.getPayload(), RunPayload.class);
        } catch (JsonProcessingException e) {
            log.warn("Run {} has an unreadable payload, using defaults: {}", run.getId(), e.getMessage());
            return RunPayload.empty();
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank()
                ? cause.getClass().getSimpleName() + ": " + message
                : cause.getClass().getSimpleName();
    }

    private static String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() > MAX_ERROR_LENGTH ? value.substring(0, MAX_ERROR_LENGTH) : value;
    }
}
