package dev.jobdigest.model;

import java.time.Instant;

/**
 * Read-only view of a pipeline run for status queries.
 */
public record RunSnapshot(
        String id,
        RunKind kind,
        RunStatus status,
        TriggerSource triggeredBy,
        int priority,
        int progress,
        String progressStatus,
        int attempts,
        Instant createdAt,
        Instant startedAt,
        Instant nextAttemptAt) {
}
