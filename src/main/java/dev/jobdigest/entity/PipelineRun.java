package dev.jobdigest.entity;

import dev.jobdigest.model.RunKind;
import dev.jobdigest.model.RunSnapshot;
import dev.jobdigest.model.RunStatus;
import dev.jobdigest.model.TriggerSource;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable queue entry for one pipeline run.
 * {@code inflightKind} mirrors {@code kind} while the run is queued or active and is null
 * otherwise; its unique constraint makes single-flight hold across processes.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "pipeline_runs", indexes = {
        @Index(name = "idx_run_kind_status", columnList = "kind,status"),
        @Index(name = "idx_run_finished_at", columnList = "finishedAt")
})
public class PipelineRun {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private RunKind kind;

    @Enumerated(EnumType.STRING)
    @Column(unique = true, length = 32)
    private RunKind inflightKind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TriggerSource triggeredBy;

    private int priority;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RunStatus status;

    private int progress;

    @Column(length = 500)
    private String progressStatus;

    private int attempts;

    @Embedded
    private RetryPolicy retryPolicy;

    private Instant nextAttemptAt;

    private Instant leaseExpiresAt;

    @Column(length = 2000)
    private String lastError;

    @Column(length = 2000)
    private String resultSummary;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant startedAt;

    private Instant finishedAt;

    public RunSnapshot toSnapshot() {
        return new RunSnapshot(id, kind, status, triggeredBy, priority, progress, progressStatus,
                attempts, createdAt, startedAt, nextAttemptAt);
    }
}
