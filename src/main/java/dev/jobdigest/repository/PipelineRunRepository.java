package dev.jobdigest.repository;

import dev.jobdigest.entity.PipelineRun;
import dev.jobdigest.model.RunKind;
import dev.jobdigest.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository backing the durable work queue.
 */
@Repository
public interface PipelineRunRepository extends JpaRepository<PipelineRun, String> {

    boolean existsByKindAndStatusIn(RunKind kind, Collection<RunStatus> statuses);

    Optional<PipelineRun> findFirstByKindAndStatusInOrderByCreatedAtDesc(RunKind kind, Collection<RunStatus> statuses);

    List<PipelineRun> findByStatusInOrderByPriorityAscCreatedAtAsc(Collection<RunStatus> statuses);

    /**
     * Queued runs whose next attempt is due, highest priority (lowest number) first.
     */
    @Query("SELECT r FROM PipelineRun r WHERE r.status = dev.jobdigest.model.RunStatus.QUEUED "
            + "AND (r.nextAttemptAt IS NULL OR r.nextAttemptAt <= :now) ORDER BY r.priority ASC, r.createdAt ASC")
    List<PipelineRun> findRunnable(Instant now);

    List<PipelineRun> findByStatusAndLeaseExpiresAtBefore(RunStatus status, Instant now);

    long countByStatus(RunStatus status);

    @Modifying
    @Query("DELETE FROM PipelineRun r WHERE r.status IN :statuses AND r.finishedAt < :cutoff")
    int deleteFinishedBefore(Collection<RunStatus> statuses, Instant cutoff);
}
