package dev.jobdigest.repository;

import dev.jobdigest.entity.JobPosting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for extracted job postings.
 */
@Repository
public interface JobPostingRepository extends JpaRepository<JobPosting, String> {

    boolean existsByApplyUrl(String applyUrl);

    boolean existsByTitleIgnoreCaseAndCompanyIgnoreCase(String title, String company);

    /**
     * Relevant postings created within a time range, best first.
     */
    @Query("SELECT j FROM JobPosting j WHERE j.createdAt >= :start AND j.createdAt < :end "
            + "AND j.relevanceScore >= :minScore ORDER BY j.relevanceScore DESC, j.createdAt DESC")
    List<JobPosting> findRelevantCreatedBetween(Instant start, Instant end, double minScore);

    long countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(Instant start, Instant end);

    @Query("SELECT COUNT(j) FROM JobPosting j WHERE j.createdAt >= :start AND j.createdAt < :end "
            + "AND j.relevanceScore >= :minScore")
    long countRelevantCreatedBetween(Instant start, Instant end, double minScore);

    /**
     * Posting counts per source platform within a time range, largest first.
     * Each row is {source, count}.
     */
    @Query("SELECT j.source, COUNT(j) FROM JobPosting j WHERE j.createdAt >= :start AND j.createdAt < :end "
            + "GROUP BY j.source ORDER BY COUNT(j) DESC")
    List<Object[]> countBySourceCreatedBetween(Instant start, Instant end);

    @Modifying
    @Query("UPDATE JobPosting j SET j.processed = true WHERE j.id IN :ids")
    int markProcessed(Collection<String> ids);
}
