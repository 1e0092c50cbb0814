package dev.jobdigest.repository;

import dev.jobdigest.entity.ProcessedEmailRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface ProcessedEmailRepository extends JpaRepository<ProcessedEmailRecord, String> {

    long countByProcessedAtGreaterThanEqualAndProcessedAtLessThan(Instant start, Instant end);
}
