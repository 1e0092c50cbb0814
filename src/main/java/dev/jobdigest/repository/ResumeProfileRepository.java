package dev.jobdigest.repository;

import dev.jobdigest.entity.ResumeProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ResumeProfileRepository extends JpaRepository<ResumeProfile, Long> {

    Optional<ResumeProfile> findFirstByOrderByAnalyzedAtDesc();
}
