package dev.jobdigest.service;

import dev.jobdigest.ai.ResumeAnalyzer;
import dev.jobdigest.config.PipelineProperties;
import dev.jobdigest.entity.ResumeProfile;
import dev.jobdigest.repository.ResumeProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Holds the latest resume analysis and decides when it must be recomputed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeProfileCache {

    private final ResumeProfileRepository resumeProfileRepository;
    private final ResumeAnalyzer resumeAnalyzer;
    private final ResumeDocumentLoader resumeDocumentLoader;
    private final PipelineProperties pipelineProperties;
    private final Clock clock;

    /**
     * Return the current profile, re-analysing the resume when none is stored or it is stale.
     * A failure to store the fresh profile is logged and the in-memory profile is used.
     */
    public Mono<ResumeProfile> currentProfile() {
        return Mono.fromCallable(this::latest)
                .flatMap(latest -> {
                    if (latest.isPresent() && !isStale(latest.get())) {
                        log.debug("Using resume profile analysed at {}", latest.get().getAnalyzedAt());
                        return Mono.just(latest.get());
                    }
                    log.info("Resume profile {} - analysing resume...", latest.isPresent() ? "is stale" : "missing");
                    return refresh();
                });
    }

    /**
     * Whether a profile is older than the configured maximum age.
     */
    public boolean isStale(ResumeProfile profile) {
        return profile.isStale(Instant.now(clock), pipelineProperties.getResume().getMaxAge());
    }

    private Optional<ResumeProfile> latest() {
        return resumeProfileRepository.findFirstByOrderByAnalyzedAtDesc();
    }

    private Mono<ResumeProfile> refresh() {
        return Mono.fromCallable(resumeDocumentLoader::load)
                .flatMap(resumeAnalyzer::analyze)
                .map(profile -> {
                    if (profile.getAnalyzedAt() == null) {
                        profile.setAnalyzedAt(Instant.now(clock));
                    }
                    return store(profile);
                });
    }

    private ResumeProfile store(ResumeProfile profile) {
        try {
            ResumeProfile saved = resumeProfileRepository.save(profile);
            log.info("Resume profile stored: {} skills, seniority {}", saved.getSkills().size(), saved.getSeniority());
            return saved;
        } catch (RuntimeException e) {
            log.warn("Failed to store resume profile - continuing with in-memory profile: {}", e.getMessage());
            return profile;
        }
    }
}
