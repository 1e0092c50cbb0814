package dev.jobdigest.ai;

import dev.jobdigest.entity.ResumeProfile;
import dev.jobdigest.model.JobPostingDraft;
import reactor.core.publisher.Mono;

/**
 * Scores how well a posting fits the candidate.
 */
public interface RelevanceScorer {

    /**
     * @return Mono with a score in [0, 1]
     */
    Mono<Double> score(JobPostingDraft draft, ResumeProfile profile);
}
