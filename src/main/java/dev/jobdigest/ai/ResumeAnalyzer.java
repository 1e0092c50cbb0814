package dev.jobdigest.ai;

import dev.jobdigest.entity.ResumeProfile;
import dev.jobdigest.model.ResumeDocument;
import reactor.core.publisher.Mono;

/**
 * Builds a resume profile from the resume text.
 */
public interface ResumeAnalyzer {

    /**
     * @return Mono with an unsaved profile stamped with the analysis time
     */
    Mono<ResumeProfile> analyze(ResumeDocument document);
}
