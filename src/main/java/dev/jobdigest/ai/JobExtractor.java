package dev.jobdigest.ai;

import dev.jobdigest.model.JobPostingDraft;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Turns one email into zero or more job postings.
 */
public interface JobExtractor {

    Mono<List<JobPostingDraft>> extractJobs(String body, String subject, String from);
}
