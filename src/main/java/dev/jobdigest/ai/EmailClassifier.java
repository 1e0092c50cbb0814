package dev.jobdigest.ai;

import dev.jobdigest.model.EmailClassification;
import dev.jobdigest.model.EmailPreview;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Labels emails as job-related or not.
 */
public interface EmailClassifier {

    /**
     * Classify one batch of emails. Results are matched back by id; an email missing
     * from the result is treated as not job-related.
     *
     * @param emails Previews of the emails in the batch
     * @return Mono with one classification per recognised email
     */
    Mono<List<EmailClassification>> classifyBatch(List<EmailPreview> emails);
}
