package dev.jobdigest.notify;

import dev.jobdigest.entity.JobPosting;
import dev.jobdigest.model.DailyStats;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * Operator-facing notifications. Implementations never propagate delivery errors:
 * failures are logged and reported through the returned value.
 */
public interface Notifier {

    /**
     * Send one digest of relevant postings, best first.
     *
     * @return Mono with true if every part was delivered
     */
    Mono<Boolean> sendDigest(List<JobPosting> postings);

    /**
     * Send the end-of-day summary.
     *
     * @return Mono with true if every part was delivered
     */
    Mono<Boolean> sendDailySummary(List<JobPosting> jobs, DailyStats stats, LocalDate day);

    Mono<Void> sendStatus(String text);

    Mono<Void> sendError(String text);

    /**
     * Create a message that later progress updates edit in place.
     *
     * @return Mono with the message handle, empty if the transport cannot edit or delivery failed
     */
    Mono<String> createProgressMessage(String text);

    /**
     * Edit a progress message. Failures are ignored.
     */
    Mono<Void> updateProgressMessage(String handle, String text);
}
