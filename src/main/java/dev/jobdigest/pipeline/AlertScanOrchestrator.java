package dev.jobdigest.pipeline;

import dev.jobdigest.ai.EmailClassifier;
import dev.jobdigest.ai.JobExtractor;
import dev.jobdigest.ai.RelevanceScorer;
import dev.jobdigest.config.PipelineProperties;
import dev.jobdigest.entity.JobPosting;
import dev.jobdigest.entity.ResumeProfile;
import dev.jobdigest.metrics.PipelineMetrics;
import dev.jobdigest.model.AlertScanSummary;
import dev.jobdigest.model.EmailClassification;
import dev.jobdigest.model.EmailMessage;
import dev.jobdigest.model.JobPostingDraft;
import dev.jobdigest.model.RunKind;
import dev.jobdigest.notify.MessageFormatter;
import dev.jobdigest.notify.Notifier;
import dev.jobdigest.queue.ProgressListener;
import dev.jobdigest.queue.RunContext;
import dev.jobdigest.queue.RunHandler;
import dev.jobdigest.schedule.SchedulePolicy;
import dev.jobdigest.service.JobStore;
import dev.jobdigest.service.ProcessedEmailLedger;
import dev.jobdigest.service.ResumeProfileCache;
import dev.jobdigest.source.EmailSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Alert-scan run: fetch new emails, keep the job-related ones, extract and score their
 * postings against the resume profile, persist them and send one digest of the relevant ones.
 * <p>
 * Every email is isolated: a failure while processing one email records it as processed
 * with zero postings, reports it once, and the run moves on to the next email.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertScanOrchestrator implements RunHandler {

    private static final String SEPARATOR = "========================================";

    private final EmailSource emailSource;
    private final EmailClassifier emailClassifier;
    private final JobExtractor jobExtractor;
    private final RelevanceScorer relevanceScorer;
    private final ResumeProfileCache resumeProfileCache;
    private final ProcessedEmailLedger ledger;
    private final JobStore jobStore;
    private final Notifier notifier;
    private final MessageFormatter formatter;
    private final SchedulePolicy schedulePolicy;
    private final PipelineProperties properties;
    private final PipelineMetrics metrics;
    private final Clock clock;

    @Override
    public RunKind kind() {
        return RunKind.ALERT_SCAN;
    }

    @Override
    public Mono<String> execute(RunContext context) {
        Double requested = context.payload().minRelevanceScore();
        double minRelevance = requested != null ? requested : properties.getRelevance().getMinScore();
        return run(minRelevance, context.progress()).map(AlertScanSummary::describe);
    }

    /**
     * Execute one alert scan.
     *
     * @param minRelevance Postings scoring at least this much join the digest
     * @param progress     Receives progress checkpoints
     * @return Mono with the run totals
     */
    public Mono<AlertScanSummary> run(double minRelevance, ProgressListener progress) {
        ScanState state = new ScanState();

        return step(progress, 5, "Starting job processing...")
                .then(step(progress, 10, "Checking resume profile..."))
                .then(Mono.defer(resumeProfileCache::currentProfile))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("No resume profile available")))
                .flatMap(profile -> step(progress, 20, "Fetching emails...")
                        .then(Mono.defer(emailSource::listRecent))
                        .defaultIfEmpty(List.of())
                        .flatMap(emails -> {
                            state.fetched = emails.size();
                            metrics.recordEmailsFetched(emails.size());
                            log.info("Fetched {} emails from {}", emails.size(), emailSource.getName());
                            return step(progress, 30, "Classifying " + emails.size() + " emails...")
                                    .then(classify(emails));
                        })
                        .flatMap(jobEmails -> {
                            state.jobRelated = jobEmails.size();
                            metrics.recordJobRelatedEmails(jobEmails.size());
                            log.info("Job-related emails: {}", jobEmails.size());
                            return step(progress, 40, "Processing " + jobEmails.size() + " job emails...")
                                    .then(processEmails(jobEmails, profile, minRelevance, state, progress));
                        }))
                .then(Mono.defer(() -> step(progress, 85, "Sending notifications...")
                        .then(notifyRelevant(state, minRelevance))))
                .then(Mono.defer(() -> step(progress, 95, "Finishing up...")
                        .then(sendFinalStatus(state))))
                .then(Mono.fromCallable(state::toSummary))
                .doOnNext(summary -> {
                    metrics.updateLastRunStats(summary);
                    log.info(SEPARATOR);
                    log.info("ALERT SCAN SUMMARY: {}", summary.describe());
                    log.info(SEPARATOR);
                });
    }

    /**
     * Classify in batches and keep, in arrival order, the emails that are job-related
     * with enough confidence. Emails without a classification do not qualify.
     */
    Mono<List<EmailMessage>> classify(List<EmailMessage> emails) {
        if (emails.isEmpty()) {
            return Mono.just(List.of());
        }
        int batchSize = Math.max(1, properties.getClassification().getBatchSize());
        int previewChars = properties.getClassification().getBodyPreviewChars();
        double threshold = properties.getClassification().getThreshold();

        List<List<EmailMessage>> batches = new ArrayList<>();
        for (int i = 0; i < emails.size(); i += batchSize) {
            batches.add(emails.subList(i, Math.min(i + batchSize, emails.size())));
        }

        return Flux.fromIterable(batches)
                .concatMap(batch -> emailClassifier.classifyBatch(
                        batch.stream().map(email -> email.toPreview(previewChars)).toList()))
                .flatMapIterable(results -> results)
                .collectMap(EmailClassification::id)
                .map(byId -> emails.stream()
                        .filter(email -> qualifies(byId, email, threshold))
                        .toList());
    }

    private boolean qualifies(Map<String, EmailClassification> byId, EmailMessage email, double threshold) {
        EmailClassification classification = byId.get(email.id());
        boolean qualifies = classification != null
                && classification.jobRelated()
                && classification.confidence() >= threshold;
        if (!qualifies) {
            log.debug("Email '{}' not job-related ({})", email.subject(), classification);
        }
        return qualifies;
    }

    private Mono<Void> processEmails(List<EmailMessage> emails, ResumeProfile profile, double minRelevance,
                                     ScanState state, ProgressListener progress) {
        int total = emails.size();
        int every = Math.max(1, properties.getProgressEveryEmails());
        return Flux.fromIterable(emails)
                .index()
                .concatMap(indexed -> processEmailIsolated(indexed.getT2(), profile, minRelevance, state)
                        .then(Mono.defer(() -> {
                            int done = indexed.getT1().intValue() + 1;
                            if (done % every == 0 || done == total) {
                                return step(progress, 40 + (40 * done / total),
                                        "Processed " + done + "/" + total + " emails...");
                            }
                            return Mono.<Void>empty();
                        })))
                .then();
    }

    /**
     * Process one email inside the per-email failure boundary.
     */
    private Mono<Void> processEmailIsolated(EmailMessage email, ResumeProfile profile, double minRelevance,
                                            ScanState state) {
        return Mono.defer(() -> {
            if (ledger.isProcessed(email.id())) {
                state.skipped++;
                log.debug("Email {} already processed, skipping", email.id());
                return Mono.<Void>empty();
            }

            List<JobPosting> relevantFromEmail = new ArrayList<>();
            return processEmail(email, profile, minRelevance, state, relevantFromEmail)
                    .then(Mono.fromRunnable(() -> {
                        state.relevant.addAll(relevantFromEmail);
                        state.processed++;
                        metrics.recordEmailProcessed();
                    }))
                    .onErrorResume(e -> handleEmailFailure(email, e, state))
                    .then();
        });
    }

    private Mono<Void> processEmail(EmailMessage email, ResumeProfile profile, double minRelevance,
                                    ScanState state, List<JobPosting> relevantFromEmail) {
        return jobExtractor.extractJobs(email.body(), email.subject(), email.from())
                .defaultIfEmpty(List.of())
                .flatMap(drafts -> {
                    log.info("Email '{}' yielded {} postings", email.subject(), drafts.size());
                    if (drafts.isEmpty()) {
                        return Mono.fromRunnable(() -> ledger.record(email.id(), email.subject(), email.from(), 0))
                                .then(Mono.defer(() -> markRead(email)));
                    }

                    List<JobPosting> persisted = new ArrayList<>();
                    return Flux.fromIterable(drafts)
                            .concatMap(draft -> persistDraft(draft, email, profile, state))
                            .doOnNext(saved -> {
                                persisted.add(saved);
                                if (saved.getRelevanceScore() >= minRelevance) {
                                    relevantFromEmail.add(saved);
                                    metrics.recordRelevantJob();
                                }
                            })
                            .then(Mono.fromRunnable(() ->
                                    ledger.record(email.id(), email.subject(), email.from(), persisted.size())))
                            .then(Mono.defer(() -> archive(email)));
                });
    }

    /**
     * Score and save one draft, unless it repeats a stored posting.
     */
    private Mono<JobPosting> persistDraft(JobPostingDraft draft, EmailMessage email, ResumeProfile profile,
                                          ScanState state) {
        return Mono.defer(() -> {
            if (jobStore.isDuplicate(draft)) {
                state.duplicates++;
                metrics.recordDuplicateJob();
                log.debug("Duplicate job skipped: '{}' @ {}", draft.getTitle(), draft.getCompany());
                return Mono.<JobPosting>empty();
            }
            return relevanceScorer.score(draft, profile)
                    .defaultIfEmpty(0.0)
                    .map(score -> jobStore.save(draft, score, email.id()))
                    .doOnNext(saved -> {
                        state.saved++;
                        metrics.recordJobSaved();
                    })
                    .delayUntil(saved -> courtesyDelay());
        });
    }

    private Mono<Void> markRead(EmailMessage email) {
        return emailSource.markRead(email.id())
                .onErrorResume(e -> {
                    log.warn("Failed to mark email {} read: {}", email.id(), e.getMessage());
                    metrics.recordArchiveFailure();
                    return Mono.empty();
                });
    }

    /**
     * Archive after the ledger write; a failure here leaves the ledger record in place.
     */
    private Mono<Void> archive(EmailMessage email) {
        return emailSource.markReadAndArchive(email.id())
                .then(Mono.fromRunnable(() -> ledger.markArchived(email.id())))
                .then()
                .onErrorResume(e -> {
                    log.warn("Failed to archive email {} ('{}'): {}", email.id(), email.subject(), e.getMessage());
                    metrics.recordArchiveFailure();
                    return Mono.empty();
                });
    }

    private Mono<Void> handleEmailFailure(EmailMessage email, Throwable error, ScanState state) {
        log.error("Failed to process email {} ('{}' from {}): {}", email.id(), email.subject(), email.from(),
                error.getMessage(), error);
        state.failed++;
        metrics.recordEmailFailure();
        return Mono.fromRunnable(() -> ledger.record(email.id(), email.subject(), email.from(), 0))
                .then(Mono.defer(() -> notifier.sendError(String.format(
                        "Failed to process email\n\n📧 Subject: %s\n👤 From: %s\n⚠️ Error: %s",
                        email.subject(), email.from(), error.getMessage()))));
    }

    /**
     * Deliver the relevant postings as one digest, best first, and flag them processed once delivered.
     */
    private Mono<Void> notifyRelevant(ScanState state, double minRelevance) {
        List<JobPosting> relevant = state.relevant.stream()
                .sorted(Comparator.comparingDouble(JobPosting::getRelevanceScore).reversed())
                .toList();

        if (relevant.isEmpty()) {
            if (state.saved == 0) {
                return Mono.empty();
            }
            return notifier.sendStatus(String.format(
                    "Found %d new jobs, but none met the minimum relevance score of %d%%",
                    state.saved, Math.round(minRelevance * 100)));
        }

        return notifier.sendDigest(relevant)
                .flatMap(sent -> {
                    if (!sent) {
                        log.warn("Digest delivery failed - {} postings stay unprocessed", relevant.size());
                        return Mono.<Void>empty();
                    }
                    return Mono.<Void>fromRunnable(() -> {
                        jobStore.markProcessed(relevant);
                        state.notified = relevant.size();
                        metrics.recordJobsNotified(relevant.size());
                    });
                })
                .then();
    }

    /**
     * Totals and next-run hint, only when this run handled at least one new email.
     */
    private Mono<Void> sendFinalStatus(ScanState state) {
        if (state.processed + state.failed == 0) {
            log.info("No new emails - nothing to report");
            return Mono.empty();
        }
        String hint = formatter.formatNextRunHint(schedulePolicy.nextRun(clock.instant()));
        String text = String.format("✅ Job processing complete!%n%n"
                        + "📧 Emails: %d fetched, %d job-related, %d processed, %d skipped, %d failed%n"
                        + "💼 Jobs: %d new, %d duplicates, %d relevant, %d sent%n%n%s",
                state.fetched, state.jobRelated, state.processed, state.skipped, state.failed,
                state.saved, state.duplicates, state.relevant.size(), state.notified, hint);
        return notifier.sendStatus(text);
    }

    private Mono<Void> courtesyDelay() {
        Duration delay = properties.getPostingDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return Mono.empty();
        }
        return Mono.delay(delay).then();
    }

    private static Mono<Void> step(ProgressListener progress, int percent, String status) {
        return Mono.fromRunnable(() -> progress.onProgress(percent, status));
    }

    /**
     * Mutable totals of one run. Only touched from the run's sequential pipeline.
     */
    private static final class ScanState {
        private int fetched;
        private int jobRelated;
        private int processed;
        private int skipped;
        private int failed;
        private int saved;
        private int duplicates;
        private int notified;
        private final List<JobPosting> relevant = new ArrayList<>();

        private AlertScanSummary toSummary() {
            return new AlertScanSummary(fetched, jobRelated, processed, skipped, failed, saved, duplicates,
                    relevant.size(), notified);
        }
    }
}
