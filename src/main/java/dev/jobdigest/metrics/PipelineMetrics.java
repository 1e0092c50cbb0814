package dev.jobdigest.metrics;

import dev.jobdigest.model.AlertScanSummary;
import dev.jobdigest.model.RunKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for pipeline runs.
 */
@Component
public class PipelineMetrics {

    private static final String TAG_KIND = "kind";
    private static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;

    // Counters
    private final Counter emailsFetchedCounter;
    private final Counter emailsJobRelatedCounter;
    private final Counter emailsProcessedCounter;
    private final Counter emailFailuresCounter;
    private final Counter archiveFailuresCounter;
    private final Counter jobsSavedCounter;
    private final Counter jobsDuplicateCounter;
    private final Counter jobsRelevantCounter;
    private final Counter jobsNotifiedCounter;
    private final Counter notificationFailuresCounter;

    // Timers (per run kind)
    private final ConcurrentHashMap<RunKind, Timer> runTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastRunJobsSaved = new AtomicInteger(0);
    private final AtomicInteger lastRunJobsRelevant = new AtomicInteger(0);
    private final AtomicInteger lastRunJobsNotified = new AtomicInteger(0);

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.emailsFetchedCounter = Counter.builder("job_digest_emails_fetched_total")
                .description("Total emails fetched from the inbox")
                .register(registry);

        this.emailsJobRelatedCounter = Counter.builder("job_digest_emails_job_related_total")
                .description("Total emails classified as job-related above the confidence threshold")
                .register(registry);

        this.emailsProcessedCounter = Counter.builder("job_digest_emails_processed_total")
                .description("Total emails written to the processed ledger")
                .register(registry);

        this.emailFailuresCounter = Counter.builder("job_digest_email_failures_total")
                .description("Total emails whose processing failed and were forced to zero postings")
                .register(registry);

        this.archiveFailuresCounter = Counter.builder("job_digest_archive_failures_total")
                .description("Total emails that could not be archived after processing")
                .register(registry);

        this.jobsSavedCounter = Counter.builder("job_digest_jobs_saved_total")
                .description("Total job postings persisted")
                .register(registry);

        this.jobsDuplicateCounter = Counter.builder("job_digest_jobs_duplicate_total")
                .description("Total extracted postings skipped as duplicates")
                .register(registry);

        this.jobsRelevantCounter = Counter.builder("job_digest_jobs_relevant_total")
                .description("Total postings at or above the minimum relevance")
                .register(registry);

        this.jobsNotifiedCounter = Counter.builder("job_digest_jobs_notified_total")
                .description("Total postings delivered in a digest")
                .register(registry);

        this.notificationFailuresCounter = Counter.builder("job_digest_notification_failures_total")
                .description("Total notification deliveries that failed")
                .register(registry);

        Gauge.builder("job_digest_last_run_jobs_saved", lastRunJobsSaved, AtomicInteger::get)
                .description("Postings saved in last alert scan")
                .register(registry);

        Gauge.builder("job_digest_last_run_jobs_relevant", lastRunJobsRelevant, AtomicInteger::get)
                .description("Relevant postings in last alert scan")
                .register(registry);

        Gauge.builder("job_digest_last_run_jobs_notified", lastRunJobsNotified, AtomicInteger::get)
                .description("Postings notified in last alert scan")
                .register(registry);
    }

    /**
     * Get or create a timer for a run kind.
     */
    public Timer getRunTimer(RunKind kind) {
        return runTimers.computeIfAbsent(kind, k ->
                Timer.builder("job_digest_run_duration")
                        .description("Wall time of a pipeline run")
                        .tag(TAG_KIND, k.getLabel())
                        .register(registry));
    }

    public void recordEmailsFetched(int count) {
        emailsFetchedCounter.increment(count);
    }

    public void recordJobRelatedEmails(int count) {
        emailsJobRelatedCounter.increment(count);
    }

    public void recordEmailProcessed() {
        emailsProcessedCounter.increment();
    }

    public void recordEmailFailure() {
        emailFailuresCounter.increment();
    }

    public void recordArchiveFailure() {
        archiveFailuresCounter.increment();
    }

    public void recordJobSaved() {
        jobsSavedCounter.increment();
    }

    public void recordDuplicateJob() {
        jobsDuplicateCounter.increment();
    }

    public void recordRelevantJob() {
        jobsRelevantCounter.increment();
    }

    public void recordJobsNotified(int count) {
        jobsNotifiedCounter.increment(count);
    }

    public void recordNotificationFailure() {
        notificationFailuresCounter.increment();
    }

    /**
     * Record the outcome of one run attempt ("completed", "retried", "failed").
     */
    public void recordRunOutcome(RunKind kind, String outcome, Duration duration) {
        Counter.builder("job_digest_runs_total")
                .tag(TAG_KIND, kind.getLabel())
                .tag(TAG_OUTCOME, outcome)
                .register(registry)
                .increment();
        if (duration != null) {
            getRunTimer(kind).record(duration);
        }
    }

    /**
     * Update last alert-scan statistics.
     */
    public void updateLastRunStats(AlertScanSummary summary) {
        lastRunJobsSaved.set(summary.jobsSaved());
        lastRunJobsRelevant.set(summary.relevantJobs());
        lastRunJobsNotified.set(summary.notifiedJobs());
    }
}
