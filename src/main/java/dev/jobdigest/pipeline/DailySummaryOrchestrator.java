package dev.jobdigest.pipeline;

import dev.jobdigest.config.PipelineProperties;
import dev.jobdigest.entity.JobPosting;
import dev.jobdigest.model.DailyStats;
import dev.jobdigest.model.RunKind;
import dev.jobdigest.notify.Notifier;
import dev.jobdigest.queue.ProgressListener;
import dev.jobdigest.queue.RunContext;
import dev.jobdigest.queue.RunHandler;
import dev.jobdigest.schedule.SchedulePolicy;
import dev.jobdigest.service.JobStore;
import dev.jobdigest.service.ProcessedEmailLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Daily summary run: relevant postings created during the local civil day plus day totals.
 * Read-only; any failure, including an undelivered summary, fails the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailySummaryOrchestrator implements RunHandler {

    private final JobStore jobStore;
    private final ProcessedEmailLedger ledger;
    private final Notifier notifier;
    private final SchedulePolicy schedulePolicy;
    private final PipelineProperties properties;
    private final Clock clock;

    @Override
    public RunKind kind() {
        return RunKind.DAILY_SUMMARY;
    }

    @Override
    public Mono<String> execute(RunContext context) {
        return run(context.progress());
    }

    public Mono<String> run(ProgressListener progress) {
        ZoneId zone = schedulePolicy.getZone();
        LocalDate day = clock.instant().atZone(zone).toLocalDate();
        Instant start = day.atStartOfDay(zone).toInstant();
        Instant end = day.plusDays(1).atStartOfDay(zone).toInstant();
        double minScore = properties.getDailySummary().getMinScore();

        return Mono.fromRunnable(() -> progress.onProgress(10, "Starting daily summary..."))
                .then(Mono.fromCallable(() -> jobStore.findRelevantCreatedBetween(start, end, minScore)))
                .flatMap(jobs -> {
                    log.info("Daily summary for {}: {} relevant jobs", day, jobs.size());
                    progress.onProgress(50, "Collecting daily statistics...");
                    DailyStats stats = collectStats(start, end, minScore);
                    progress.onProgress(90, "Sending daily summary...");
                    return send(jobs, stats, day);
                });
    }

    private DailyStats collectStats(Instant start, Instant end, double minScore) {
        return new DailyStats(
                jobStore.countCreatedBetween(start, end),
                jobStore.countRelevantCreatedBetween(start, end, minScore),
                ledger.countProcessedBetween(start, end),
                jobStore.topSources(start, end, properties.getDailySummary().getTopSources()));
    }

    private Mono<String> send(List<JobPosting> jobs, DailyStats stats, LocalDate day) {
        return notifier.sendDailySummary(jobs, stats, day)
                .defaultIfEmpty(false)
                .flatMap(sent -> sent
                        ? Mono.just(String.format("Daily summary for %s sent: %d relevant of %d jobs, %d emails",
                                day, jobs.size(), stats.totalJobsProcessed(), stats.emailsProcessed()))
                        : Mono.<String>error(new IllegalStateException("Daily summary for " + day + " was not delivered")));
    }
}
