package dev.jobdigest.notify;

import dev.jobdigest.config.NotifierProperties;
import dev.jobdigest.entity.JobPosting;
import dev.jobdigest.metrics.PipelineMetrics;
import dev.jobdigest.model.DailyStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * Notifier that formats messages and delivers them through the configured {@link ChatTransport}.
 * Long messages are split into parts and sent in order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransportNotifier implements Notifier {

    private final ChatTransport transport;
    private final MessageFormatter formatter;
    private final NotifierProperties properties;
    private final PipelineMetrics metrics;

    @Override
    public Mono<Boolean> sendDigest(List<JobPosting> postings) {
        if (postings.isEmpty()) {
            return Mono.just(true);
        }
        return deliver(formatter.formatDigest(postings), "Job Report")
                .doOnNext(sent -> {
                    if (sent) {
                        log.info("Digest with {} postings sent via {}", postings.size(), transport.getName());
                    }
                });
    }

    @Override
    public Mono<Boolean> sendDailySummary(List<JobPosting> jobs, DailyStats stats, LocalDate day) {
        return deliver(formatter.formatDailySummary(jobs, stats, day), "Daily Summary");
    }

    @Override
    public Mono<Void> sendStatus(String text) {
        return deliver(formatter.formatStatus(text), "Status").then();
    }

    @Override
    public Mono<Void> sendError(String text) {
        return deliver(formatter.formatError(text), "Error").then();
    }

    @Override
    public Mono<String> createProgressMessage(String text) {
        if (!transport.supportsEdit()) {
            return Mono.empty();
        }
        return transport.send(formatter.formatStatus(text))
                .onErrorResume(e -> {
                    log.warn("Failed to create progress message: {}", e.getMessage());
                    metrics.recordNotificationFailure();
                    return Mono.empty();
                });
    }

    @Override
    public Mono<Void> updateProgressMessage(String handle, String text) {
        if (handle == null || !transport.supportsEdit()) {
            return Mono.empty();
        }
        return transport.edit(handle, formatter.formatStatus(text))
                .onErrorResume(e -> {
                    log.debug("Progress edit for {} dropped: {}", handle, e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Boolean> deliver(String message, String title) {
        List<String> parts = formatter.split(message, title, properties.getMaxMessageLength());
        return Flux.fromIterable(parts)
                .concatMap(transport::send)
                .then(Mono.just(true))
                .onErrorResume(e -> {
                    log.error("Failed to deliver {} via {}: {}", title, transport.getName(), e.getMessage(), e);
                    metrics.recordNotificationFailure();
                    return Mono.just(false);
                });
    }
}
