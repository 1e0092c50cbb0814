package dev.jobdigest.pipeline;

import dev.jobdigest.model.RunKind;
import dev.jobdigest.queue.RunContext;
import dev.jobdigest.queue.RunHandler;
import dev.jobdigest.queue.WorkQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Housekeeping run that deletes finished queue entries past the retention window.
 * Postings and ledger records are kept.
 */
@Service
@RequiredArgsConstructor
public class RetentionPruneHandler implements RunHandler {

    private final WorkQueue queue;
    private final Clock clock;

    @Override
    public RunKind kind() {
        return RunKind.RETENTION_PRUNE;
    }

    @Override
    public Mono<String> execute(RunContext context) {
        return Mono.fromCallable(() -> {
            context.progress().onProgress(10, "Pruning finished runs...");
            int deleted = queue.pruneFinished(clock.instant());
            return "Deleted " + deleted + " finished runs";
        });
    }
}
