package dev.jobdigest.pipeline;

import dev.jobdigest.model.RunKind;
import dev.jobdigest.model.RunPayload;
import dev.jobdigest.model.TriggerSource;
import dev.jobdigest.notify.Notifier;
import dev.jobdigest.queue.AlreadyInFlightException;
import dev.jobdigest.queue.WorkQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;

/**
 * Operator-initiated runs. Uses the same single-flight enqueue path as the scheduler and,
 * where the transport allows it, creates a progress message the run edits as it goes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunTriggerService {

    private final WorkQueue queue;
    private final Notifier notifier;

    /**
     * Queue a manual run.
     *
     * @param kind    Run kind
     * @param payload Run parameters
     * @return Mono with the run id, or an {@link AlreadyInFlightException} error
     */
    public Mono<String> trigger(RunKind kind, RunPayload payload) {
        RunPayload base = payload != null ? payload : RunPayload.empty();
        return Mono.fromCallable(() -> queue.currentRun(kind).isPresent())
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(inFlight -> inFlight
                        ? rejectInFlight(kind, Optional.empty())
                        : createProgressMessage(kind).flatMap(handle -> enqueue(kind, base, handle)));
    }

    private Mono<Optional<String>> createProgressMessage(RunKind kind) {
        String text = kind == RunKind.ALERT_SCAN ? "⏳ Jobs queued" : "⏳ " + kind.getLabel() + " queued";
        return notifier.createProgressMessage(text)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private Mono<String> enqueue(RunKind kind, RunPayload payload, Optional<String> handle) {
        return Mono.fromCallable(() -> queue.enqueue(kind, TriggerSource.MANUAL,
                        payload.withProgressHandle(handle.orElse(null))))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(runId -> log.info("Manual {} run {} queued", kind.getLabel(), runId))
                .onErrorResume(AlreadyInFlightException.class, e -> rejectInFlight(kind, handle));
    }

    private Mono<String> rejectInFlight(RunKind kind, Optional<String> progressHandle) {
        log.info("Manual {} rejected: already in flight", kind.getLabel());
        Mono<Void> retire = progressHandle
                .map(handle -> notifier.updateProgressMessage(handle, "⏳ Already processing"))
                .orElse(Mono.empty());
        return retire
                .then(notifier.sendStatus("⏳ Already processing " + kind.getLabel()
                        + ". Please wait for the current run to finish."))
                .then(Mono.<String>error(new AlreadyInFlightException(kind)));
    }
}
