package dev.jobdigest.queue;

import dev.jobdigest.model.RunKind;
import reactor.core.publisher.Mono;

/**
 * Executes runs of one {@link RunKind}. An error signal from {@link #execute} fails the attempt.
 */
public interface RunHandler {

    RunKind kind();

    /**
     * @return Mono with a one-line result summary stored on the completed run
     */
    Mono<String> execute(RunContext context);
}
