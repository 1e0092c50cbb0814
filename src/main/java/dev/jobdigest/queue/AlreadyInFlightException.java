package dev.jobdigest.queue;

import dev.jobdigest.model.RunKind;
import lombok.Getter;

/**
 * Thrown by {@link WorkQueue#enqueue} when a run of the same kind is already queued or active.
 */
@Getter
public class AlreadyInFlightException extends RuntimeException {

    private final RunKind kind;

    public AlreadyInFlightException(RunKind kind) {
        super("A " + kind.getLabel() + " run is already queued or active");
        this.kind = kind;
    }
}
