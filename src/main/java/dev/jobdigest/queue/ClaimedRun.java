package dev.jobdigest.queue;

import dev.jobdigest.model.RunKind;
import dev.jobdigest.model.RunPayload;
import dev.jobdigest.model.TriggerSource;

/**
 * A run moved to ACTIVE by {@link WorkQueue#claimRunnable}, ready for its handler.
 */
public record ClaimedRun(String id, RunKind kind, TriggerSource triggeredBy, RunPayload payload, int attempt) {
}
