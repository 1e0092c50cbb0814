package dev.jobdigest.queue;

import dev.jobdigest.model.RunPayload;
import dev.jobdigest.model.TriggerSource;

/**
 * Everything a {@link RunHandler} gets to know about the run it executes.
 */
public record RunContext(String runId, TriggerSource triggeredBy, RunPayload payload, ProgressListener progress) {
}
