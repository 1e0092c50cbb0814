package dev.jobdigest.schedule;

import dev.jobdigest.model.RunKind;

import java.time.Instant;

/**
 * A run the schedule wants enqueued, with its UTC fire time.
 */
public record ScheduledTrigger(RunKind kind, Instant fireAt) {
}
