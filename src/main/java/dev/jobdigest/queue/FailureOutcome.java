package dev.jobdigest.queue;

public enum FailureOutcome {
    /** Requeued; a later attempt will pick it up after the backoff delay. */
    RETRY_SCHEDULED,
    /** Attempt ceiling reached; the run is FAILED for good. */
    FAILED_PERMANENTLY,
    /** The run was no longer active, nothing changed. */
    IGNORED
}
