package dev.jobdigest.model;

public enum RunStatus {
    QUEUED,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isInFlight() {
        return this == QUEUED || this == ACTIVE;
    }
}
