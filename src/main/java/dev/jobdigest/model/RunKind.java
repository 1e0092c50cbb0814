package dev.jobdigest.model;

/**
 * Kinds of pipeline runs. Each kind is single-flight in the work queue.
 */
public enum RunKind {
    ALERT_SCAN("alert-scan"),
    DAILY_SUMMARY("daily-summary"),
    RETENTION_PRUNE("retention-prune");

    private final String label;

    RunKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolve a kind from its label ("alert-scan") or enum name ("ALERT_SCAN").
     */
    public static RunKind fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Run kind is required");
        }
        for (RunKind kind : values()) {
            if (kind.label.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown run kind: " + value);
    }
}
