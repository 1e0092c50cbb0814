package dev.jobdigest.model;

import java.util.Locale;

/**
 * Seniority level inferred from a resume.
 */
public enum Seniority {
    JUNIOR,
    MID,
    SENIOR,
    LEAD,
    PRINCIPAL;

    /**
     * Lenient parse of an LLM label; unknown or blank values map to MID.
     */
    public static Seniority fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MID;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("JR") || normalized.contains("JUNIOR") || normalized.contains("ENTRY")) {
            return JUNIOR;
        }
        if (normalized.startsWith("SR") || normalized.contains("SENIOR")) {
            return SENIOR;
        }
        if (normalized.contains("PRINCIPAL") || normalized.contains("STAFF")) {
            return PRINCIPAL;
        }
        if (normalized.contains("LEAD")) {
            return LEAD;
        }
        return MID;
    }
}
