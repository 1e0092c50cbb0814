package dev.jobdigest.model;

/**
 * Totals of one alert-scan run.
 */
public record AlertScanSummary(
        int emailsFetched,
        int jobRelatedEmails,
        int emailsProcessed,
        int emailsSkipped,
        int failedEmails,
        int jobsSaved,
        int duplicatesSkipped,
        int relevantJobs,
        int notifiedJobs) {

    public String describe() {
        return String.format("%d new, %d duplicates, %d relevant, %d sent, %d failed emails",
                jobsSaved, duplicatesSkipped, relevantJobs, notifiedJobs, failedEmails);
    }
}
