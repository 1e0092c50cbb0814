package dev.jobdigest.model;

import java.util.List;

public record DailyStats(
        long totalJobsProcessed,
        long relevantJobs,
        long emailsProcessed,
        List<SourceCount> topSources) {
}
