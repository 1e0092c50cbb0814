package dev.jobdigest.schedule;

import java.time.ZonedDateTime;

/**
 * Upcoming scheduled runs as seen from {@code now}, all in the schedule zone.
 */
public record NextRun(ZonedDateTime now, ZonedDateTime nextAlertScan, ZonedDateTime nextDailySummary) {
}
