package dev.jobdigest.schedule;

import dev.jobdigest.config.ScheduleProperties;
import dev.jobdigest.model.RunKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Civil-time cron rules evaluated in the configured zone.
 * Pure: the same interval always yields the same triggers, each with a UTC fire time.
 */
@Slf4j
@Component
public class SchedulePolicy {

    private final ZoneId zone;
    private final Map<RunKind, CronExpression> rules = new EnumMap<>(RunKind.class);

    public SchedulePolicy(ScheduleProperties properties) {
        validateHour("window-start-hour", properties.getWindowStartHour());
        validateHour("window-end-hour", properties.getWindowEndHour());
        validateHour("daily-summary-hour", properties.getDailySummaryHour());
        validateHour("retention-prune-hour", properties.getRetentionPruneHour());
        if (properties.getWindowStartHour() > properties.getWindowEndHour()) {
            throw new IllegalArgumentException("schedule.window-start-hour must not be after schedule.window-end-hour");
        }

        this.zone = ZoneId.of(properties.getZone());
        rules.put(RunKind.ALERT_SCAN, CronExpression.parse(
                "0 0 " + properties.getWindowStartHour() + "-" + properties.getWindowEndHour() + " * * *"));
        rules.put(RunKind.DAILY_SUMMARY, CronExpression.parse("0 0 " + properties.getDailySummaryHour() + " * * *"));
        rules.put(RunKind.RETENTION_PRUNE, CronExpression.parse("0 0 " + properties.getRetentionPruneHour() + " * * *"));

        log.info("Schedule in {}: alert scan hourly {}:00-{}:00, daily summary {}:00, retention prune {}:00",
                zone, properties.getWindowStartHour(), properties.getWindowEndHour(),
                properties.getDailySummaryHour(), properties.getRetentionPruneHour());
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Every trigger with a fire time in {@code (fromExclusive, toInclusive]}, ordered by fire time.
     */
    public List<ScheduledTrigger> triggersBetween(Instant fromExclusive, Instant toInclusive) {
        List<ScheduledTrigger> triggers = new ArrayList<>();
        if (!toInclusive.isAfter(fromExclusive)) {
            return triggers;
        }
        ZonedDateTime start = fromExclusive.atZone(zone);
        rules.forEach((kind, cron) -> {
            ZonedDateTime next = cron.next(start);
            while (next != null && !next.toInstant().isAfter(toInclusive)) {
                triggers.add(new ScheduledTrigger(kind, next.toInstant()));
                next = cron.next(next);
            }
        });
        triggers.sort(Comparator.comparing(ScheduledTrigger::fireAt).thenComparing(ScheduledTrigger::kind));
        return triggers;
    }

    public ZonedDateTime nextAlertScan(Instant now) {
        return next(RunKind.ALERT_SCAN, now);
    }

    public ZonedDateTime nextDailySummary(Instant now) {
        return next(RunKind.DAILY_SUMMARY, now);
    }

    public NextRun nextRun(Instant now) {
        return new NextRun(now.atZone(zone), nextAlertScan(now), nextDailySummary(now));
    }

    private ZonedDateTime next(RunKind kind, Instant now) {
        return rules.get(kind).next(now.atZone(zone));
    }

    private static void validateHour(String name, int hour) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("schedule." + name + " must be between 0 and 23, got " + hour);
        }
    }
}
