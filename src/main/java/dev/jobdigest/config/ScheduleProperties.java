package dev.jobdigest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Civil-time schedule. Hours are local to {@code zone}; the scheduler converts to UTC.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "schedule")
public class ScheduleProperties {

    private boolean enabled = true;
    private String zone = "Asia/Manila";

    /** First local hour (inclusive) of the hourly alert-scan window. */
    private int windowStartHour = 6;

    /** Last local hour (inclusive) of the hourly alert-scan window. */
    private int windowEndHour = 20;

    private int dailySummaryHour = 21;
    private int retentionPruneHour = 3;

    /** Delay between scheduler ticks; read by the {@code @Scheduled} trigger. */
    private long tickIntervalMs = 30000;
}
