package dev.jobdigest.config;

import dev.jobdigest.model.BackoffKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Work queue retry, lease and retention settings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "queue")
public class QueueProperties {

    private int maxAttempts = 3;
    private BackoffKind backoffKind = BackoffKind.EXPONENTIAL;
    private Duration baseDelay = Duration.ofSeconds(2);

    /**
     * An active run whose lease is not renewed within this window is treated as crashed.
     */
    private Duration leaseTimeout = Duration.ofMinutes(30);

    private Duration retention = Duration.ofDays(7);
    private int workerThreads = 3;

    /** Set false to stop the worker from claiming runs (tests, maintenance). */
    private boolean workerEnabled = true;

    /** Delay between worker polls; read by the {@code @Scheduled} trigger. */
    private long pollIntervalMs = 5000;
}
