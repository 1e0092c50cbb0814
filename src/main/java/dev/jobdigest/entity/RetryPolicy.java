package dev.jobdigest.entity;

import dev.jobdigest.model.BackoffKind;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Retry policy attached to each queued run.
 */
@Data
@Builder
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    @Column(name = "retry_max_attempts", nullable = false)
    private int maxAttempts;

    @Enumerated(EnumType.STRING)
    @Column(name = "retry_backoff_kind", nullable = false, length = 20)
    private BackoffKind backoffKind;

    @Column(name = "retry_base_delay_ms", nullable = false)
    private long baseDelayMs;

    /**
     * Delay before the next attempt, given how many attempts already failed (1-based).
     */
    public Duration delayAfter(int failedAttempts) {
        if (backoffKind == BackoffKind.FIXED || failedAttempts <= 1) {
            return Duration.ofMillis(baseDelayMs);
        }
        int exponent = Math.min(failedAttempts - 1, 20);
        return Duration.ofMillis(baseDelayMs * (1L << exponent));
    }

    public boolean allowsRetryAfter(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }
}
