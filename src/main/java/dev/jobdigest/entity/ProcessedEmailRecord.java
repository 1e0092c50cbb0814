package dev.jobdigest.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Idempotency ledger entry. Existence of a row means the message is never processed again.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "processed_emails", indexes = {
        @Index(name = "idx_processed_at", columnList = "processedAt")
})
public class ProcessedEmailRecord {

    @Id
    @Column(length = 255)
    private String messageId;

    @Column(length = 1000)
    private String subject;

    @Column(length = 500)
    private String sender;

    private int jobsExtracted;

    private boolean archived;

    @Column(nullable = false)
    private Instant processedAt;
}
