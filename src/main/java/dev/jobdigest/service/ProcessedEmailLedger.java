package dev.jobdigest.service;

import dev.jobdigest.entity.ProcessedEmailRecord;
import dev.jobdigest.repository.ProcessedEmailRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Idempotency ledger of processed emails, keyed by message id.
 * A record is written before any inbox side effect and is never removed on its failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProcessedEmailLedger {

    private final ProcessedEmailRepository processedEmailRepository;
    private final Clock clock;

    /**
     * Check if a message has already been processed.
     *
     * @param messageId The inbox message id
     * @return true if a ledger record exists
     */
    public boolean isProcessed(String messageId) {
        return processedEmailRepository.existsById(messageId);
    }

    /**
     * Record a message as processed, not archived. Overwrites an earlier record for the same id.
     *
     * @param messageId     The inbox message id
     * @param subject       Subject line, for operator inspection
     * @param sender        Sender address
     * @param jobsExtracted Number of postings persisted from the message
     * @return the saved record
     */
    @Transactional
    public ProcessedEmailRecord record(String messageId, String subject, String sender, int jobsExtracted) {
        ProcessedEmailRecord record = ProcessedEmailRecord.builder()
                .messageId(messageId)
                .subject(truncate(subject, 1000))
                .sender(truncate(sender, 500))
                .jobsExtracted(jobsExtracted)
                .archived(false)
                .processedAt(Instant.now(clock))
                .build();

        ProcessedEmailRecord saved = processedEmailRepository.save(record);
        log.debug("Email {} recorded as processed ({} jobs)", messageId, jobsExtracted);
        return saved;
    }

    /**
     * Flag an already recorded message as archived.
     *
     * @param messageId The inbox message id
     */
    @Transactional
    public void markArchived(String messageId) {
        processedEmailRepository.findById(messageId).ifPresentOrElse(record -> {
            record.setArchived(true);
            processedEmailRepository.save(record);
        }, () -> log.warn("Cannot mark email {} archived: no ledger record", messageId));
    }

    /**
     * Count messages processed within [start, end).
     */
    public long countProcessedBetween(Instant start, Instant end) {
        return processedEmailRepository.countByProcessedAtGreaterThanEqualAndProcessedAtLessThan(start, end);
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
