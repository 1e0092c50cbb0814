package dev.jobdigest.source;

import dev.jobdigest.model.EmailMessage;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Inbox the pipeline reads job alerts from.
 */
public interface EmailSource {

    /**
     * Get the name of this source (e.g., "IMAP").
     */
    String getName();

    /**
     * List recent unread messages, oldest first.
     */
    Mono<List<EmailMessage>> listRecent();

    /**
     * Mark a message as read, leaving it in the inbox.
     */
    Mono<Void> markRead(String messageId);

    /**
     * Mark a message as read and move it out of the inbox.
     */
    Mono<Void> markReadAndArchive(String messageId);
}
