package dev.jobdigest.notify;

import reactor.core.publisher.Mono;

/**
 * Delivery channel for notification text.
 */
public interface ChatTransport {

    String getName();

    /**
     * Send one message.
     *
     * @return Mono with a handle that can be passed to {@link #edit}, empty if the transport has none
     */
    Mono<String> send(String text);

    /**
     * Replace the text of a previously sent message.
     */
    Mono<Void> edit(String handle, String text);

    /**
     * Whether {@link #edit} is supported.
     */
    boolean supportsEdit();
}
