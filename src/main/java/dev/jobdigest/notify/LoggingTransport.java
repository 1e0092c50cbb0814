package dev.jobdigest.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Dry-run transport that writes every message to the application log.
 * Remembers the most recent handles so progress edits can be logged against them;
 * older handles are evicted and can no longer be edited.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "notifier.transport", havingValue = "logging", matchIfMissing = true)
public class LoggingTransport implements ChatTransport {

    static final int MAX_TRACKED_HANDLES = 256;

    private final Map<String, String> sent = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                    return size() > MAX_TRACKED_HANDLES;
                }
            });

    @Override
    public String getName() {
        return "logging";
    }

    @Override
    public Mono<String> send(String text) {
        return Mono.fromCallable(() -> {
            String handle = UUID.randomUUID().toString();
            sent.put(handle, text);
            log.info("[notify {}]\n{}", handle, text);
            return handle;
        });
    }

    @Override
    public Mono<Void> edit(String handle, String text) {
        return Mono.fromRunnable(() -> {
            if (sent.replace(handle, text) == null) {
                throw new IllegalArgumentException("Unknown message handle: " + handle);
            }
            log.info("[edit {}] {}", handle, text);
        });
    }

    @Override
    public boolean supportsEdit() {
        return true;
    }

    int sentCount() {
        return sent.size();
    }
}
