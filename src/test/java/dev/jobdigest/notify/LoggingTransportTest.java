package dev.jobdigest.notify;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingTransportTest {

    private final LoggingTransport transport = new LoggingTransport();

    @Test
    void shouldReturnEditableHandle() {
        String handle = transport.send("⏳ Jobs queued").block();

        assertThat(handle).isNotBlank();
        assertThat(transport.supportsEdit()).isTrue();
        StepVerifier.create(transport.edit(handle, "Processing 3 job emails... (40%)")).verifyComplete();
        assertThat(transport.sentCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectUnknownHandle() {
        StepVerifier.create(transport.edit("nope", "text"))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void shouldOnlyTrackRecentHandles() {
        String first = transport.send("Job Report 0").block();
        String last = null;
        for (int i = 1; i < 5000; i++) {
            last = transport.send("Job Report " + i).block();
        }

        assertThat(transport.sentCount()).isEqualTo(LoggingTransport.MAX_TRACKED_HANDLES);
        StepVerifier.create(transport.edit(last, "edited")).verifyComplete();
        StepVerifier.create(transport.edit(first, "edited"))
                .expectError(IllegalArgumentException.class)
                .verify();
    }
}
