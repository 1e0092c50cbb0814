package dev.jobdigest.notify;

import dev.jobdigest.config.NotifierProperties;
import dev.jobdigest.config.PipelineProperties;
import dev.jobdigest.config.ScheduleProperties;
import dev.jobdigest.entity.JobPosting;
import dev.jobdigest.metrics.PipelineMetrics;
import dev.jobdigest.model.DailyStats;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TransportNotifierTest {

    private static final Instant NOW = Instant.parse("2026-03-10T02:00:00Z");

    @Mock
    private ChatTransport transport;

    private NotifierProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private TransportNotifier notifier;

    @BeforeEach
    void setUp() {
        properties = new NotifierProperties();
        meterRegistry = new SimpleMeterRegistry();
        MessageFormatter formatter = new MessageFormatter(new PipelineProperties(), new ScheduleProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        notifier = new TransportNotifier(transport, formatter, properties, new PipelineMetrics(meterRegistry));
        lenient().when(transport.getName()).thenReturn("test");
    }

    private JobPosting job(int index) {
        return JobPosting.builder()
                .id("j-" + index)
                .title("Java Developer " + index)
                .company("Acme")
                .applyUrl("https://www.linkedin.com/jobs/view/" + index)
                .source("LinkedIn")
                .relevanceScore(0.8)
                .emailMessageId("m-1")
                .createdAt(NOW)
                .build();
    }

    private double notificationFailures() {
        return meterRegistry.get("job_digest_notification_failures_total").counter().count();
    }

    @Nested
    @DisplayName("Digest delivery")
    class DigestTests {

        @Test
        @DisplayName("Should not send an empty digest")
        void shouldSkipEmptyDigest() {
            StepVerifier.create(notifier.sendDigest(List.of()))
                    .expectNext(true)
                    .verifyComplete();

            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("Should send a digest in one message")
        void shouldSendDigest() {
            when(transport.send(anyString())).thenReturn(Mono.just("h-1"));

            StepVerifier.create(notifier.sendDigest(List.of(job(1))))
                    .expectNext(true)
                    .verifyComplete();

            verify(transport).send(startsWith("⏰ **Hourly Batch Report** - 1 Jobs"));
        }

        @Test
        @DisplayName("Should send a long digest in labelled parts, in order")
        void shouldSplitLongDigest() {
            properties.setMaxMessageLength(400);
            when(transport.send(anyString())).thenReturn(Mono.just("h"));
            List<JobPosting> jobs = IntStream.rangeClosed(1, 10).mapToObj(TransportNotifierTest.this::job).toList();

            StepVerifier.create(notifier.sendDigest(jobs))
                    .expectNext(true)
                    .verifyComplete();

            ArgumentCaptor<String> parts = ArgumentCaptor.forClass(String.class);
            verify(transport, atLeast(2)).send(parts.capture());
            assertThat(parts.getAllValues().get(0)).startsWith("⏰ **Hourly Batch Report**");
            assertThat(parts.getAllValues().get(1)).startsWith("📋 **Job Report (Part 2)**");
            assertThat(parts.getAllValues()).allMatch(part -> part.length() <= 400);
        }

        @Test
        @DisplayName("Should report failure instead of erroring when the transport fails")
        void shouldReportTransportFailure() {
            when(transport.send(anyString())).thenReturn(Mono.error(new IllegalStateException("SMTP down")));

            StepVerifier.create(notifier.sendDigest(List.of(job(1))))
                    .expectNext(false)
                    .verifyComplete();

            assertThat(notificationFailures()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should complete status and error sends even when delivery fails")
        void shouldSwallowStatusFailure() {
            when(transport.send(anyString())).thenReturn(Mono.error(new IllegalStateException("SMTP down")));

            StepVerifier.create(notifier.sendStatus("hello")).verifyComplete();
            StepVerifier.create(notifier.sendError("boom")).verifyComplete();

            assertThat(notificationFailures()).isEqualTo(2.0);
        }

        @Test
        void shouldSendDailySummary() {
            when(transport.send(anyString())).thenReturn(Mono.empty());

            StepVerifier.create(notifier.sendDailySummary(List.of(job(1)), new DailyStats(1, 1, 1, List.of()),
                            LocalDate.of(2026, 3, 10)))
                    .expectNext(true)
                    .verifyComplete();

            verify(transport).send(startsWith("🌙 **Daily Job Digest Summary - March 10, 2026**"));
        }
    }

    @Nested
    @DisplayName("Progress messages")
    class ProgressTests {

        @Test
        @DisplayName("Should create no progress message when the transport cannot edit")
        void shouldSkipWithoutEditSupport() {
            when(transport.supportsEdit()).thenReturn(false);

            StepVerifier.create(notifier.createProgressMessage("⏳ Jobs queued")).verifyComplete();
            StepVerifier.create(notifier.updateProgressMessage("h-1", "Halfway")).verifyComplete();

            verify(transport, never()).send(anyString());
            verify(transport, never()).edit(anyString(), anyString());
        }

        @Test
        @DisplayName("Should create and edit a progress message")
        void shouldCreateAndEdit() {
            when(transport.supportsEdit()).thenReturn(true);
            when(transport.send("🤖 *Job Bot Status*\n\n⏳ Jobs queued")).thenReturn(Mono.just("h-1"));
            when(transport.edit("h-1", "🤖 *Job Bot Status*\n\nHalfway")).thenReturn(Mono.empty());

            StepVerifier.create(notifier.createProgressMessage("⏳ Jobs queued"))
                    .expectNext("h-1")
                    .verifyComplete();
            StepVerifier.create(notifier.updateProgressMessage("h-1", "Halfway")).verifyComplete();
        }

        @Test
        @DisplayName("Should drop failed edits silently")
        void shouldDropFailedEdit() {
            when(transport.supportsEdit()).thenReturn(true);
            when(transport.edit(anyString(), anyString()))
                    .thenReturn(Mono.error(new IllegalArgumentException("Unknown message handle")));

            StepVerifier.create(notifier.updateProgressMessage("gone", "Halfway")).verifyComplete();

            assertThat(notificationFailures()).isZero();
        }

        @Test
        void shouldIgnoreMissingHandle() {
            StepVerifier.create(notifier.updateProgressMessage(null, "Halfway")).verifyComplete();

            verifyNoInteractions(transport);
        }
    }
}
