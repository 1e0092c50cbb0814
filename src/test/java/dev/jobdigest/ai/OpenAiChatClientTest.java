package dev.jobdigest.ai;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobdigest.config.LlmProperties;
import dev.jobdigest.entity.ResumeProfile;
import dev.jobdigest.model.EmailPreview;
import dev.jobdigest.model.JobPostingDraft;
import dev.jobdigest.model.ResumeDocument;
import dev.jobdigest.model.Seniority;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiChatClientTest {

    private static final Instant NOW = Instant.parse("2026-03-10T02:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ResumeProfile profile = ResumeProfile.builder()
            .skills(List.of("Java", "Spring Boot"))
            .experience(List.of("8 years backend"))
            .preferredRoles(List.of("Backend Engineer"))
            .seniority(Seniority.SENIOR)
            .analyzedAt(NOW)
            .build();

    private final JobPostingDraft draft = JobPostingDraft.builder()
            .title("Senior Java Developer")
            .company("Acme")
            .location("Remote")
            .remote(true)
            .build();

    private MockWebServer mockWebServer;
    private OpenAiChatClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        LlmProperties properties = new LlmProperties();
        properties.setApiKey("test-api-key");
        properties.setBaseUrl(mockWebServer.url("/v1").toString());
        properties.setRetryBackoff(Duration.ofMillis(10));
        properties.setTimeout(Duration.ofSeconds(5));
        client = new OpenAiChatClient(properties, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private void enqueueCompletion(String content) throws IOException {
        String body = objectMapper.writeValueAsString(
                Map.of("choices", List.of(Map.of("message", Map.of("role", "assistant", "content", content)))));
        mockWebServer.enqueue(new MockResponse()
                .setBody(body)
                .setHeader("Content-Type", "application/json"));
    }

    private JsonNode takeRequestBody() throws InterruptedException, IOException {
        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-api-key");
        return objectMapper.readTree(request.getBody().readUtf8());
    }

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @Test
        @DisplayName("Should parse a fenced JSON answer and clamp confidence")
        void shouldClassifyBatch() throws Exception {
            enqueueCompletion("""
                    ```json
                    [{"id": "m-1", "isJobRelated": true, "confidence": 0.93},
                     {"id": "m-2", "isJobRelated": false, "confidence": 1.7},
                     {"isJobRelated": true, "confidence": 0.9}]
                    ```""");

            List<EmailPreview> previews = List.of(
                    new EmailPreview("m-1", "jobs-noreply@linkedin.com", "5 new Java jobs", "Senior Java Developer at Acme"),
                    new EmailPreview("m-2", "friend@example.com", "Lunch?", "Are you free friday"));

            StepVerifier.create(client.classifyBatch(previews))
                    .assertNext(results -> {
                        assertThat(results).hasSize(2);
                        assertThat(results.get(0).id()).isEqualTo("m-1");
                        assertThat(results.get(0).jobRelated()).isTrue();
                        assertThat(results.get(0).confidence()).isEqualTo(0.93);
                        assertThat(results.get(1).jobRelated()).isFalse();
                        assertThat(results.get(1).confidence()).isEqualTo(1.0);
                    })
                    .verifyComplete();

            JsonNode request = takeRequestBody();
            assertThat(request.get("model").asText()).isEqualTo("gpt-4o-mini");
            assertThat(request.get("messages").get(1).get("content").asText()).contains("(ID: m-1)");
        }

        @Test
        @DisplayName("Should not call the API for an empty batch")
        void shouldSkipEmptyBatch() {
            StepVerifier.create(client.classifyBatch(List.of()))
                    .assertNext(results -> assertThat(results).isEmpty())
                    .verifyComplete();

            assertThat(mockWebServer.getRequestCount()).isZero();
        }

        @Test
        @DisplayName("Should fail on an answer that is not JSON")
        void shouldFailOnGarbage() throws Exception {
            enqueueCompletion("Sorry, I cannot help with that.");

            StepVerifier.create(client.classifyBatch(List.of(new EmailPreview("m-1", "a", "b", "c"))))
                    .expectError(LlmResponseException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Extraction")
    class ExtractionTests {

        @Test
        @DisplayName("Should map extracted jobs to drafts")
        void shouldExtractJobs() throws Exception {
            enqueueCompletion("""
                    [{"title": "Senior Java Developer", "company": "Acme", "location": "Makati (Work from home)",
                      "isRemote": false, "description": "Build services", "requirements": ["Java", "Spring"],
                      "applyUrl": "https://www.linkedin.com/jobs/view/1", "salary": null,
                      "postedDate": "2026-03-09", "source": ""},
                     {"title": "Go Developer", "company": "Beta", "location": "Taguig", "isRemote": true,
                      "applyUrl": "https://www.linkedin.com/jobs/view/2", "postedDate": "last week",
                      "source": "LinkedIn"}]""");

            StepVerifier.create(client.extractJobs("email body", "Jobs for you", "jobs-noreply@jobstreet.com"))
                    .assertNext(drafts -> {
                        assertThat(drafts).hasSize(2);
                        JobPostingDraft first = drafts.get(0);
                        assertThat(first.getTitle()).isEqualTo("Senior Java Developer");
                        assertThat(first.isRemote()).isTrue();
                        assertThat(first.getRequirements()).containsExactly("Java", "Spring");
                        assertThat(first.getPostedDate()).isEqualTo(LocalDate.of(2026, 3, 9));
                        assertThat(first.getSource()).isEqualTo("JobStreet");

                        JobPostingDraft second = drafts.get(1);
                        assertThat(second.isRemote()).isTrue();
                        assertThat(second.getPostedDate()).isNull();
                        assertThat(second.getRequirements()).isEmpty();
                        assertThat(second.getSource()).isEqualTo("LinkedIn");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should return no drafts for an empty array")
        void shouldHandleNoJobs() throws Exception {
            enqueueCompletion("[]");

            StepVerifier.create(client.extractJobs("newsletter", "Weekly digest", "news@example.com"))
                    .assertNext(drafts -> assertThat(drafts).isEmpty())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Scoring")
    class ScoringTests {

        @Test
        @DisplayName("Should read the score from the answer")
        void shouldScore() throws Exception {
            enqueueCompletion("Score: 0.85");

            StepVerifier.create(client.score(draft, profile))
                    .expectNext(0.85)
                    .verifyComplete();

            assertThat(takeRequestBody().get("messages").get(1).get("content").asText())
                    .contains("Skills: Java, Spring Boot")
                    .contains("Seniority: SENIOR");
        }

        @Test
        void shouldClampAndDefaultScores() {
            assertThat(client.parseScore("no idea")).isEqualTo(0.0);
            assertThat(client.parseScore("0.4")).isEqualTo(0.4);
            assertThat(client.parseScore("1")).isEqualTo(1.0);
            assertThat(client.parseScore("250")).isEqualTo(1.0);
        }

        @Test
        void shouldReadLeadingDotAndPercentScores() {
            assertThat(client.parseScore(".85")).isEqualTo(0.85);
            assertThat(client.parseScore("Score: .85")).isEqualTo(0.85);
            assertThat(client.parseScore("85%")).isEqualTo(0.85);
            assertThat(client.parseScore("85")).isEqualTo(0.85);
            assertThat(client.parseScore("0.5%")).isEqualTo(0.005);
        }
    }

    @Test
    @DisplayName("Should build a resume profile with de-duplicated skills")
    void shouldAnalyzeResume() throws Exception {
        enqueueCompletion("""
                {"skills": ["Java", "Kafka", "Java"], "experience": ["Led payments team"],
                 "preferredRoles": ["Backend Engineer"], "seniority": "Senior"}""");

        StepVerifier.create(client.analyze(new ResumeDocument("resume.txt", "Jane Doe, Senior Java Engineer")))
                .assertNext(profile -> {
                    assertThat(profile.getSkills()).containsExactly("Java", "Kafka");
                    assertThat(profile.getExperience()).containsExactly("Led payments team");
                    assertThat(profile.getSeniority()).isEqualTo(Seniority.SENIOR);
                    assertThat(profile.getAnalyzedAt()).isEqualTo(NOW);
                    assertThat(profile.getId()).isNull();
                })
                .verifyComplete();
    }

    @Nested
    @DisplayName("Transport errors")
    class ErrorTests {

        @Test
        @DisplayName("Should retry server errors and succeed")
        void shouldRetryServerError() throws Exception {
            mockWebServer.enqueue(new MockResponse().setResponseCode(500));
            mockWebServer.enqueue(new MockResponse().setResponseCode(429));
            enqueueCompletion("0.7");

            StepVerifier.create(client.score(draft, profile))
                    .expectNext(0.7)
                    .verifyComplete();

            assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should give up after the configured retries")
        void shouldGiveUpAfterRetries() {
            for (int i = 0; i < 3; i++) {
                mockWebServer.enqueue(new MockResponse().setResponseCode(503));
            }

            StepVerifier.create(client.score(draft, profile))
                    .expectError(WebClientResponseException.ServiceUnavailable.class)
                    .verify();

            assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should not retry client errors")
        void shouldNotRetryClientError() {
            mockWebServer.enqueue(new MockResponse().setResponseCode(401));

            StepVerifier.create(client.score(draft, profile))
                    .expectError(WebClientResponseException.Unauthorized.class)
                    .verify();

            assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should fail on an empty completion")
        void shouldFailOnEmptyCompletion() throws Exception {
            enqueueCompletion("  ");

            StepVerifier.create(client.score(draft, profile))
                    .expectError(LlmResponseException.class)
                    .verify();
        }
    }

    @Test
    void shouldStripFencesBeforeParsing() {
        List<String> parsed = client.parse("```json\n[\"a\", \"b\"]\n```", new TypeReference<List<String>>() {
        });

        assertThat(parsed).containsExactly("a", "b");
        assertThatThrownBy(() -> client.parse("{broken", new TypeReference<List<String>>() {
        })).isInstanceOf(LlmResponseException.class);
    }

    @Test
    void shouldDetermineSourceFromSender() {
        assertThat(OpenAiChatClient.determineSource("LinkedIn Job Alerts <jobalerts-noreply@linkedin.com>"))
                .isEqualTo("LinkedIn");
        assertThat(OpenAiChatClient.determineSource("alerts@indeed.com")).isEqualTo("Indeed");
        assertThat(OpenAiChatClient.determineSource(null)).isEqualTo("Unknown");
    }
}
