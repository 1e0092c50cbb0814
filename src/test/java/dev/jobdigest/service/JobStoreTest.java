package dev.jobdigest.service;

import dev.jobdigest.entity.JobPosting;
import dev.jobdigest.model.JobPostingDraft;
import dev.jobdigest.model.SourceCount;
import dev.jobdigest.repository.JobPostingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-10T02:00:00Z");

    @Mock
    private JobPostingRepository repository;

    private JobStore jobStore;

    @BeforeEach
    void setUp() {
        jobStore = new JobStore(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JobPostingDraft.JobPostingDraftBuilder draft() {
        return JobPostingDraft.builder()
                .title("Senior Java Developer")
                .company("Acme")
                .location("Manila")
                .applyUrl("https://www.linkedin.com/jobs/view/123")
                .source("LinkedIn");
    }

    @Nested
    @DisplayName("Duplicate detection")
    class DuplicateTests {

        @Test
        @DisplayName("Should treat a known apply URL as duplicate")
        void shouldMatchOnUrl() {
            when(repository.existsByApplyUrl("https://www.linkedin.com/jobs/view/123")).thenReturn(true);

            assertThat(jobStore.isDuplicate(draft().build())).isTrue();
            verify(repository, never()).existsByTitleIgnoreCaseAndCompanyIgnoreCase(anyString(), anyString());
        }

        @Test
        @DisplayName("Should fall back to title and company")
        void shouldMatchOnTitleAndCompany() {
            when(repository.existsByApplyUrl(anyString())).thenReturn(false);
            when(repository.existsByTitleIgnoreCaseAndCompanyIgnoreCase("Senior Java Developer", "Acme"))
                    .thenReturn(true);

            assertThat(jobStore.isDuplicate(draft().title("  Senior Java Developer ").build())).isTrue();
        }

        @Test
        @DisplayName("Should normalise the URL before lookup")
        void shouldCleanUrl() {
            when(repository.existsByApplyUrl("https://jobstreet.com/job/9")).thenReturn(true);

            assertThat(jobStore.isDuplicate(draft().applyUrl(" jobstreet.com/job/9\u200B ").build())).isTrue();
        }

        @Test
        @DisplayName("Should ignore placeholder URLs when checking duplicates")
        void shouldIgnorePlaceholderUrl() {
            when(repository.existsByTitleIgnoreCaseAndCompanyIgnoreCase("Senior Java Developer", "Acme"))
                    .thenReturn(false);

            assertThat(jobStore.isDuplicate(draft().applyUrl("Unknown URL").build())).isFalse();
            assertThat(jobStore.isDuplicate(draft().applyUrl("N/A").build())).isFalse();
            verify(repository, never()).existsByApplyUrl(anyString());
        }

        @Test
        @DisplayName("Should not match drafts without URL, title or company")
        void shouldNotMatchIncompleteDraft() {
            JobPostingDraft incomplete = JobPostingDraft.builder().title("Engineer").build();

            assertThat(jobStore.isDuplicate(incomplete)).isFalse();
            verifyNoInteractions(repository);
        }
    }

    @Test
    @DisplayName("Should persist a scored draft with defaults")
    void shouldSaveDraft() {
        when(repository.save(any(JobPosting.class))).thenAnswer(invocation -> invocation.getArgument(0));

        JobPosting saved = jobStore.save(draft().company(" ").source(null).remote(true).build(), 1.4, "m-1");

        assertThat(saved.getId()).isNotBlank();
        assertThat(saved.getCompany()).isEqualTo("Unknown");
        assertThat(saved.getSource()).isEqualTo("Unknown");
        assertThat(saved.getRelevanceScore()).isEqualTo(1.0);
        assertThat(saved.getEmailMessageId()).isEqualTo("m-1");
        assertThat(saved.isRemote()).isTrue();
        assertThat(saved.isProcessed()).isFalse();
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
        assertThat(saved.getRequirements()).isEmpty();
    }

    @Test
    @DisplayName("Should store no apply URL for placeholder text")
    void shouldDropPlaceholderUrlOnSave() {
        when(repository.save(any(JobPosting.class))).thenAnswer(invocation -> invocation.getArgument(0));

        assertThat(jobStore.save(draft().applyUrl("Unknown URL").build(), 0.8, "m-1").getApplyUrl()).isNull();
        assertThat(jobStore.save(draft().applyUrl("N/A").build(), 0.8, "m-1").getApplyUrl()).isNull();
    }

    @Test
    void shouldCleanUrls() {
        assertThat(JobStore.cleanUrl("https://jobs.example.com/view?id=1 2")).isEqualTo("https://jobs.example.com/view?id=12");
        assertThat(JobStore.cleanUrl("HTTP://Example.com/a")).isEqualTo("HTTP://Example.com/a");
        assertThat(JobStore.cleanUrl("careers.acme.io/jobs/7")).isEqualTo("https://careers.acme.io/jobs/7");
        assertThat(JobStore.cleanUrl("localhost/jobs")).isNull();
        assertThat(JobStore.cleanUrl("see site.com")).isNull();
        assertThat(JobStore.cleanUrl("\u200B ")).isNull();
    }

    @Test
    @DisplayName("Should flag delivered postings")
    void shouldMarkProcessed() {
        JobPosting first = JobPosting.builder().id("j-1").build();
        JobPosting second = JobPosting.builder().id("j-2").build();
        when(repository.markProcessed(List.of("j-1", "j-2"))).thenReturn(2);

        jobStore.markProcessed(List.of(first, second));

        assertThat(first.isProcessed()).isTrue();
        assertThat(second.isProcessed()).isTrue();
    }

    @Test
    void shouldSkipEmptyMarkProcessed() {
        jobStore.markProcessed(List.of());

        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("Should limit and map top sources")
    void shouldMapTopSources() {
        Instant start = NOW.minusSeconds(86400);
        when(repository.countBySourceCreatedBetween(start, NOW)).thenReturn(List.of(
                new Object[]{"LinkedIn", 7L},
                new Object[]{"JobStreet", 3L},
                new Object[]{"Indeed", 1L}));

        List<SourceCount> top = jobStore.topSources(start, NOW, 2);

        assertThat(top).containsExactly(new SourceCount("LinkedIn", 7), new SourceCount("JobStreet", 3));
    }
}
