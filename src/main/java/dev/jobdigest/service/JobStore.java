package dev.jobdigest.service;

import dev.jobdigest.entity.JobPosting;
import dev.jobdigest.model.JobPostingDraft;
import dev.jobdigest.model.SourceCount;
import dev.jobdigest.repository.JobPostingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Persistence of job postings and the queries the pipeline needs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    private static final String UNKNOWN = "Unknown";
    private static final Pattern SCHEME = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);

    private final JobPostingRepository jobPostingRepository;
    private final Clock clock;

    /**
     * Check whether a draft repeats a stored posting: same apply URL, or same title at the same company.
     */
    public boolean isDuplicate(JobPostingDraft draft) {
        String url = cleanUrl(draft.getApplyUrl());
        if (url != null && jobPostingRepository.existsByApplyUrl(url)) {
            return true;
        }
        if (draft.getTitle() == null || draft.getCompany() == null) {
            return false;
        }
        return jobPostingRepository.existsByTitleIgnoreCaseAndCompanyIgnoreCase(
                draft.getTitle().trim(), draft.getCompany().trim());
    }

    /**
     * Persist a scored draft.
     *
     * @param draft          The extracted posting
     * @param relevanceScore Score in [0, 1]
     * @param emailMessageId Originating message id
     * @return the saved posting
     */
    @Transactional
    public JobPosting save(JobPostingDraft draft, double relevanceScore, String emailMessageId) {
        JobPosting posting = JobPosting.builder()
                .id(UUID.randomUUID().toString())
                .title(orUnknown(draft.getTitle()))
                .company(orUnknown(draft.getCompany()))
                .location(draft.getLocation() != null ? draft.getLocation() : "")
                .remote(draft.isRemote())
                .description(draft.getDescription() != null ? draft.getDescription() : "")
                .requirements(draft.getRequirements() != null ? new ArrayList<>(draft.getRequirements()) : new ArrayList<>())
                .applyUrl(cleanUrl(draft.getApplyUrl()))
                .salary(draft.getSalary())
                .postedDate(draft.getPostedDate())
                .source(draft.getSource() != null && !draft.getSource().isBlank() ? draft.getSource() : UNKNOWN)
                .relevanceScore(clampScore(relevanceScore))
                .emailMessageId(emailMessageId)
                .processed(false)
                .createdAt(Instant.now(clock))
                .build();

        JobPosting saved = jobPostingRepository.save(posting);
        log.debug("Saved job '{}' @ {} (score: {})", saved.getTitle(), saved.getCompany(), saved.getRelevanceScore());
        return saved;
    }

    /**
     * Flag postings as delivered.
     *
     * @param postings Postings that were part of a sent digest
     */
    @Transactional
    public void markProcessed(List<JobPosting> postings) {
        if (postings.isEmpty()) {
            return;
        }
        List<String> ids = postings.stream().map(JobPosting::getId).toList();
        int updated = jobPostingRepository.markProcessed(ids);
        postings.forEach(posting -> posting.setProcessed(true));
        log.info("Marked {} jobs as processed", updated);
    }

    public List<JobPosting> findRelevantCreatedBetween(Instant start, Instant end, double minScore) {
        return jobPostingRepository.findRelevantCreatedBetween(start, end, minScore);
    }

    public long countCreatedBetween(Instant start, Instant end) {
        return jobPostingRepository.countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(start, end);
    }

    public long countRelevantCreatedBetween(Instant start, Instant end, double minScore) {
        return jobPostingRepository.countRelevantCreatedBetween(start, end, minScore);
    }

    /**
     * Top sources by posting count within [start, end).
     */
    public List<SourceCount> topSources(Instant start, Instant end, int limit) {
        return jobPostingRepository.countBySourceCreatedBetween(start, end).stream()
                .limit(limit)
                .map(row -> new SourceCount(String.valueOf(row[0]), ((Number) row[1]).longValue()))
                .toList();
    }

    /**
     * Ensure URL is clean and safe for chat and email clients.
     */
    static String cleanUrl(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.replaceAll("[\\u200B-\\u200D\\uFEFF]", "").trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (SCHEME.matcher(trimmed).find()) {
            return trimmed.replaceAll("\\s+", "");
        }
        // Bare placeholders such as "Unknown URL" or "N/A" are not links
        String host = trimmed.split("[/?#]", 2)[0];
        if (!host.contains(".") || host.chars().anyMatch(Character::isWhitespace)) {
            return null;
        }
        return "https://" + trimmed.replaceAll("\\s+", "");
    }

    private String orUnknown(String value) {
        return value != null && !value.isBlank() ? value.trim() : UNKNOWN;
    }

    private double clampScore(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
