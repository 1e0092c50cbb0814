package dev.jobdigest.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A job posting extracted from an email and scored against the resume profile.
 * The pipeline only ever flips {@code processed} after the posting was delivered.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_postings", indexes = {
        @Index(name = "idx_job_apply_url", columnList = "applyUrl"),
        @Index(name = "idx_job_created_at", columnList = "createdAt"),
        @Index(name = "idx_job_email", columnList = "emailMessageId")
})
public class JobPosting {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false)
    private String company;

    @Column(length = 500)
    private String location;

    private boolean remote;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Builder.Default
    @Column(columnDefinition = "TEXT")
    @Convert(converter = StringListConverter.class)
    private List<String> requirements = new ArrayList<>();

    @Column(length = 2048)
    private String applyUrl;

    private String salary;

    private LocalDate postedDate;

    @Column(nullable = false)
    private String source;

    @Column(nullable = false)
    private double relevanceScore;

    @Column(nullable = false)
    private String emailMessageId;

    private boolean processed;

    @Column(nullable = false)
    private Instant createdAt;
}
