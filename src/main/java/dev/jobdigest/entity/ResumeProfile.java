package dev.jobdigest.entity;

import dev.jobdigest.model.Seniority;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of analysing the candidate's resume. The most recent row is the current profile.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "resume_profiles", indexes = {
        @Index(name = "idx_resume_analyzed_at", columnList = "analyzedAt")
})
public class ResumeProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Sets are stored de-duplicated in first-seen order.
    @Builder.Default
    @Column(columnDefinition = "TEXT")
    @Convert(converter = StringListConverter.class)
    private List<String> skills = new ArrayList<>();

    @Builder.Default
    @Column(columnDefinition = "TEXT")
    @Convert(converter = StringListConverter.class)
    private List<String> experience = new ArrayList<>();

    @Builder.Default
    @Column(columnDefinition = "TEXT")
    @Convert(converter = StringListConverter.class)
    private List<String> preferredRoles = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Seniority seniority;

    @Column(nullable = false)
    private Instant analyzedAt;

    public boolean isStale(Instant now, Duration maxAge) {
        return analyzedAt == null || analyzedAt.isBefore(now.minus(maxAge));
    }
}
