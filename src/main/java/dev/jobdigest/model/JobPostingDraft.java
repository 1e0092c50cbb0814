package dev.jobdigest.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * A job posting as extracted from one email, before scoring and persistence.
 */
@Data
@Builder
public class JobPostingDraft {
    private String title;
    private String company;
    private String location;
    private boolean remote;
    private String description;
    private List<String> requirements;
    private String applyUrl;
    private String salary;
    private LocalDate postedDate;
    private String source; // platform name (linkedin, jobstreet, ...)
}
