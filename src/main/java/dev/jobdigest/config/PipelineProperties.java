package dev.jobdigest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tunables of the alert-scan and daily-summary pipelines.
 * Loaded from application.yml under 'pipeline' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Classification classification = new Classification();
    private Relevance relevance = new Relevance();
    private Resume resume = new Resume();
    private DailySummary dailySummary = new DailySummary();

    /**
     * Pause after each persisted posting, to go easy on the LLM and job sites.
     */
    private Duration postingDelay = Duration.ofSeconds(1);

    /**
     * Emit a progress checkpoint every this many emails in the per-email loop.
     */
    private int progressEveryEmails = 5;

    @Data
    public static class Classification {
        private double threshold = 0.5;
        private int batchSize = 10;
        private int bodyPreviewChars = 500;
    }

    @Data
    public static class Relevance {
        /** Default minimum score for a posting to join the digest. */
        private double minScore = 0.6;
        private double highBand = 0.8;
        private double mediumBand = 0.6;
    }

    @Data
    public static class Resume {
        private String path = "resume.txt";
        private Duration maxAge = Duration.ofDays(7);
    }

    @Data
    public static class DailySummary {
        private double minScore = 0.6;
        private int topSources = 5;
    }
}
