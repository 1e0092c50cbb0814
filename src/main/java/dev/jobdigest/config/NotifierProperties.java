package dev.jobdigest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Notification transport settings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "notifier")
public class NotifierProperties {

    /** "logging" (dry run) or "mail". */
    private String transport = "logging";

    private int maxMessageLength = 4000;

    private Mail mail = new Mail();

    @Data
    public static class Mail {
        private String from;
        private String to;
        private String subjectPrefix = "Job Digest";
    }
}
