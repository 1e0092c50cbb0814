package dev.jobdigest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * IMAP inbox the job alerts arrive in.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.inbox")
public class InboxProperties {

    /** "imap" enables the IMAP adapter. */
    private String provider;

    private String host;
    private int port = 993;
    private String username;
    private String password;
    private String folder = "INBOX";
    private String archiveFolder = "Archive";

    /** Only unread messages received within this window are listed. */
    private Duration lookback = Duration.ofDays(2);

    private int maxMessages = 50;
}
