package dev.jobdigest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * OpenAI-compatible chat completion endpoint used for classification, extraction,
 * scoring and resume analysis.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.llm")
public class LlmProperties {

    private String apiKey;
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o-mini";
    private double temperature = 0.1;
    private Duration timeout = Duration.ofSeconds(60);
    private int maxRetries = 2;
    private Duration retryBackoff = Duration.ofSeconds(2);

    /** Email bodies are cut to this many characters before extraction. */
    private int maxBodyChars = 8000;
}
