package dev.jobdigest.service;

import dev.jobdigest.config.PipelineProperties;
import dev.jobdigest.model.ResumeDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the resume text from the configured file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResumeDocumentLoader {

    private final PipelineProperties pipelineProperties;

    public ResumeDocument load() {
        Path path = Path.of(pipelineProperties.getResume().getPath());
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Resume file not found: " + path.toAbsolutePath());
        }
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            log.info("Loaded resume {} ({} chars)", path.getFileName(), text.length());
            return new ResumeDocument(path.getFileName().toString(), text);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read resume file " + path, e);
        }
    }
}
