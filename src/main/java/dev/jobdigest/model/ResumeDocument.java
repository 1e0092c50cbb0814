package dev.jobdigest.model;

/**
 * Plain-text content of the candidate's resume.
 */
public record ResumeDocument(String name, String text) {
}
