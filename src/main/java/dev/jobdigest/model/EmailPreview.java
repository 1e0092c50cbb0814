package dev.jobdigest.model;

public record EmailPreview(
        String id,
        String from,
        String subject,
        String bodyPreview) {
}
