package dev.jobdigest.model;

/**
 * A message pulled from the inbox.
 */
public record EmailMessage(
        String id,
        String subject,
        String from,
        String body) {

    /**
     * Reduced view sent to the classifier.
     */
    public EmailPreview toPreview(int maxBodyChars) {
        String safeBody = body != null ? body : "";
        String preview = safeBody.length() > maxBodyChars ? safeBody.substring(0, maxBodyChars) : safeBody;
        return new EmailPreview(id, from, subject, preview);
    }
}
