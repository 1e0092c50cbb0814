package dev.jobdigest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Parameters carried by a queued run.
 *
 * @param minRelevanceScore relevance threshold for the digest, null for the configured default
 * @param progressHandle    transport handle of a progress message created at enqueue time
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunPayload(Double minRelevanceScore, String progressHandle) {

    public static RunPayload empty() {
        return new RunPayload(null, null);
    }

    public RunPayload withProgressHandle(String handle) {
        return new RunPayload(minRelevanceScore, handle);
    }
}
