package dev.jobdigest.model;

public record EmailClassification(
        String id,
        boolean jobRelated,
        double confidence) {
}
