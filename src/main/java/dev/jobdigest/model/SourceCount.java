package dev.jobdigest.model;

public record SourceCount(String source, long count) {
}
