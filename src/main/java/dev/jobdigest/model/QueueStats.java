package dev.jobdigest.model;

public record QueueStats(long queued, long active, long completed, long failed) {
}
