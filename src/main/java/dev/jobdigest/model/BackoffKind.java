package dev.jobdigest.model;

public enum BackoffKind {
    FIXED,
    EXPONENTIAL
}
