package dev.jobdigest.model;

public enum TriggerSource {
    CRON,
    MANUAL
}
