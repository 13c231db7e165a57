package quest.gekko.churnguard.dto;

public enum RunStatus {
    SUCCEEDED,
    // ran to the end with gaps: a failed registry sync, metric job or classification
    DEGRADED,
    FAILED
}
