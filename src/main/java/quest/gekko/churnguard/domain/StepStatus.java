package quest.gekko.churnguard.domain;

public enum StepStatus {
    RUNNING,
    COMPLETED,
    // finished, but some items failed
    DEGRADED,
    FAILED,
    SKIPPED
}
