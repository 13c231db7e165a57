package quest.gekko.churnguard.domain;

/**
 * The four daily facts pulled from the warehouse. Each one is extracted by its own job.
 */
public enum MetricType {
    SPEND("spend"),
    MESSAGES("messages"),
    REDEMPTIONS("redemptions"),
    ACTIVE_SUBSCRIBERS("active-subscribers");

    private final String path;

    MetricType(String path) {
        this.path = path;
    }

    /** Path segment of the warehouse facts endpoint. */
    public String path() {
        return path;
    }
}
