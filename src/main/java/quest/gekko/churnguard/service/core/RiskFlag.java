package quest.gekko.churnguard.service.core;

/**
 * Numeric churn flags and their weights. The label is what ends up in the persisted reason list.
 */
public enum RiskFlag {
    LOW_MONTHLY_REDEMPTIONS("Low Monthly Redemptions", 1),
    LOW_ENGAGEMENT_COMBO("Low Engagement Combo", 2),
    LOW_ACTIVITY("Low Activity", 1),
    SPEND_DROP("Spend Drop", 1),
    REDEMPTIONS_DROP("Redemptions Drop", 1);

    private final String label;
    private final int points;

    RiskFlag(String label, int points) {
        this.label = label;
        this.points = points;
    }

    public String label() {
        return label;
    }

    public int points() {
        return points;
    }
}
