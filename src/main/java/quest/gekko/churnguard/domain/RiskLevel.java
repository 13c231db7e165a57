package quest.gekko.churnguard.domain;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel forFlagPoints(int points) {
        if (points >= 3) return HIGH;
        if (points >= 1) return MEDIUM;
        return LOW;
    }
}
