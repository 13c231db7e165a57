package quest.gekko.churnguard.dto;

import quest.gekko.churnguard.domain.RiskLevel;

import java.util.List;

public record RiskAssessment(RiskLevel level, List<String> reasons, int points) {

    public static final String NO_FLAGS = "No flags";

    public static RiskAssessment of(RiskLevel level, List<String> reasons) {
        return new RiskAssessment(level, List.copyOf(reasons), 0);
    }

    /** Default for an account that could not be classified. */
    public static RiskAssessment fallback() {
        return new RiskAssessment(RiskLevel.LOW, List.of(), 0);
    }
}
