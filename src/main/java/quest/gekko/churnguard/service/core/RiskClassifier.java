package quest.gekko.churnguard.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.churnguard.config.RiskThresholds;
import quest.gekko.churnguard.domain.Account;
import quest.gekko.churnguard.domain.AccountStatus;
import quest.gekko.churnguard.domain.RiskLevel;
import quest.gekko.churnguard.dto.MonthlyTotals;
import quest.gekko.churnguard.dto.RiskAssessment;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Churn-risk policy for one account in one month. Stateless; the same rules serve the trending pass (month in
 * progress, {@code progress < 1}) and the historical pass ({@code progress == 1}).
 */
@Component
@RequiredArgsConstructor
public class RiskClassifier {
    public static final String RECENTLY_ARCHIVED = "Recently Archived";
    public static final String FROZEN_STATUS = "Frozen Account Status";
    public static final String FROZEN_INACTIVE = "Frozen & Inactive";

    /** Combo flag needs the account to be past its first two months. */
    static final int COMBO_MIN_MONTHS = 3;
    static final int DROP_MIN_MONTHS = 3;

    private final RiskThresholds thresholds;

    /**
     * @param current   totals of the month so far
     * @param previous  totals of the comparison window in the previous month; drop flags need at least one daily row
     * @param progress  elapsed share of the month, 1 for a closed month
     */
    public RiskAssessment assess(Account account, YearMonth month, MonthlyTotals current, MonthlyTotals previous,
                                 double progress) {
        if (AccountEligibility.wasArchivedIn(account, month)) {
            return RiskAssessment.of(RiskLevel.HIGH, List.of(RECENTLY_ARCHIVED));
        }

        if (account.getStatus() == AccountStatus.FROZEN) {
            if (current.messages() == 0) {
                return RiskAssessment.of(RiskLevel.HIGH, List.of(FROZEN_STATUS, FROZEN_INACTIVE));
            }
            return RiskAssessment.of(RiskLevel.MEDIUM, List.of(FROZEN_STATUS));
        }

        if (progress <= 0) {
            return RiskAssessment.of(RiskLevel.LOW, List.of(RiskAssessment.NO_FLAGS));
        }

        long monthsSinceLaunch = monthsSinceLaunch(account, month);
        List<RiskFlag> flags = new ArrayList<>();

        if (current.redemptions() < thresholds.proratedRedemptionsThreshold(progress)) {
            flags.add(RiskFlag.LOW_MONTHLY_REDEMPTIONS);
        }
        if (monthsSinceLaunch >= COMBO_MIN_MONTHS
                && current.avgActiveSubscribers() < thresholds.comboSubscribersThreshold()
                && current.redemptions() < thresholds.proratedComboRedemptionsThreshold(progress)) {
            flags.add(RiskFlag.LOW_ENGAGEMENT_COMBO);
        }
        if (current.avgActiveSubscribers() < thresholds.lowActivitySubscribersThreshold()) {
            flags.add(RiskFlag.LOW_ACTIVITY);
        }
        if (previous != null && previous.hasDailyData() && monthsSinceLaunch >= DROP_MIN_MONTHS) {
            if (drop(previous.spend(), current.spend()) >= thresholds.spendDropFraction()) {
                flags.add(RiskFlag.SPEND_DROP);
            }
            if (drop(BigDecimal.valueOf(previous.redemptions()), BigDecimal.valueOf(current.redemptions()))
                    >= thresholds.redemptionsDropFraction()) {
                flags.add(RiskFlag.REDEMPTIONS_DROP);
            }
        }

        int points = flags.stream().mapToInt(RiskFlag::points).sum();
        List<String> reasons = flags.isEmpty()
                ? List.of(RiskAssessment.NO_FLAGS)
                : flags.stream().map(RiskFlag::label).toList();
        return new RiskAssessment(RiskLevel.forFlagPoints(points), reasons, points);
    }

    /**
     * Whole calendar months between the launch month and {@code month}, never negative.
     */
    static long monthsSinceLaunch(Account account, YearMonth month) {
        if (account.getLaunchedAt() == null) {
            throw new IllegalStateException("Account " + account.getAccountId() + " has no launch date");
        }
        return Math.max(0, ChronoUnit.MONTHS.between(YearMonth.from(account.getLaunchedAt()), month));
    }

    /**
     * Relative decrease from {@code previous} to {@code current}; 0 when there was nothing to drop from.
     */
    static double drop(BigDecimal previous, BigDecimal current) {
        if (previous == null || previous.signum() <= 0) return 0;
        BigDecimal cur = current != null ? current : BigDecimal.ZERO;
        BigDecimal fraction = previous.subtract(cur).divide(previous, 6, RoundingMode.HALF_UP);
        return Math.max(0, fraction.doubleValue());
    }
}
