package quest.gekko.churnguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Churn-risk policy shared by the trending and historical passes.
 *
 * <p>Redemption thresholds are monthly totals and get pro-rated for a month in progress. Subscriber thresholds apply
 * to the monthly average and are never pro-rated. Drop fractions compare the current window against the previous
 * month's window.
 */
@ConfigurationProperties("churnguard.risk")
public record RiskThresholds(
        @DefaultValue("10") int redemptionsThreshold,
        @DefaultValue("300") int comboSubscribersThreshold,
        @DefaultValue("35") int comboRedemptionsThreshold,
        @DefaultValue("300") int lowActivitySubscribersThreshold,
        @DefaultValue("0.40") double spendDropFraction,
        @DefaultValue("0.50") double redemptionsDropFraction) {

    public static final int REDEMPTIONS_THRESHOLD = 10;
    public static final int COMBO_SUBSCRIBERS_THRESHOLD = 300;
    public static final int COMBO_REDEMPTIONS_THRESHOLD = 35;
    public static final int LOW_ACTIVITY_SUBSCRIBERS_THRESHOLD = 300;
    public static final double SPEND_DROP_FRACTION = 0.40;
    public static final double REDEMPTIONS_DROP_FRACTION = 0.50;

    public static final RiskThresholds DEFAULTS = new RiskThresholds(
            REDEMPTIONS_THRESHOLD,
            COMBO_SUBSCRIBERS_THRESHOLD,
            COMBO_REDEMPTIONS_THRESHOLD,
            LOW_ACTIVITY_SUBSCRIBERS_THRESHOLD,
            SPEND_DROP_FRACTION,
            REDEMPTIONS_DROP_FRACTION);

    /**
     * Share of the month already covered by data when the classification runs on {@code dayOfMonth}: the day itself
     * is not complete yet, so day 1 has no progress and day {@code daysInMonth + 1} means the month is done.
     */
    public static double monthProgress(int dayOfMonth, int daysInMonth) {
        return (dayOfMonth - 1) / (double) daysInMonth;
    }

    public double proratedRedemptionsThreshold(double progress) {
        return redemptionsThreshold * progress;
    }

    public double proratedComboRedemptionsThreshold(double progress) {
        return comboRedemptionsThreshold * progress;
    }
}
