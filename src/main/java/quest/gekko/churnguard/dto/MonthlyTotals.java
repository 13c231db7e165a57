package quest.gekko.churnguard.dto;

import quest.gekko.churnguard.domain.DailyMetric;
import quest.gekko.churnguard.domain.MonthlyMetric;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Aggregate of daily rows over a window. Spend, messages and redemptions are summed; active subscribers is a gauge,
 * so it is averaged over the days that have a row.
 *
 * @param days number of daily rows in the window, 0 when the window has none or when built from a stored monthly row
 */
public record MonthlyTotals(BigDecimal spend, long messages, long redemptions, long avgActiveSubscribers, int days) {

    public static final MonthlyTotals EMPTY = new MonthlyTotals(BigDecimal.ZERO, 0, 0, 0, 0);

    public static MonthlyTotals of(Collection<DailyMetric> rows) {
        if (rows == null || rows.isEmpty()) return EMPTY;

        BigDecimal spend = BigDecimal.ZERO;
        long messages = 0;
        long redemptions = 0;
        long subscribers = 0;
        for (DailyMetric row : rows) {
            if (row.getSpend() != null) spend = spend.add(row.getSpend());
            messages += row.getMessagesDelivered();
            redemptions += row.getRedemptions();
            subscribers += row.getActiveSubscribers();
        }
        long avg = BigDecimal.valueOf(subscribers)
                .divide(BigDecimal.valueOf(rows.size()), 0, RoundingMode.HALF_UP)
                .longValue();
        return new MonthlyTotals(spend, messages, redemptions, avg, rows.size());
    }

    public boolean hasDailyData() {
        return days > 0;
    }

    public static MonthlyTotals of(MonthlyMetric metric) {
        return new MonthlyTotals(metric.getTotalSpend(), metric.getTotalMessages(), metric.getTotalRedemptions(),
                metric.getAvgActiveSubscribers(), 0);
    }
}
