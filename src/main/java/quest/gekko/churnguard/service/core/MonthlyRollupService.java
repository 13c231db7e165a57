package quest.gekko.churnguard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.churnguard.domain.Account;
import quest.gekko.churnguard.domain.DailyMetric;
import quest.gekko.churnguard.domain.MonthlyMetric;
import quest.gekko.churnguard.dto.MonthlyTotals;
import quest.gekko.churnguard.dto.RollupResult;
import quest.gekko.churnguard.exception.RollupFailedException;
import quest.gekko.churnguard.repository.AccountRepository;
import quest.gekko.churnguard.repository.DailyMetricRepository;
import quest.gekko.churnguard.repository.MonthlyMetricRepository;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rebuilds a month of the monthly table from the daily ledger. The month is deleted and recreated in one transaction,
 * so readers see either the old rows or the new ones. Historical risk levels of a closed month are carried over.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonthlyRollupService {
    public static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");
    public static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.US);

    private final AccountRepository accountRepository;
    private final DailyMetricRepository dailyMetricRepository;
    private final MonthlyMetricRepository monthlyMetricRepository;

    @Transactional
    public RollupResult rollupMonth(YearMonth month) {
        String key = month.format(MONTH_KEY);
        String label = month.format(MONTH_LABEL);
        try {
            // a closed month stays closed: its historical slot survives the recompute
            Map<String, MonthlyMetric> closed = monthlyMetricRepository.findByMetricMonthOrderByAccountIdAsc(key).stream()
                    .filter(MonthlyMetric::isClosed)
                    .collect(Collectors.toMap(MonthlyMetric::getAccountId, Function.identity()));
            int deleted = monthlyMetricRepository.deleteMonth(key);

            Map<String, List<DailyMetric>> daily = dailyMetricRepository
                    .findAllBetween(month.atDay(1), month.atEndOfMonth()).stream()
                    .collect(Collectors.groupingBy(DailyMetric::getAccountId));

            List<MonthlyMetric> rows = accountRepository.findAll().stream()
                    .filter(account -> AccountEligibility.isVisibleInMonth(account, month))
                    .sorted(Comparator.comparing(Account::getAccountId))
                    .map(account -> toRow(account.getAccountId(), key, label,
                            MonthlyTotals.of(daily.get(account.getAccountId())), closed.get(account.getAccountId())))
                    .toList();
            monthlyMetricRepository.saveAll(rows);

            log.info("📊 Rolled up {}: replaced {} rows with {}", key, deleted, rows.size());
            return new RollupResult(key, label, deleted, rows.size());
        } catch (RuntimeException e) {
            log.error("❌ Rollup of {} failed, rolling back", key, e);
            throw new RollupFailedException(month, e);
        }
    }

    public static String monthKey(YearMonth month) {
        return month.format(MONTH_KEY);
    }

    private static MonthlyMetric toRow(String accountId, String key, String label, MonthlyTotals totals,
                                       MonthlyMetric closed) {
        MonthlyMetric row = new MonthlyMetric();
        row.setAccountId(accountId);
        row.setMetricMonth(key);
        row.setMonthLabel(label);
        row.setTotalSpend(totals.spend());
        row.setTotalMessages(totals.messages());
        row.setTotalRedemptions(totals.redemptions());
        row.setAvgActiveSubscribers(totals.avgActiveSubscribers());
        if (closed != null) {
            row.close(closed.getHistoricalRiskLevel(), closed.getRiskReasons());
        }
        return row;
    }
}
