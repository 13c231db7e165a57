package quest.gekko.churnguard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.churnguard.config.RiskThresholds;
import quest.gekko.churnguard.domain.Account;
import quest.gekko.churnguard.domain.DailyMetric;
import quest.gekko.churnguard.domain.MonthlyMetric;
import quest.gekko.churnguard.dto.ClassificationResult;
import quest.gekko.churnguard.dto.MonthlyTotals;
import quest.gekko.churnguard.dto.RiskAssessment;
import quest.gekko.churnguard.repository.AccountRepository;
import quest.gekko.churnguard.repository.DailyMetricRepository;
import quest.gekko.churnguard.repository.MonthlyMetricRepository;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes risk levels onto the monthly rows. A month is classified as trending while it is open and gets its
 * historical classification once, when it closes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RiskClassificationService {
    private final RiskClassifier classifier;
    private final AccountRepository accountRepository;
    private final DailyMetricRepository dailyMetricRepository;
    private final MonthlyMetricRepository monthlyMetricRepository;
    private final Clock clock;

    /**
     * Classifies the open month as processed on {@code processDate}; that day is not counted as complete, so day 1
     * has no progress. Rows that already carry a historical level are left alone.
     */
    @Transactional
    public ClassificationResult classifyTrending(YearMonth month, LocalDate processDate) {
        double progress = RiskThresholds.monthProgress(dayOfMonth(month, processDate), month.lengthOfMonth());
        return classify(month, elapsedDays(month, processDate), progress, false);
    }

    /**
     * Closes a complete month. A no-op when the month is already closed, unless {@code force} is set.
     */
    @Transactional
    public ClassificationResult classifyHistorical(YearMonth month, boolean force) {
        String key = MonthlyRollupService.monthKey(month);
        if (!month.isBefore(YearMonth.now(clock))) {
            throw new IllegalArgumentException("Month " + key + " is not complete yet");
        }
        if (!force && monthlyMetricRepository.existsByMetricMonthAndHistoricalRiskLevelIsNotNull(key)) {
            log.info("Month {} already closed, skipping historical classification", key);
            return ClassificationResult.alreadyClosed(key);
        }
        return classify(month, month.lengthOfMonth(), 1.0, true);
    }

    private ClassificationResult classify(YearMonth month, int elapsedDays, double progress, boolean historical) {
        String key = MonthlyRollupService.monthKey(month);
        List<MonthlyMetric> rows = monthlyMetricRepository.findByMetricMonthOrderByAccountIdAsc(key);
        Map<String, Account> accounts = accountRepository
                .findAllById(rows.stream().map(MonthlyMetric::getAccountId).toList()).stream()
                .collect(Collectors.toMap(Account::getAccountId, Function.identity()));
        Map<String, List<DailyMetric>> comparison = comparisonWindow(month, elapsedDays);

        int classified = 0;
        int fallbacks = 0;
        for (MonthlyMetric row : rows) {
            if (!historical && row.isClosed()) continue;

            RiskAssessment assessment;
            try {
                Account account = accounts.get(row.getAccountId());
                if (account == null) {
                    throw new IllegalStateException("Account " + row.getAccountId() + " missing from registry");
                }
                MonthlyTotals previous = MonthlyTotals.of(comparison.get(row.getAccountId()));
                assessment = classifier.assess(account, month, MonthlyTotals.of(row), previous, progress);
                classified++;
            } catch (RuntimeException e) {
                log.warn("Risk classification failed for {} in {}, defaulting to LOW: {}",
                        row.getAccountId(), key, e.getMessage());
                assessment = RiskAssessment.fallback();
                fallbacks++;
            }

            if (historical) row.close(assessment.level(), assessment.reasons());
            else row.applyTrending(assessment.level(), assessment.reasons());
        }
        monthlyMetricRepository.saveAll(rows);

        log.info("🎯 {} classification of {}: {} classified, {} defaulted (progress {})",
                historical ? "Historical" : "Trending", key, classified, fallbacks, String.format("%.3f", progress));
        return new ClassificationResult(key, historical, classified, fallbacks, false);
    }

    /**
     * Daily rows of the previous month from its first day through the same number of elapsed days, clamped to the
     * previous month's length. Empty when no day has elapsed.
     */
    Map<String, List<DailyMetric>> comparisonWindow(YearMonth month, int elapsedDays) {
        if (elapsedDays <= 0) return Map.of();
        YearMonth previous = month.minusMonths(1);
        LocalDate to = previous.atDay(Math.min(elapsedDays, previous.lengthOfMonth()));
        return dailyMetricRepository.findAllBetween(previous.atDay(1), to).stream()
                .collect(Collectors.groupingBy(DailyMetric::getAccountId));
    }

    /**
     * Day of {@code month} that {@code processDate} falls on: 1 before the month starts, one past the last day once
     * the month is over.
     */
    static int dayOfMonth(YearMonth month, LocalDate processDate) {
        if (processDate.isBefore(month.atDay(1))) return 1;
        if (processDate.isAfter(month.atEndOfMonth())) return month.lengthOfMonth() + 1;
        return processDate.getDayOfMonth();
    }

    static int elapsedDays(YearMonth month, LocalDate dataThrough) {
        if (dataThrough.isBefore(month.atDay(1))) return 0;
        if (dataThrough.isAfter(month.atEndOfMonth())) return month.lengthOfMonth();
        return dataThrough.getDayOfMonth();
    }
}
