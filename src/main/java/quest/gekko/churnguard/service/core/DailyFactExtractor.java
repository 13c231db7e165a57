package quest.gekko.churnguard.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import quest.gekko.churnguard.domain.Account;
import quest.gekko.churnguard.domain.MetricType;
import quest.gekko.churnguard.dto.ExtractionResult;
import quest.gekko.churnguard.dto.FactTotal;
import quest.gekko.churnguard.dto.MetricExtractionResult;
import quest.gekko.churnguard.repository.AccountRepository;
import quest.gekko.churnguard.service.integration.connector.FactSourceConnector;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pulls one day of facts from the warehouse into the daily ledger. The four metrics are extracted by independent jobs
 * running in parallel; a failing job only loses its own metric for the day.
 */
@Service
@Slf4j
public class DailyFactExtractor {
    private final FactSourceConnector factSource;
    private final AccountRepository accountRepository;
    private final DailyMetricWriter writer;
    private final Executor executor;

    public DailyFactExtractor(FactSourceConnector factSource,
                              AccountRepository accountRepository,
                              DailyMetricWriter writer,
                              @Qualifier("extractionExecutor") Executor executor) {
        this.factSource = factSource;
        this.accountRepository = accountRepository;
        this.writer = writer;
        this.executor = executor;
    }

    public ExtractionResult extractDay(LocalDate date) {
        log.info("📥 Extracting daily facts for {}", date);
        Map<String, Account> registry = accountRepository.findAll().stream()
                .collect(Collectors.toMap(Account::getAccountId, Function.identity()));

        Map<MetricType, CompletableFuture<MetricExtractionResult>> futures = new EnumMap<>(MetricType.class);
        for (MetricType metric : MetricType.values()) {
            futures.put(metric, CompletableFuture
                    .supplyAsync(() -> extractMetric(metric, date, registry), executor)
                    .exceptionally(e -> {
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        log.warn("❌ {} extraction failed for {}: {}", metric, date, cause.getMessage());
                        return MetricExtractionResult.failed(cause.getMessage() != null
                                ? cause.getMessage() : cause.getClass().getSimpleName());
                    }));
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<MetricType, MetricExtractionResult> results = new EnumMap<>(MetricType.class);
        futures.forEach((metric, future) -> results.put(metric, future.join()));

        ExtractionResult result = new ExtractionResult(date, results);
        log.info("✅ Daily facts for {}: {} rows written, {} metric job(s) failed",
                date, result.rowsWritten(), result.failedMetrics());
        return result;
    }

    MetricExtractionResult extractMetric(MetricType metric, LocalDate date, Map<String, Account> registry) {
        List<FactTotal> totals = factSource.fetchDailyTotals(metric, date);
        int updated = 0;
        int created = 0;
        int skipped = 0;

        for (FactTotal total : totals) {
            Account account = registry.get(total.accountId());
            if (account == null || !total.hasActivity() || !AccountEligibility.isEligibleForDay(account, date)) {
                skipped++;
                continue;
            }
            DailyMetricWriter.Outcome outcome;
            try {
                outcome = writer.upsert(metric, total.accountId(), date, total.total());
            } catch (DataIntegrityViolationException race) {
                // another metric job inserted the row first
                outcome = writer.upsert(metric, total.accountId(), date, total.total());
            }
            if (outcome == DailyMetricWriter.Outcome.CREATED) created++;
            else updated++;
        }

        log.debug("{} for {}: {} updated, {} created, {} skipped", metric, date, updated, created, skipped);
        return new MetricExtractionResult(updated, created, skipped, null);
    }
}
