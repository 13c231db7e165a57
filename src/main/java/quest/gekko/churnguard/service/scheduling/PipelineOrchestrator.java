package quest.gekko.churnguard.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.churnguard.config.ChurnGuardProperties;
import quest.gekko.churnguard.domain.EtlRun;
import quest.gekko.churnguard.domain.PipelineStep;
import quest.gekko.churnguard.domain.StepStatus;
import quest.gekko.churnguard.dto.ClassificationResult;
import quest.gekko.churnguard.dto.ExtractionResult;
import quest.gekko.churnguard.dto.RegistrySyncResult;
import quest.gekko.churnguard.dto.RollupResult;
import quest.gekko.churnguard.dto.RunSummary;
import quest.gekko.churnguard.dto.StepReport;
import quest.gekko.churnguard.exception.PipelineBusyException;
import quest.gekko.churnguard.repository.DailyMetricRepository;
import quest.gekko.churnguard.service.core.AccountRegistryService;
import quest.gekko.churnguard.service.core.DailyFactExtractor;
import quest.gekko.churnguard.service.core.MonthlyRollupService;
import quest.gekko.churnguard.service.core.RiskClassificationService;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs the daily pipeline: registry sync, fact extraction, monthly rollup, trending classification and, during the
 * first days of a month, the close of the previous month. Only one operation runs at a time in the process.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineOrchestrator {
    private final AccountRegistryService accountRegistryService;
    private final DailyFactExtractor dailyFactExtractor;
    private final MonthlyRollupService monthlyRollupService;
    private final RiskClassificationService riskClassificationService;
    private final DailyMetricRepository dailyMetricRepository;
    private final EtlRunTracker tracker;
    private final ChurnGuardProperties.Pipeline pipeline;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public LocalDate yesterday() {
        return LocalDate.now(clock).minusDays(1);
    }

    public RunSummary runDaily(LocalDate processDate) {
        return exclusive("daily run for " + processDate, () -> doRunDaily(processDate, true));
    }

    /**
     * Resumes from the day after the latest date in the daily ledger through yesterday. An empty ledger starts at the
     * configured start date, or yesterday.
     */
    public List<RunSummary> runCatchUp() {
        return exclusive("catch-up", () -> {
            LocalDate to = yesterday();
            LocalDate from = dailyMetricRepository.findLatestDate()
                    .map(latest -> latest.plusDays(1))
                    .orElseGet(() -> pipeline.startDate() != null ? pipeline.startDate() : to);
            if (from.isAfter(to)) {
                log.info("Daily ledger is up to date through {}, nothing to catch up", to);
                return List.of();
            }
            log.info("🔄 Catching up {} day(s): {} to {}", from.datesUntil(to.plusDays(1)).count(), from, to);
            return runSequence(from, to);
        });
    }

    public List<RunSummary> runRange(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Backfill start " + from + " is after end " + to);
        }
        return exclusive("backfill " + from + ".." + to, () -> runSequence(from, to));
    }

    public RegistrySyncResult refreshAccounts() {
        return exclusive("account refresh", accountRegistryService::refreshAccounts);
    }

    public ExtractionResult extractDay(LocalDate date) {
        return exclusive("extraction for " + date, () -> dailyFactExtractor.extractDay(date));
    }

    public RollupResult rollupMonth(YearMonth month) {
        return exclusive("rollup of " + month, () -> monthlyRollupService.rollupMonth(month));
    }

    public ClassificationResult classify(YearMonth month, boolean historical, boolean force) {
        return exclusive("classification of " + month, () -> {
            if (historical) return riskClassificationService.classifyHistorical(month, force);
            LocalDate dataThrough = yesterday();
            return riskClassificationService.classifyTrending(month,
                    dataThrough.isAfter(month.atEndOfMonth()) ? month.atEndOfMonth() : dataThrough);
        });
    }

    public List<EtlRun> runsFor(LocalDate date) {
        return tracker.runsFor(date);
    }

    public boolean isRunning() {
        return running.get();
    }

    private List<RunSummary> runSequence(LocalDate from, LocalDate to) {
        List<RunSummary> summaries = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            RunSummary summary = doRunDaily(date, date.equals(from));
            summaries.add(summary);
            if (summary.isFailed()) {
                log.error("❌ Stopping at {}: run failed, later dates were not processed", date);
                break;
            }
        }
        return summaries;
    }

    RunSummary doRunDaily(LocalDate processDate, boolean syncRegistry) {
        YearMonth month = YearMonth.from(processDate);
        log.info("🚀 Pipeline run for {}", processDate);
        List<StepReport> steps = new ArrayList<>();

        if (syncRegistry) {
            steps.add(runStep(processDate, PipelineStep.ACCOUNTS, () -> {
                RegistrySyncResult r = accountRegistryService.refreshAccounts();
                return StepReport.of(PipelineStep.ACCOUNTS, r.upserted(), r.failed(),
                        "fetched " + r.fetched() + ", outside window " + r.skipped());
            }));
        } else {
            steps.add(skip(processDate, PipelineStep.ACCOUNTS, "registry already synced in this batch"));
        }

        steps.add(runStep(processDate, PipelineStep.DAILY_EXTRACT, () -> {
            ExtractionResult r = dailyFactExtractor.extractDay(processDate);
            return StepReport.of(PipelineStep.DAILY_EXTRACT, r.rowsWritten(), r.failedMetrics(), r.metrics().toString());
        }));

        StepReport rollup = runStep(processDate, PipelineStep.MONTHLY_ROLLUP, () -> {
            RollupResult r = monthlyRollupService.rollupMonth(month);
            return StepReport.of(PipelineStep.MONTHLY_ROLLUP, r.accountsProcessed(), 0,
                    r.monthLabel() + ": replaced " + r.deleted() + " rows");
        });
        steps.add(rollup);

        if (rollup.status() == StepStatus.FAILED) {
            steps.add(skip(processDate, PipelineStep.TRENDING_RISK, "monthly rollup failed"));
            steps.add(skip(processDate, PipelineStep.HISTORICAL_RISK, "monthly rollup failed"));
            return finish(processDate, steps);
        }

        steps.add(runStep(processDate, PipelineStep.TRENDING_RISK, () -> {
            ClassificationResult r = riskClassificationService.classifyTrending(month, processDate);
            return StepReport.of(PipelineStep.TRENDING_RISK, r.classified(), r.fallbacks(), r.month());
        }));

        if (processDate.getDayOfMonth() <= pipeline.monthEndWindowDays()) {
            YearMonth previous = month.minusMonths(1);
            steps.add(runStep(processDate, PipelineStep.HISTORICAL_RISK, () -> {
                ClassificationResult r = riskClassificationService.classifyHistorical(previous, false);
                if (r.skipped()) return StepReport.skipped(PipelineStep.HISTORICAL_RISK, r.month() + " already closed");
                return StepReport.of(PipelineStep.HISTORICAL_RISK, r.classified(), r.fallbacks(), r.month());
            }));
        } else {
            steps.add(skip(processDate, PipelineStep.HISTORICAL_RISK, "outside month-end window"));
        }

        return finish(processDate, steps);
    }

    private StepReport runStep(LocalDate date, PipelineStep step, Supplier<StepReport> work) {
        EtlRun run = tracker.start(date, step);
        StepReport report;
        try {
            report = work.get();
        } catch (RuntimeException e) {
            log.warn("❌ Step {} failed for {}: {}", step, date, e.getMessage());
            report = StepReport.failed(step, e);
        }
        tracker.finish(run, report);
        return report;
    }

    private StepReport skip(LocalDate date, PipelineStep step, String reason) {
        StepReport report = StepReport.skipped(step, reason);
        tracker.finish(tracker.start(date, step), report);
        return report;
    }

    private RunSummary finish(LocalDate date, List<StepReport> steps) {
        RunSummary summary = RunSummary.of(date, steps);
        switch (summary.status()) {
            case SUCCEEDED -> log.info("✅ Pipeline run for {} succeeded", date);
            case DEGRADED -> log.warn("⚠️ Pipeline run for {} finished degraded", date);
            case FAILED -> log.error("❌ Pipeline run for {} failed", date);
        }
        return summary;
    }

    private <T> T exclusive(String operation, Supplier<T> work) {
        if (!running.compareAndSet(false, true)) {
            throw new PipelineBusyException(operation);
        }
        try {
            return work.get();
        } finally {
            running.set(false);
        }
    }
}
