package quest.gekko.churnguard.service.scheduling;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.churnguard.config.ChurnGuardProperties;
import quest.gekko.churnguard.domain.EtlRun;
import quest.gekko.churnguard.domain.MetricType;
import quest.gekko.churnguard.domain.PipelineStep;
import quest.gekko.churnguard.domain.StepStatus;
import quest.gekko.churnguard.dto.*;
import quest.gekko.churnguard.exception.FactSourceException;
import quest.gekko.churnguard.exception.PipelineBusyException;
import quest.gekko.churnguard.exception.RollupFailedException;
import quest.gekko.churnguard.repository.DailyMetricRepository;
import quest.gekko.churnguard.service.core.AccountRegistryService;
import quest.gekko.churnguard.service.core.DailyFactExtractor;
import quest.gekko.churnguard.service.core.MonthlyRollupService;
import quest.gekko.churnguard.service.core.RiskClassificationService;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PipelineOrchestrator Unit Tests")
class PipelineOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-09-02T06:30:00Z"), ZoneOffset.UTC);
    private static final YearMonth AUGUST = YearMonth.of(2025, 8);

    @Mock
    private AccountRegistryService accountRegistryService;

    @Mock
    private DailyFactExtractor dailyFactExtractor;

    @Mock
    private MonthlyRollupService monthlyRollupService;

    @Mock
    private RiskClassificationService riskClassificationService;

    @Mock
    private DailyMetricRepository dailyMetricRepository;

    @Mock
    private EtlRunTracker tracker;

    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        ChurnGuardProperties.Pipeline pipeline = new ChurnGuardProperties.Pipeline("UTC", true,
                LocalDate.of(2025, 8, 30), null, 12, 3);
        orchestrator = new PipelineOrchestrator(accountRegistryService, dailyFactExtractor, monthlyRollupService,
                riskClassificationService, dailyMetricRepository, tracker, pipeline, CLOCK);
        lenient().when(tracker.start(any(), any())).thenAnswer(inv -> new EtlRun());
    }

    private static ExtractionResult extraction(LocalDate date, boolean messagesFailed) {
        Map<MetricType, MetricExtractionResult> metrics = new EnumMap<>(MetricType.class);
        for (MetricType metric : MetricType.values()) {
            metrics.put(metric, new MetricExtractionResult(3, 1, 0, null));
        }
        if (messagesFailed) metrics.put(MetricType.MESSAGES, MetricExtractionResult.failed("timeout"));
        return new ExtractionResult(date, metrics);
    }

    private void stubHealthyRun() {
        lenient().when(accountRegistryService.refreshAccounts()).thenReturn(new RegistrySyncResult(5, 5, 0, 0));
        lenient().when(dailyFactExtractor.extractDay(any())).thenAnswer(inv -> extraction(inv.getArgument(0), false));
        lenient().when(monthlyRollupService.rollupMonth(any()))
                .thenAnswer(inv -> new RollupResult(inv.getArgument(0).toString(), "label", 5, 5));
        lenient().when(riskClassificationService.classifyTrending(any(), any()))
                .thenAnswer(inv -> new ClassificationResult(inv.getArgument(0).toString(), false, 5, 0, false));
        lenient().when(riskClassificationService.classifyHistorical(any(), anyBoolean()))
                .thenAnswer(inv -> new ClassificationResult(inv.getArgument(0).toString(), true, 5, 0, false));
    }

    private static StepReport step(RunSummary summary, PipelineStep step) {
        return summary.steps().stream().filter(s -> s.step() == step).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("A clean mid-month run succeeds and skips the month-end close")
    void cleanRun() {
        // Given
        stubHealthyRun();
        LocalDate date = LocalDate.of(2025, 8, 14);

        // When
        RunSummary summary = orchestrator.runDaily(date);

        // Then
        assertThat(summary.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(summary.steps()).extracting(StepReport::step).containsExactly(
                PipelineStep.ACCOUNTS, PipelineStep.DAILY_EXTRACT, PipelineStep.MONTHLY_ROLLUP,
                PipelineStep.TRENDING_RISK, PipelineStep.HISTORICAL_RISK);
        assertThat(step(summary, PipelineStep.HISTORICAL_RISK).status()).isEqualTo(StepStatus.SKIPPED);
        verify(monthlyRollupService).rollupMonth(AUGUST);
        verify(riskClassificationService).classifyTrending(AUGUST, date);
        verify(riskClassificationService, never()).classifyHistorical(any(), anyBoolean());
        verify(tracker, times(5)).finish(any(), any());
    }

    @Test
    @DisplayName("Registry and metric failures degrade the run but it continues")
    void degradedRun() {
        stubHealthyRun();
        when(accountRegistryService.refreshAccounts()).thenThrow(new FactSourceException("feed down"));
        when(dailyFactExtractor.extractDay(any())).thenAnswer(inv -> extraction(inv.getArgument(0), true));

        RunSummary summary = orchestrator.runDaily(LocalDate.of(2025, 8, 14));

        assertThat(summary.status()).isEqualTo(RunStatus.DEGRADED);
        assertThat(step(summary, PipelineStep.ACCOUNTS).status()).isEqualTo(StepStatus.FAILED);
        assertThat(step(summary, PipelineStep.ACCOUNTS).error()).contains("feed down");
        assertThat(step(summary, PipelineStep.DAILY_EXTRACT).status()).isEqualTo(StepStatus.DEGRADED);
        assertThat(step(summary, PipelineStep.DAILY_EXTRACT).failed()).isEqualTo(1);
        assertThat(step(summary, PipelineStep.TRENDING_RISK).status()).isEqualTo(StepStatus.COMPLETED);
    }

    @Test
    @DisplayName("A failed rollup fails the run and skips classification")
    void rollupFailure() {
        stubHealthyRun();
        when(monthlyRollupService.rollupMonth(AUGUST))
                .thenThrow(new RollupFailedException(AUGUST, new IllegalStateException("db gone")));

        RunSummary summary = orchestrator.runDaily(LocalDate.of(2025, 8, 14));

        assertThat(summary.status()).isEqualTo(RunStatus.FAILED);
        assertThat(step(summary, PipelineStep.TRENDING_RISK).status()).isEqualTo(StepStatus.SKIPPED);
        assertThat(step(summary, PipelineStep.HISTORICAL_RISK).status()).isEqualTo(StepStatus.SKIPPED);
        verifyNoInteractions(riskClassificationService);
    }

    @Test
    @DisplayName("Within the month-end window the previous month is closed")
    void monthEndClose() {
        stubHealthyRun();

        RunSummary summary = orchestrator.runDaily(LocalDate.of(2025, 9, 1));

        verify(riskClassificationService).classifyHistorical(AUGUST, false);
        assertThat(step(summary, PipelineStep.HISTORICAL_RISK).status()).isEqualTo(StepStatus.COMPLETED);
    }

    @Test
    @DisplayName("An already closed month shows up as a skipped close")
    void alreadyClosed() {
        stubHealthyRun();
        when(riskClassificationService.classifyHistorical(AUGUST, false))
                .thenReturn(ClassificationResult.alreadyClosed("2025-08"));

        RunSummary summary = orchestrator.runDaily(LocalDate.of(2025, 9, 2));

        assertThat(summary.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(step(summary, PipelineStep.HISTORICAL_RISK).status()).isEqualTo(StepStatus.SKIPPED);
    }

    @Test
    @DisplayName("Catch-up resumes after the latest ledger date and syncs the registry once")
    void catchUpFromLedger() {
        stubHealthyRun();
        when(dailyMetricRepository.findLatestDate()).thenReturn(Optional.of(LocalDate.of(2025, 8, 29)));

        List<RunSummary> runs = orchestrator.runCatchUp();

        assertThat(runs).extracting(RunSummary::date).containsExactly(
                LocalDate.of(2025, 8, 30), LocalDate.of(2025, 8, 31), LocalDate.of(2025, 9, 1));
        verify(accountRegistryService, times(1)).refreshAccounts();
        assertThat(step(runs.get(1), PipelineStep.ACCOUNTS).status()).isEqualTo(StepStatus.SKIPPED);
    }

    @Test
    @DisplayName("Catch-up on an empty ledger starts at the configured start date")
    void catchUpFromStartDate() {
        stubHealthyRun();
        when(dailyMetricRepository.findLatestDate()).thenReturn(Optional.empty());

        List<RunSummary> runs = orchestrator.runCatchUp();

        assertThat(runs).hasSize(3);
        assertThat(runs.get(0).date()).isEqualTo(LocalDate.of(2025, 8, 30));
    }

    @Test
    @DisplayName("Catch-up does nothing when the ledger is current")
    void catchUpUpToDate() {
        when(dailyMetricRepository.findLatestDate()).thenReturn(Optional.of(LocalDate.of(2025, 9, 1)));

        assertThat(orchestrator.runCatchUp()).isEmpty();
        verifyNoInteractions(dailyFactExtractor);
    }

    @Test
    @DisplayName("A backfill stops at the first failed date")
    void rangeStopsOnFailure() {
        stubHealthyRun();
        when(monthlyRollupService.rollupMonth(AUGUST))
                .thenThrow(new RollupFailedException(AUGUST, new IllegalStateException("boom")));

        List<RunSummary> runs = orchestrator.runRange(LocalDate.of(2025, 8, 30), LocalDate.of(2025, 9, 1));

        assertThat(runs).hasSize(1);
        assertThat(runs.get(0).isFailed()).isTrue();
    }

    @Test
    @DisplayName("Inverted backfill range is rejected")
    void invertedRange() {
        assertThatThrownBy(() -> orchestrator.runRange(LocalDate.of(2025, 9, 1), LocalDate.of(2025, 8, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Only one operation runs at a time")
    void singleRunGuard() {
        stubHealthyRun();
        when(dailyFactExtractor.extractDay(any())).thenAnswer(inv -> {
            assertThat(orchestrator.isRunning()).isTrue();
            assertThatThrownBy(() -> orchestrator.refreshAccounts()).isInstanceOf(PipelineBusyException.class);
            return extraction(inv.getArgument(0), false);
        });

        orchestrator.runDaily(LocalDate.of(2025, 8, 14));

        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(orchestrator.refreshAccounts().upserted()).isEqualTo(5);
    }
}
