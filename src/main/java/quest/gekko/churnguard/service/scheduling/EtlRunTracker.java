package quest.gekko.churnguard.service.scheduling;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.churnguard.domain.EtlRun;
import quest.gekko.churnguard.domain.PipelineStep;
import quest.gekko.churnguard.domain.StepStatus;
import quest.gekko.churnguard.dto.StepReport;
import quest.gekko.churnguard.repository.EtlRunRepository;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Records every pipeline step in {@code etl_runs}. Re-running a date overwrites that date's rows.
 */
@Component
@RequiredArgsConstructor
public class EtlRunTracker {
    private static final int MAX_TEXT = 2000;

    private final EtlRunRepository etlRunRepository;
    private final Clock clock;

    public EtlRun start(LocalDate date, PipelineStep step) {
        EtlRun run = etlRunRepository.findByRunDateAndStep(date, step).orElseGet(() -> {
            EtlRun created = new EtlRun();
            created.setRunDate(date);
            created.setStep(step);
            return created;
        });
        run.setStatus(StepStatus.RUNNING);
        run.setStartedAt(clock.instant());
        run.setCompletedAt(null);
        run.setErrorMessage(null);
        run.setDetail(null);
        return etlRunRepository.save(run);
    }

    public EtlRun finish(EtlRun run, StepReport report) {
        run.setStatus(report.status());
        run.setCompletedAt(clock.instant());
        run.setDetail(truncate(report.detail()));
        run.setErrorMessage(truncate(report.error()));
        return etlRunRepository.save(run);
    }

    public List<EtlRun> runsFor(LocalDate date) {
        return etlRunRepository.findByRunDateOrderByStepAsc(date);
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_TEXT) return text;
        return text.substring(0, MAX_TEXT);
    }
}
