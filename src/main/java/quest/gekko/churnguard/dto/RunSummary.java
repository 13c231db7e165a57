package quest.gekko.churnguard.dto;

import quest.gekko.churnguard.domain.PipelineStep;
import quest.gekko.churnguard.domain.StepStatus;

import java.time.LocalDate;
import java.util.List;

public record RunSummary(LocalDate date, RunStatus status, List<StepReport> steps) {

    /**
     * A failed rollup fails the run; any other failed or degraded step only degrades it.
     */
    public static RunSummary of(LocalDate date, List<StepReport> steps) {
        RunStatus status = RunStatus.SUCCEEDED;
        for (StepReport step : steps) {
            if (step.step() == PipelineStep.MONTHLY_ROLLUP && step.status() == StepStatus.FAILED) {
                status = RunStatus.FAILED;
                break;
            }
            if (step.status() == StepStatus.FAILED || step.status() == StepStatus.DEGRADED) {
                status = RunStatus.DEGRADED;
            }
        }
        return new RunSummary(date, status, List.copyOf(steps));
    }

    public boolean isFailed() {
        return status == RunStatus.FAILED;
    }
}
