package quest.gekko.churnguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import quest.gekko.churnguard.domain.PipelineStep;
import quest.gekko.churnguard.domain.StepStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepReport(PipelineStep step, StepStatus status, int processed, int failed, String detail, String error) {

    public static StepReport of(PipelineStep step, int processed, int failed, String detail) {
        return new StepReport(step, failed > 0 ? StepStatus.DEGRADED : StepStatus.COMPLETED, processed, failed, detail, null);
    }

    public static StepReport failed(PipelineStep step, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new StepReport(step, StepStatus.FAILED, 0, 0, null, message);
    }

    public static StepReport skipped(PipelineStep step, String reason) {
        return new StepReport(step, StepStatus.SKIPPED, 0, 0, reason, null);
    }
}
