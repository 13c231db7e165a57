package quest.gekko.churnguard.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.churnguard.config.ChurnGuardProperties;
import quest.gekko.churnguard.dto.RunSummary;
import quest.gekko.churnguard.exception.PipelineBusyException;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineScheduler {
    private final PipelineOrchestrator orchestrator;
    private final ChurnGuardProperties.Pipeline pipeline;

    // 06:30 daily by default, after the warehouse has settled the previous day
    @Scheduled(cron = "${churnguard.pipeline.cron:0 30 6 * * *}", zone = "${churnguard.pipeline.zone:UTC}")
    public void runScheduled() {
        try {
            List<RunSummary> runs = pipeline.gapDetection()
                    ? orchestrator.runCatchUp()
                    : List.of(orchestrator.runDaily(orchestrator.yesterday()));
            runs.stream()
                    .filter(RunSummary::isFailed)
                    .forEach(run -> log.error("❌ Scheduled pipeline run for {} failed: {}", run.date(), run.steps()));
        } catch (PipelineBusyException e) {
            log.warn("Scheduled run skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ Scheduled pipeline run crashed", e);
        }
    }
}
