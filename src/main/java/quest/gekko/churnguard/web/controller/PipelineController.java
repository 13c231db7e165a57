package quest.gekko.churnguard.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;
import quest.gekko.churnguard.domain.EtlRun;
import quest.gekko.churnguard.dto.ClassificationResult;
import quest.gekko.churnguard.dto.ExtractionResult;
import quest.gekko.churnguard.dto.RegistrySyncResult;
import quest.gekko.churnguard.dto.RollupResult;
import quest.gekko.churnguard.dto.RunSummary;
import quest.gekko.churnguard.service.scheduling.PipelineOrchestrator;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * Operator triggers for the pipeline. Every call goes through the orchestrator's single-run guard.
 */
@Controller
@RequestMapping("/admin/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineOrchestrator orchestrator;

    // defaults to yesterday
    @PostMapping("/run")
    @ResponseBody
    public ResponseEntity<RunSummary> run(@RequestParam(required = false)
                                          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        RunSummary summary = orchestrator.runDaily(date != null ? date : orchestrator.yesterday());
        HttpStatus status = summary.isFailed() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.OK;
        return ResponseEntity.status(status).body(summary);
    }

    @PostMapping("/catch-up")
    @ResponseBody
    public List<RunSummary> catchUp() {
        return orchestrator.runCatchUp();
    }

    @PostMapping("/backfill")
    @ResponseBody
    public List<RunSummary> backfill(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                     @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return orchestrator.runRange(from, to);
    }

    @PostMapping("/accounts/refresh")
    @ResponseBody
    public RegistrySyncResult refreshAccounts() {
        return orchestrator.refreshAccounts();
    }

    @PostMapping("/extract/{date}")
    @ResponseBody
    public ExtractionResult extract(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return orchestrator.extractDay(date);
    }

    @PostMapping("/rollup/{month}")
    @ResponseBody
    public RollupResult rollup(@PathVariable String month) {
        return orchestrator.rollupMonth(YearMonth.parse(month));
    }

    @PostMapping("/classify/{month}")
    @ResponseBody
    public ClassificationResult classify(@PathVariable String month,
                                         @RequestParam(defaultValue = "false") boolean historical,
                                         @RequestParam(defaultValue = "false") boolean force) {
        return orchestrator.classify(YearMonth.parse(month), historical, force);
    }

    @GetMapping("/runs/{date}")
    @ResponseBody
    public List<EtlRun> runs(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return orchestrator.runsFor(date);
    }
}
