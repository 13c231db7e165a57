package quest.gekko.churnguard.dto;

import quest.gekko.churnguard.domain.MetricType;

import java.time.LocalDate;
import java.util.Map;

public record ExtractionResult(LocalDate date, Map<MetricType, MetricExtractionResult> metrics) {

    public int rowsWritten() {
        return metrics.values().stream().mapToInt(MetricExtractionResult::written).sum();
    }

    public int failedMetrics() {
        return (int) metrics.values().stream().filter(MetricExtractionResult::isFailed).count();
    }
}
