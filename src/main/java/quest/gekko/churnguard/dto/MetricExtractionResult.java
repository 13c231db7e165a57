package quest.gekko.churnguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one metric job for one day. {@code error} is set only when the job failed as a whole.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricExtractionResult(int updated, int created, int skipped, String error) {

    public static MetricExtractionResult failed(String error) {
        return new MetricExtractionResult(0, 0, 0, error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public int written() {
        return updated + created;
    }
}
