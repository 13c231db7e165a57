package quest.gekko.churnguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Configuration properties for the warehouse connection and the daily pipeline
 */
@Configuration
@EnableConfigurationProperties({
        ChurnGuardProperties.Warehouse.class,
        ChurnGuardProperties.Pipeline.class,
        RiskThresholds.class
})
public class ChurnGuardProperties {

    @ConfigurationProperties("churnguard.warehouse")
    public record Warehouse(
            String baseUrl,
            String apiKey,
            @DefaultValue("PT2M") Duration timeout,
            @DefaultValue("4") int maxConcurrentCalls,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("PT2S") Duration backoff) {}

    /**
     * @param startDate           first date to extract when the daily ledger is empty
     * @param windowStart         fixed start of the account eligibility window; rolling when unset
     * @param windowMonths        size of the rolling window in whole months before the current month
     * @param monthEndWindowDays  days at the start of a month during which the previous month gets closed
     */
    @ConfigurationProperties("churnguard.pipeline")
    public record Pipeline(
            @DefaultValue("UTC") String zone,
            @DefaultValue("true") boolean gapDetection,
            LocalDate startDate,
            LocalDate windowStart,
            @DefaultValue("12") int windowMonths,
            @DefaultValue("3") int monthEndWindowDays) {}
}
