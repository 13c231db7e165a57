package quest.gekko.churnguard.service.integration.connector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.churnguard.config.ChurnGuardProperties;
import quest.gekko.churnguard.domain.MetricType;
import quest.gekko.churnguard.dto.AccountRecord;
import quest.gekko.churnguard.dto.FactTotal;
import quest.gekko.churnguard.util.RateLimiter;

import java.time.LocalDate;
import java.util.List;

/**
 * HTTP client for the warehouse export API. Each call goes through the {@link RateLimiter} so a flaky warehouse gets
 * a few retries before the caller sees a failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WarehouseConnector implements FactSourceConnector {
    private final WebClient http;
    private final RateLimiter rateLimiter;
    private final ChurnGuardProperties.Warehouse warehouse;

    @Override
    public List<AccountRecord> fetchAccounts(LocalDate windowStart, LocalDate windowEnd) {
        List<AccountRecord> accounts = rateLimiter.call("accounts " + windowStart + ".." + windowEnd, () -> http.get()
                .uri(uri -> uri.path("/accounts")
                        .queryParam("windowStart", windowStart)
                        .queryParam("windowEnd", windowEnd)
                        .build())
                .retrieve()
                .bodyToFlux(AccountRecord.class)
                .collectList()
                .block(warehouse.timeout()));

        if (accounts == null) return List.of();
        log.info("Fetched {} accounts for window {} to {}", accounts.size(), windowStart, windowEnd);
        return accounts;
    }

    @Override
    public List<FactTotal> fetchDailyTotals(MetricType metric, LocalDate date) {
        List<FactTotal> totals = rateLimiter.call(metric.path() + " " + date, () -> http.get()
                .uri(uri -> uri.path("/facts/{metric}")
                        .queryParam("date", date)
                        .build(metric.path()))
                .retrieve()
                .bodyToFlux(FactTotal.class)
                .collectList()
                .block(warehouse.timeout()));

        if (totals == null) return List.of();
        // the export is pre-filtered, but a zero row would read as "extracted and idle"
        return totals.stream()
                .filter(t -> t.accountId() != null && t.hasActivity())
                .toList();
    }
}
