package quest.gekko.churnguard.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.churnguard.domain.DailyMetric;
import quest.gekko.churnguard.domain.MetricType;
import quest.gekko.churnguard.repository.DailyMetricRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Writes one metric value into the daily ledger. Each call is its own short transaction.
 */
@Component
@RequiredArgsConstructor
public class DailyMetricWriter {
    private final DailyMetricRepository dailyMetricRepository;
    private final Clock clock;

    public enum Outcome { UPDATED, CREATED }

    @Transactional
    public Outcome upsert(MetricType metric, String accountId, LocalDate date, BigDecimal value) {
        Instant now = clock.instant();
        if (update(metric, accountId, date, value, now) > 0) {
            return Outcome.UPDATED;
        }
        // siblings start at zero; saveAndFlush surfaces a unique-key race right here
        dailyMetricRepository.saveAndFlush(DailyMetric.of(accountId, date).apply(metric, value, now));
        return Outcome.CREATED;
    }

    private int update(MetricType metric, String accountId, LocalDate date, BigDecimal value, Instant at) {
        return switch (metric) {
            case SPEND -> dailyMetricRepository.updateSpend(accountId, date, value, at);
            case MESSAGES -> dailyMetricRepository.updateMessages(accountId, date, value.longValue(), at);
            case REDEMPTIONS -> dailyMetricRepository.updateRedemptions(accountId, date, value.longValue(), at);
            case ACTIVE_SUBSCRIBERS -> dailyMetricRepository.updateActiveSubscribers(accountId, date, value.longValue(), at);
        };
    }
}
