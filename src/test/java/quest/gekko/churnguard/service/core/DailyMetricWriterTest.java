package quest.gekko.churnguard.service.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import quest.gekko.churnguard.domain.DailyMetric;
import quest.gekko.churnguard.domain.MetricType;
import quest.gekko.churnguard.repository.DailyMetricRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({ DailyMetricWriter.class, DailyMetricWriterTest.Config.class })
@DisplayName("DailyMetricWriter Integration Tests")
class DailyMetricWriterTest {

    private static final Instant NOW = Instant.parse("2025-08-15T06:30:00Z");
    private static final LocalDate DAY = LocalDate.of(2025, 8, 14);

    @TestConfiguration
    static class Config {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private DailyMetricWriter writer;

    @Autowired
    private DailyMetricRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private DailyMetric reload() {
        entityManager.flush();
        entityManager.clear();
        return repository.findByAccountIdAndMetricDate("A1", DAY).orElseThrow();
    }

    @Test
    @DisplayName("First metric creates the row with siblings at zero")
    void createsRow() {
        DailyMetricWriter.Outcome outcome = writer.upsert(MetricType.SPEND, "A1", DAY, new BigDecimal("42.10"));

        assertThat(outcome).isEqualTo(DailyMetricWriter.Outcome.CREATED);
        DailyMetric row = reload();
        assertThat(row.getSpend()).isEqualByComparingTo("42.10");
        assertThat(row.getSpendUpdatedAt()).isEqualTo(NOW);
        assertThat(row.getMessagesDelivered()).isZero();
        assertThat(row.getRedemptions()).isZero();
        assertThat(row.getActiveSubscribers()).isZero();
        assertThat(row.getMessagesUpdatedAt()).isNull();
    }

    @Test
    @DisplayName("Later metrics only touch their own field")
    void updatesSingleField() {
        writer.upsert(MetricType.SPEND, "A1", DAY, new BigDecimal("42.10"));
        reload();

        DailyMetricWriter.Outcome messages = writer.upsert(MetricType.MESSAGES, "A1", DAY, new BigDecimal("300"));
        DailyMetricWriter.Outcome subs = writer.upsert(MetricType.ACTIVE_SUBSCRIBERS, "A1", DAY, new BigDecimal("1250"));

        assertThat(messages).isEqualTo(DailyMetricWriter.Outcome.UPDATED);
        assertThat(subs).isEqualTo(DailyMetricWriter.Outcome.UPDATED);
        DailyMetric row = reload();
        assertThat(row.getSpend()).isEqualByComparingTo("42.10");
        assertThat(row.getMessagesDelivered()).isEqualTo(300);
        assertThat(row.getActiveSubscribers()).isEqualTo(1250);
        assertThat(row.getRedemptions()).isZero();
        assertThat(row.getRedemptionsUpdatedAt()).isNull();
        assertThat(repository.count()).isEqualTo(1);
    }
}
