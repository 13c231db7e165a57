package quest.gekko.churnguard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "daily_metrics",
        uniqueConstraints = @UniqueConstraint(columnNames = { "account_id", "`date`" }),
        indexes = @Index(name = "idx_daily_metrics_date", columnList = "`date`"))
@Getter @Setter
public class DailyMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "account_id", nullable = false)
    String accountId;

    @Column(name = "`date`", nullable = false)
    LocalDate metricDate;

    @Column(precision = 14, scale = 2, nullable = false)
    BigDecimal spend = BigDecimal.ZERO;

    @Column(name = "messages_delivered", nullable = false)
    long messagesDelivered;

    @Column(nullable = false)
    long redemptions;

    @Column(name = "active_subscribers", nullable = false)
    long activeSubscribers;

    // null timestamp = metric not extracted yet for this day
    @Column(name = "spend_updated_at")
    Instant spendUpdatedAt;

    @Column(name = "messages_updated_at")
    Instant messagesUpdatedAt;

    @Column(name = "redemptions_updated_at")
    Instant redemptionsUpdatedAt;

    @Column(name = "subscribers_updated_at")
    Instant subscribersUpdatedAt;

    public static DailyMetric of(String accountId, LocalDate date) {
        DailyMetric row = new DailyMetric();
        row.setAccountId(accountId);
        row.setMetricDate(date);
        return row;
    }

    /**
     * Sets a single metric and its timestamp, leaving the other three untouched.
     */
    public DailyMetric apply(MetricType metric, BigDecimal value, Instant at) {
        switch (metric) {
            case SPEND -> { spend = value; spendUpdatedAt = at; }
            case MESSAGES -> { messagesDelivered = value.longValue(); messagesUpdatedAt = at; }
            case REDEMPTIONS -> { redemptions = value.longValue(); redemptionsUpdatedAt = at; }
            case ACTIVE_SUBSCRIBERS -> { activeSubscribers = value.longValue(); subscribersUpdatedAt = at; }
        }
        return this;
    }
}
