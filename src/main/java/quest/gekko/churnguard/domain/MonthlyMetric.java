package quest.gekko.churnguard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.List;

@Entity
@Table(name = "monthly_metrics",
        uniqueConstraints = @UniqueConstraint(columnNames = { "account_id", "`month`" }),
        indexes = @Index(name = "idx_monthly_metrics_month", columnList = "`month`"))
@Getter @Setter
public class MonthlyMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "account_id", nullable = false)
    String accountId;

    // YYYY-MM
    @Column(name = "`month`", nullable = false, length = 7)
    String metricMonth;

    @Column(name = "month_label")
    String monthLabel;

    @Column(name = "total_spend", precision = 16, scale = 2, nullable = false)
    BigDecimal totalSpend = BigDecimal.ZERO;

    @Column(name = "total_messages", nullable = false)
    long totalMessages;

    @Column(name = "total_redemptions", nullable = false)
    long totalRedemptions;

    @Column(name = "avg_active_subscribers", nullable = false)
    long avgActiveSubscribers;

    @Enumerated(EnumType.STRING)
    @Column(name = "trending_risk_level")
    RiskLevel trendingRiskLevel;

    @Convert(converter = ReasonListConverter.class)
    @Column(name = "trending_risk_reasons", length = 1024)
    List<String> trendingRiskReasons;

    @Enumerated(EnumType.STRING)
    @Column(name = "historical_risk_level")
    RiskLevel historicalRiskLevel;

    @Convert(converter = ReasonListConverter.class)
    @Column(name = "risk_reasons", length = 1024)
    List<String> riskReasons;

    public boolean isClosed() {
        return historicalRiskLevel != null;
    }

    public void applyTrending(RiskLevel level, List<String> reasons) {
        this.trendingRiskLevel = level;
        this.trendingRiskReasons = reasons;
    }

    /**
     * Closes the month: the historical slot becomes authoritative and the trending slot is cleared.
     */
    public void close(RiskLevel level, List<String> reasons) {
        this.historicalRiskLevel = level;
        this.riskReasons = reasons;
        this.trendingRiskLevel = null;
        this.trendingRiskReasons = null;
    }
}
