package quest.gekko.churnguard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.churnguard.domain.DailyMetric;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DailyMetricRepository extends JpaRepository<DailyMetric, Long> {
    Optional<DailyMetric> findByAccountIdAndMetricDate(final String accountId, final LocalDate date);

    @Query("select d from DailyMetric d where d.metricDate between :from and :to")
    List<DailyMetric> findAllBetween(@Param("from") final LocalDate from, @Param("to") final LocalDate to);

    @Query("select max(d.metricDate) from DailyMetric d")
    Optional<LocalDate> findLatestDate();

    // Single-field updates: a metric job never overwrites the other three metrics of the row.

    @Modifying
    @Query("update DailyMetric d set d.spend = :value, d.spendUpdatedAt = :at where d.accountId = :accountId and d.metricDate = :date")
    int updateSpend(@Param("accountId") String accountId, @Param("date") LocalDate date,
                    @Param("value") BigDecimal value, @Param("at") Instant at);

    @Modifying
    @Query("update DailyMetric d set d.messagesDelivered = :value, d.messagesUpdatedAt = :at where d.accountId = :accountId and d.metricDate = :date")
    int updateMessages(@Param("accountId") String accountId, @Param("date") LocalDate date,
                       @Param("value") long value, @Param("at") Instant at);

    @Modifying
    @Query("update DailyMetric d set d.redemptions = :value, d.redemptionsUpdatedAt = :at where d.accountId = :accountId and d.metricDate = :date")
    int updateRedemptions(@Param("accountId") String accountId, @Param("date") LocalDate date,
                          @Param("value") long value, @Param("at") Instant at);

    @Modifying
    @Query("update DailyMetric d set d.activeSubscribers = :value, d.subscribersUpdatedAt = :at where d.accountId = :accountId and d.metricDate = :date")
    int updateActiveSubscribers(@Param("accountId") String accountId, @Param("date") LocalDate date,
                                @Param("value") long value, @Param("at") Instant at);
}
