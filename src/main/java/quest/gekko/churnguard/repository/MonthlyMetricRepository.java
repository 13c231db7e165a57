package quest.gekko.churnguard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.churnguard.domain.MonthlyMetric;

import java.util.List;
import java.util.Optional;

public interface MonthlyMetricRepository extends JpaRepository<MonthlyMetric, Long> {
    List<MonthlyMetric> findByMetricMonthOrderByAccountIdAsc(final String month);

    Optional<MonthlyMetric> findByAccountIdAndMetricMonth(final String accountId, final String month);

    boolean existsByMetricMonthAndHistoricalRiskLevelIsNotNull(final String month);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from MonthlyMetric m where m.metricMonth = :month")
    int deleteMonth(@Param("month") final String month);
}
