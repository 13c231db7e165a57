package quest.gekko.churnguard.service.integration.connector;

import quest.gekko.churnguard.domain.MetricType;
import quest.gekko.churnguard.dto.AccountRecord;
import quest.gekko.churnguard.dto.FactTotal;

import java.time.LocalDate;
import java.util.List;

/**
 * Read access to the upstream analytical warehouse. Implementations hide the query dialect.
 */
public interface FactSourceConnector {

    /** Accounts launched by {@code windowEnd} that were not archived before {@code windowStart}. */
    List<AccountRecord> fetchAccounts(LocalDate windowStart, LocalDate windowEnd);

    /** Per-account totals of one metric for a single day; accounts without activity are left out. */
    List<FactTotal> fetchDailyTotals(MetricType metric, LocalDate date);
}
