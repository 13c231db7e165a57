package quest.gekko.churnguard.service.core;

import quest.gekko.churnguard.domain.Account;
import quest.gekko.churnguard.domain.AccountStatus;
import quest.gekko.churnguard.dto.AccountRecord;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Lifecycle predicates deciding which accounts take part in which month. All checks are evaluated against the month
 * being processed, never against the account's current status.
 */
public final class AccountEligibility {

    private AccountEligibility() {
    }

    /**
     * An account gets a monthly row when it launched by the end of the month and was not archived before the month
     * started. Archived accounts therefore stay visible up to and including their archive month.
     */
    public static boolean isVisibleInMonth(Account account, YearMonth month) {
        if (account.getLaunchedAt() == null) return false;
        if (account.getLaunchedAt().isAfter(month.atEndOfMonth())) return false;
        LocalDate cutoff = account.archiveCutoff();
        return cutoff == null || !cutoff.isBefore(month.atDay(1));
    }

    /**
     * Daily facts are only collected for accounts alive for the whole month containing {@code date}.
     */
    public static boolean isEligibleForDay(Account account, LocalDate date) {
        if (account.getLaunchedAt() == null || account.getLaunchedAt().isAfter(date)) return false;
        LocalDate cutoff = account.archiveCutoff();
        return cutoff == null || cutoff.isAfter(YearMonth.from(date).atEndOfMonth());
    }

    public static boolean wasArchivedIn(Account account, YearMonth month) {
        LocalDate archived = account.reportedArchiveDate();
        return archived != null && YearMonth.from(archived).equals(month);
    }

    /**
     * Registry window: launched by {@code windowEnd} (or launch date unknown), and if ARCHIVED, archived on or after
     * {@code windowStart}. An ARCHIVED account without any archive date is too old to place and is left out.
     */
    public static boolean isTrackable(AccountRecord record, AccountStatus status, LocalDate windowStart, LocalDate windowEnd) {
        if (record.launchedAt() != null && record.launchedAt().isAfter(windowEnd)) return false;
        if (status != AccountStatus.ARCHIVED) return true;
        LocalDate archived = record.archivedAt() != null ? record.archivedAt() : record.earliestUnitArchivedAt();
        return archived != null && !archived.isBefore(windowStart);
    }
}
