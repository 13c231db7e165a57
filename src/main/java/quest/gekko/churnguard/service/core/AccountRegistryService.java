package quest.gekko.churnguard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.churnguard.config.ChurnGuardProperties;
import quest.gekko.churnguard.domain.Account;
import quest.gekko.churnguard.domain.AccountStatus;
import quest.gekko.churnguard.dto.AccountRecord;
import quest.gekko.churnguard.dto.RegistrySyncResult;
import quest.gekko.churnguard.repository.AccountRepository;
import quest.gekko.churnguard.service.integration.connector.FactSourceConnector;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * Best-effort refresh of the account registry from the warehouse feed. Accounts that drop out of the feed are kept.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountRegistryService {
    private final FactSourceConnector factSource;
    private final AccountRepository accountRepository;
    private final ChurnGuardProperties.Pipeline pipeline;
    private final Clock clock;

    public RegistrySyncResult refreshAccounts() {
        LocalDate windowEnd = LocalDate.now(clock);
        LocalDate windowStart = windowStart();

        List<AccountRecord> feed = factSource.fetchAccounts(windowStart, windowEnd);
        int upserted = 0;
        int skipped = 0;
        int failed = 0;

        for (AccountRecord record : feed) {
            try {
                AccountStatus status = AccountStatus.fromFeed(record.status());
                if (!AccountEligibility.isTrackable(record, status, windowStart, windowEnd)) {
                    skipped++;
                    continue;
                }
                upsert(record, status);
                upserted++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Skipping account {}: {}", record.accountId(), e.getMessage());
            }
        }

        log.info("✅ Account registry refreshed: {} upserted, {} outside window, {} failed (feed size {})",
                upserted, skipped, failed, feed.size());
        return new RegistrySyncResult(feed.size(), upserted, skipped, failed);
    }

    LocalDate windowStart() {
        if (pipeline.windowStart() != null) return pipeline.windowStart();
        return YearMonth.now(clock).minusMonths(pipeline.windowMonths()).atDay(1);
    }

    private Account upsert(AccountRecord record, AccountStatus status) {
        if (record.accountId() == null || record.accountId().isBlank()) {
            throw new IllegalArgumentException("Feed row without account_id");
        }
        Account account = accountRepository.findById(record.accountId())
                .orElseGet(() -> {
                    Account created = new Account();
                    created.setAccountId(record.accountId());
                    return created;
                });

        // Only overwrite name/owner when an operator hasn't pinned them
        if (!account.isNameProtected() || account.getName() == null) {
            account.setName(record.name() != null ? record.name() : "Unknown Account");
        }
        if (!account.isOwnerProtected() || account.getOwner() == null) {
            account.setOwner(record.owner() != null ? record.owner() : "Unassigned");
        }
        account.setStatus(status);
        account.setLaunchedAt(record.launchedAt());
        account.setArchivedAt(record.archivedAt());
        account.setEarliestUnitArchivedAt(record.earliestUnitArchivedAt());
        account.setLastUpdated(clock.instant());
        return accountRepository.save(account);
    }
}
