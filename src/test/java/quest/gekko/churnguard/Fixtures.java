package quest.gekko.churnguard;

import quest.gekko.churnguard.domain.Account;
import quest.gekko.churnguard.domain.AccountStatus;
import quest.gekko.churnguard.domain.DailyMetric;

import java.math.BigDecimal;
import java.time.LocalDate;

public final class Fixtures {

    private Fixtures() {
    }

    public static Account account(String id, AccountStatus status, LocalDate launchedAt) {
        Account account = new Account();
        account.setAccountId(id);
        account.setName("Account " + id);
        account.setOwner("owner@example.com");
        account.setStatus(status);
        account.setLaunchedAt(launchedAt);
        return account;
    }

    public static Account archived(String id, LocalDate launchedAt, LocalDate archivedAt) {
        Account account = account(id, AccountStatus.ARCHIVED, launchedAt);
        account.setArchivedAt(archivedAt);
        return account;
    }

    public static DailyMetric daily(String accountId, LocalDate date, String spend, long messages, long redemptions,
                                    long subscribers) {
        DailyMetric row = DailyMetric.of(accountId, date);
        row.setSpend(new BigDecimal(spend));
        row.setMessagesDelivered(messages);
        row.setRedemptions(redemptions);
        row.setActiveSubscribers(subscribers);
        return row;
    }
}
