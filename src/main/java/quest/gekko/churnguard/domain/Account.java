package quest.gekko.churnguard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "accounts", indexes = {
        @Index(name = "idx_accounts_status", columnList = "status"),
        @Index(name = "idx_accounts_launched_at", columnList = "launched_at")
})
@Getter @Setter
public class Account {
    @Id
    @Column(name = "account_id", nullable = false)
    String accountId;

    String name;

    String owner;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    AccountStatus status;

    @Column(name = "launched_at")
    LocalDate launchedAt;

    @Column(name = "archived_at")
    LocalDate archivedAt;

    @Column(name = "earliest_unit_archived_at")
    LocalDate earliestUnitArchivedAt;

    // set by operators; a registry refresh keeps the stored value
    @Column(name = "name_protected", nullable = false)
    boolean nameProtected;

    @Column(name = "owner_protected", nullable = false)
    boolean ownerProtected;

    @Column(name = "last_updated")
    Instant lastUpdated;

    /**
     * Last moment the account counts as alive: the earlier of the two archive dates.
     */
    public LocalDate archiveCutoff() {
        if (archivedAt == null) return earliestUnitArchivedAt;
        if (earliestUnitArchivedAt == null) return archivedAt;
        return archivedAt.isBefore(earliestUnitArchivedAt) ? archivedAt : earliestUnitArchivedAt;
    }

    /**
     * Archive date shown in risk reasons: the account-level date when present, else the unit fallback.
     */
    public LocalDate reportedArchiveDate() {
        return archivedAt != null ? archivedAt : earliestUnitArchivedAt;
    }
}
