package quest.gekko.churnguard.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.churnguard.config.ChurnGuardProperties;
import quest.gekko.churnguard.domain.Account;
import quest.gekko.churnguard.domain.AccountStatus;
import quest.gekko.churnguard.dto.AccountRecord;
import quest.gekko.churnguard.dto.RegistrySyncResult;
import quest.gekko.churnguard.exception.FactSourceException;
import quest.gekko.churnguard.repository.AccountRepository;
import quest.gekko.churnguard.service.integration.connector.FactSourceConnector;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static quest.gekko.churnguard.Fixtures.account;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccountRegistryService Unit Tests")
class AccountRegistryServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-08-15T06:30:00Z"), ZoneOffset.UTC);
    private static final LocalDate WINDOW_START = LocalDate.of(2024, 8, 1);
    private static final LocalDate TODAY = LocalDate.of(2025, 8, 15);

    @Mock
    private FactSourceConnector factSource;

    @Mock
    private AccountRepository accountRepository;

    private AccountRegistryService service;

    @BeforeEach
    void setUp() {
        ChurnGuardProperties.Pipeline pipeline = new ChurnGuardProperties.Pipeline("UTC", true, null, null, 12, 3);
        service = new AccountRegistryService(factSource, accountRepository, pipeline, CLOCK);
    }

    private static AccountRecord record(String id, String status, LocalDate launched, LocalDate archived) {
        return new AccountRecord(id, "Name " + id, status, launched, archived, null, "feed-owner");
    }

    @Test
    @DisplayName("Rolling window starts twelve whole months back")
    void rollingWindow() {
        assertThat(service.windowStart()).isEqualTo(WINDOW_START);
    }

    @Test
    @DisplayName("Upserts trackable accounts, skips the rest, survives a bad row")
    void refreshesRegistry() {
        // Given
        when(factSource.fetchAccounts(WINDOW_START, TODAY)).thenReturn(List.of(
                record("A1", "ACTIVE", LocalDate.of(2025, 1, 1), null),
                record("A2", "ARCHIVED", LocalDate.of(2023, 1, 1), LocalDate.of(2024, 3, 1)),
                record("A3", "SOMETHING_ELSE", LocalDate.of(2025, 1, 1), null),
                record("A4", "FROZEN", LocalDate.of(2025, 2, 1), null)));
        when(accountRepository.findById(anyString())).thenReturn(Optional.empty());
        when(accountRepository.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        RegistrySyncResult result = service.refreshAccounts();

        // Then
        assertThat(result.fetched()).isEqualTo(4);
        assertThat(result.upserted()).isEqualTo(2);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);

        ArgumentCaptor<Account> saved = ArgumentCaptor.forClass(Account.class);
        verify(accountRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(Account::getAccountId).containsExactly("A1", "A4");
        assertThat(saved.getAllValues().get(0).getStatus()).isEqualTo(AccountStatus.LAUNCHED);
        assertThat(saved.getAllValues().get(0).getLastUpdated()).isEqualTo(CLOCK.instant());
    }

    @Test
    @DisplayName("Protected name and owner survive a refresh")
    void keepsProtectedFields() {
        Account existing = account("A1", AccountStatus.LAUNCHED, LocalDate.of(2025, 1, 1));
        existing.setName("Pinned Name");
        existing.setNameProtected(true);
        existing.setOwner("old-owner");
        when(factSource.fetchAccounts(WINDOW_START, TODAY)).thenReturn(List.of(
                record("A1", "PAUSED", LocalDate.of(2025, 1, 1), null)));
        when(accountRepository.findById("A1")).thenReturn(Optional.of(existing));
        when(accountRepository.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));

        service.refreshAccounts();

        assertThat(existing.getName()).isEqualTo("Pinned Name");
        assertThat(existing.getOwner()).isEqualTo("feed-owner");
        assertThat(existing.getStatus()).isEqualTo(AccountStatus.PAUSED);
    }

    @Test
    @DisplayName("A failing feed propagates and nothing is deleted")
    void feedFailurePropagates() {
        when(factSource.fetchAccounts(WINDOW_START, TODAY)).thenThrow(new FactSourceException("down"));

        assertThatThrownBy(() -> service.refreshAccounts()).isInstanceOf(FactSourceException.class);
        verify(accountRepository, never()).delete(any());
        verify(accountRepository, never()).deleteAll();
    }
}
