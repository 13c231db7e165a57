package quest.gekko.churnguard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.churnguard.domain.Account;

public interface AccountRepository extends JpaRepository<Account, String> {
}
