package quest.gekko.churnguard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.churnguard.domain.EtlRun;
import quest.gekko.churnguard.domain.PipelineStep;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface EtlRunRepository extends JpaRepository<EtlRun, Long> {
    Optional<EtlRun> findByRunDateAndStep(final LocalDate runDate, final PipelineStep step);

    List<EtlRun> findByRunDateOrderByStepAsc(final LocalDate runDate);
}
