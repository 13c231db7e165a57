package quest.gekko.churnguard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One row per pipeline step per processing date. Re-running a date overwrites the step's row.
 */
@Entity
@Table(name = "etl_runs", uniqueConstraints = @UniqueConstraint(columnNames = { "run_date", "step" }))
@Getter @Setter
public class EtlRun {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "run_date", nullable = false)
    LocalDate runDate;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 32)
    PipelineStep step;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 16)
    StepStatus status;

    @Column(name = "started_at")
    Instant startedAt;

    @Column(name = "completed_at")
    Instant completedAt;

    @Column(name = "error_message", length = 2000)
    String errorMessage;

    @Column(length = 2000)
    String detail;
}
