package com.platform.failover.persistence.entity;

import com.platform.failover.model.StepOutcome;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One recorded step attempt of a failover. Append-only.
 */
@Entity
@Table(name = "failover_steps", indexes = {
    @Index(name = "idx_failover_steps_event", columnList = "event_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailoverStepEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "event_id", nullable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private FailoverEventEntity event;
    
    @Column(name = "step_sequence", nullable = false, updatable = false)
    private int sequence;
    
    @Column(name = "step_name", length = 50, nullable = false, updatable = false)
    private String stepName;
    
    @Column(nullable = false, updatable = false)
    private int attempt;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", columnDefinition = "VARCHAR(30)", nullable = false, updatable = false)
    private StepOutcome outcome;
    
    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;
    
    @Column(name = "finished_at", nullable = false, updatable = false)
    private Instant finishedAt;
    
    @Column(columnDefinition = "TEXT", updatable = false)
    private String detail;
}
