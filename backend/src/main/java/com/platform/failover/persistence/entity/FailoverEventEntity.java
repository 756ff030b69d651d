package com.platform.failover.persistence.entity;

import com.platform.failover.model.FailoverPhase;
import com.platform.failover.model.FailoverTrigger;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for failover events.
 * {@code liveServiceId} is set only while the event is live; its unique constraint keeps
 * at most one live event per service at the database level.
 */
@Entity
@Table(name = "failover_events", indexes = {
    @Index(name = "idx_failover_service", columnList = "service_id"),
    @Index(name = "idx_failover_triggered_at", columnList = "triggered_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailoverEventEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(name = "service_id", length = 100, nullable = false)
    private String serviceId;
    
    @Column(name = "live_service_id", length = 100, unique = true)
    private String liveServiceId;
    
    @Column(name = "from_region", length = 100, nullable = false)
    private String fromRegion;
    
    @Column(name = "to_region", length = 100, nullable = false)
    private String toRegion;
    
    @Column(name = "triggered_at", nullable = false, updatable = false)
    private Instant triggeredAt;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", columnDefinition = "VARCHAR(20)", nullable = false)
    private FailoverTrigger trigger;
    
    @Column(name = "triggered_by", length = 100)
    private String triggeredBy;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "phase", columnDefinition = "VARCHAR(20)", nullable = false)
    private FailoverPhase phase;
    
    @Column(name = "finished_at")
    private Instant finishedAt;
    
    @Column(columnDefinition = "TEXT")
    private String reason;
    
    @OneToMany(mappedBy = "event", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("sequence ASC")
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<FailoverStepEntity> steps = new ArrayList<>();
    
    @Version
    @Column(nullable = false)
    private Long version;
    
    @PrePersist
    protected void onCreate() {
        if (version == null) {
            version = 0L;
        }
    }
    
    public void addStep(FailoverStepEntity step) {
        step.setEvent(this);
        steps.add(step);
    }
}
