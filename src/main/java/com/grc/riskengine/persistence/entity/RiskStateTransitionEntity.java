package com.grc.riskengine.persistence.entity;

import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.LifecycleState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit trail of risk decisions and state changes. Suppressed candidates have no
 * risk id and are identified by their dedupe key.
 */
@Entity
@Table(name = "risk_state_transitions", indexes = {
    @Index(name = "idx_transition_risk", columnList = "risk_id"),
    @Index(name = "idx_transition_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskStateTransitionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "risk_id")
    private Long riskId;

    @Column(name = "dedupe_key")
    private String dedupeKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_state")
    private LifecycleState previousState;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_state", nullable = false)
    private LifecycleState currentState;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status")
    private ApprovalStatus approvalStatus;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "automated", nullable = false)
    private boolean automated;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "actor")
    private String actor;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
