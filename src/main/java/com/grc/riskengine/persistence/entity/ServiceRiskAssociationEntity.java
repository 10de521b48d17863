package com.grc.riskengine.persistence.entity;

import com.grc.riskengine.domain.CascadingType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Weighted link between a service and a risk. Contribution to the service's
 * aggregate is risk score times weight.
 */
@Entity
@Table(name = "service_risk_associations", indexes = {
    @Index(name = "idx_association_service", columnList = "service_id"),
    @Index(name = "idx_association_risk", columnList = "risk_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_association_service_risk", columnNames = {"service_id", "risk_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceRiskAssociationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "risk_id", nullable = false)
    private Long riskId;

    /** 0–1. */
    @Column(name = "weight", nullable = false)
    private double weight;

    @Enumerated(EnumType.STRING)
    @Column(name = "cascading_type", nullable = false)
    private CascadingType cascadingType;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    /** Service the cascade reached this one from; null for direct associations. */
    @Column(name = "via_service_id")
    private Long viaServiceId;

    @Column(name = "cascade_depth", nullable = false)
    private int cascadeDepth;

    @Column(name = "requires_approval", nullable = false)
    private boolean requiresApproval;

    @Column(name = "review_approved", nullable = false)
    private boolean reviewApproved;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /** Flagged cascades count toward scoring only once reviewed. */
    public boolean isEffective() {
        return !requiresApproval || reviewApproved;
    }
}
