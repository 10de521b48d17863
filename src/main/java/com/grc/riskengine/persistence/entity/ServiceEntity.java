package com.grc.riskengine.persistence.entity;

import com.grc.riskengine.domain.CriticalityLevel;
import com.grc.riskengine.domain.RiskTrend;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A business-critical service. Score columns are written only by a full recompute.
 */
@Entity
@Table(name = "services", indexes = {
    @Index(name = "idx_service_name", columnList = "name"),
    @Index(name = "idx_service_criticality", columnList = "criticality_level")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "criticality_level", nullable = false)
    @Builder.Default
    private CriticalityLevel criticalityLevel = CriticalityLevel.MEDIUM;

    @Column(name = "confidentiality_score", nullable = false)
    @Builder.Default
    private int confidentialityScore = 1;

    @Column(name = "integrity_score", nullable = false)
    @Builder.Default
    private int integrityScore = 1;

    @Column(name = "availability_score", nullable = false)
    @Builder.Default
    private int availabilityScore = 1;

    /** 0–100; null until the first recompute. */
    @Column(name = "aggregate_risk_score")
    private Double aggregateRiskScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_trend", nullable = false)
    @Builder.Default
    private RiskTrend riskTrend = RiskTrend.STABLE;

    @Column(name = "last_risk_update")
    private Instant lastRiskUpdate;

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
}
