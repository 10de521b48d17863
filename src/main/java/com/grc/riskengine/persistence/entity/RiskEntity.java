package com.grc.riskengine.persistence.entity;

import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.LifecycleState;
import com.grc.riskengine.domain.RiskCategory;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A risk record. Never deleted; merges and approvals mutate it in place.
 */
@Entity
@Table(name = "risks", indexes = {
    @Index(name = "idx_risk_dedupe_key", columnList = "dedupe_key"),
    @Index(name = "idx_risk_service_category", columnList = "primary_service_id, category"),
    @Index(name = "idx_risk_created_at", columnList = "created_at"),
    @Index(name = "idx_risk_approval_status", columnList = "approval_status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false)
    private RiskCategory category;

    @Column(name = "source_type")
    private String sourceType;

    @Column(name = "primary_service_id", nullable = false)
    private Long primaryServiceId;

    /** 0–100. */
    @Column(name = "composite_score", nullable = false)
    private double compositeScore;

    /** 0–1. */
    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "severity", nullable = false)
    private int severity;

    @Column(name = "likelihood", nullable = false)
    private int likelihood;

    @Column(name = "confidentiality_impact", nullable = false)
    private int confidentialityImpact;

    @Column(name = "integrity_impact", nullable = false)
    private int integrityImpact;

    @Column(name = "availability_impact", nullable = false)
    private int availabilityImpact;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", nullable = false)
    @Builder.Default
    private ApprovalStatus approvalStatus = ApprovalStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "lifecycle_state", nullable = false)
    @Builder.Default
    private LifecycleState lifecycleState = LifecycleState.DRAFT;

    @Column(name = "dedupe_key", nullable = false)
    private String dedupeKey;

    @Column(name = "source_event_id")
    private String sourceEventId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "risk_merged_from", joinColumns = @JoinColumn(name = "risk_id"))
    @Column(name = "source_id", nullable = false)
    @Builder.Default
    private List<String> mergedFrom = new ArrayList<>();

    /** Technique, actor and indicator identifiers backing the risk. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "risk_threat_intel_sources", joinColumns = @JoinColumn(name = "risk_id"))
    @Column(name = "identifier", nullable = false)
    @Builder.Default
    private Set<String> threatIntelSources = new LinkedHashSet<>();

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isActive() {
        return lifecycleState == LifecycleState.ACTIVE;
    }
}
