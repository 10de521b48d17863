package com.grc.riskengine.persistence.entity;

import com.grc.riskengine.domain.RiskTrend;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per persisted service recompute. Rows past the retention period are purged.
 */
@Entity
@Table(name = "risk_score_history", indexes = {
    @Index(name = "idx_history_service_recorded", columnList = "service_id, recorded_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskScoreHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "previous_score")
    private Double previousScore;

    @Column(name = "composite_score", nullable = false)
    private double compositeScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "trend", nullable = false)
    private RiskTrend trend;

    @Column(name = "algorithmic_score", nullable = false)
    private double algorithmicScore;

    @Column(name = "prediction_score", nullable = false)
    private double predictionScore;

    @Column(name = "prediction_confidence", nullable = false)
    private double predictionConfidence;

    @Column(name = "prediction_source")
    private String predictionSource;

    @Column(name = "cascading_boost", nullable = false)
    private double cascadingBoost;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
