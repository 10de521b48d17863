package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of a full service recompute.
 */
@Value
@Builder
public class ServiceRiskScore {

    Long serviceId;
    String serviceName;
    /** Stored aggregate before this recompute; null if never scored. */
    Double previousScore;
    double compositeScore;
    RiskTrend trend;
    int confidentialityScore;
    int integrityScore;
    int availabilityScore;
    int contributingRiskCount;
    ScoreBreakdown breakdown;
    Instant computedAt;
}
