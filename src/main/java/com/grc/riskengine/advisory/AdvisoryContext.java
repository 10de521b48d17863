package com.grc.riskengine.advisory;

import com.grc.riskengine.domain.CriticalityLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Feature context sent to the advisory service for one service score.
 */
@Value
@Builder
public class AdvisoryContext {

    Long serviceId;
    String serviceName;
    CriticalityLevel criticalityLevel;
    double ciaWeighted;
    double dependencyImpact;
    double riskCorrelation;
    double businessImpact;
    double technical;
    double historical;
    int contributingRiskCount;
    int highSeverityRiskCount;
}
