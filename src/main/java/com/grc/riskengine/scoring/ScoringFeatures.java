package com.grc.riskengine.scoring;

import com.grc.riskengine.advisory.AdvisoryContext;
import com.grc.riskengine.domain.CriticalityLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Feature vector shared by the algorithmic score and the predictors. Sub-scores are 0–100.
 */
@Value
@Builder
public class ScoringFeatures {

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

    double[] asVector() {
        return new double[]{ciaWeighted, dependencyImpact, riskCorrelation, businessImpact, technical, historical};
    }

    AdvisoryContext toAdvisoryContext() {
        return AdvisoryContext.builder()
                .serviceId(serviceId)
                .serviceName(serviceName)
                .criticalityLevel(criticalityLevel)
                .ciaWeighted(ciaWeighted)
                .dependencyImpact(dependencyImpact)
                .riskCorrelation(riskCorrelation)
                .businessImpact(businessImpact)
                .technical(technical)
                .historical(historical)
                .contributingRiskCount(contributingRiskCount)
                .highSeverityRiskCount(highSeverityRiskCount)
                .build();
    }
}
