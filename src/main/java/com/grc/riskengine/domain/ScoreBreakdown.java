package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Sub-scores (each 0–100) and blending inputs behind a composite score.
 */
@Value
@Builder
public class ScoreBreakdown {

    double ciaWeighted;
    double dependencyImpact;
    double riskCorrelation;
    double businessImpact;
    double technical;
    double historical;
    /** Weighted combination of the six sub-scores before the prediction blend. */
    double algorithmicScore;
    double predictionScore;
    double predictionConfidence;
    String predictionSource;
    double cascadingBoost;
    double compositeScore;
}
