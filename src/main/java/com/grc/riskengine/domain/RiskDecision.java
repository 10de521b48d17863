package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RiskDecision {

    DecisionOutcome outcome;
    double confidence;
    double compositeScore;
    String reasoning;
}
