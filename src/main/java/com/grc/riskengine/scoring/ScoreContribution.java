package com.grc.riskengine.scoring;

import com.grc.riskengine.domain.CascadingType;
import lombok.Builder;
import lombok.Value;

/**
 * One risk's contribution to a service score, after association weighting.
 */
@Value
@Builder(toBuilder = true)
class ScoreContribution {

    Long riskId;
    double score;
    double confidence;
    double weight;
    int severity;
    int likelihood;
    int confidentialityImpact;
    int integrityImpact;
    int availabilityImpact;
    CascadingType type;
}
