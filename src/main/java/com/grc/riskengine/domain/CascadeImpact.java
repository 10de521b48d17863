package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One dependent service reached by a cascade.
 */
@Value
@Builder
public class CascadeImpact {

    Long serviceId;
    /** Service the impact arrived from. */
    Long viaServiceId;
    int depth;
    double cascadedScore;
    double cascadedConfidence;
    double weight;
    boolean requiresApproval;
}
