package com.grc.riskengine.intel;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One correlation returned by the threat-intel service.
 */
@Value
@Builder
@Jacksonized
public class ThreatCorrelation {

    String threat;
    /** 0.0–1.0. */
    double confidence;
    boolean activeExploitation;
    boolean trendingUp;
}
