package com.grc.riskengine.advisory;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Opaque advisory output. {@code recommendation} is a criticality label
 * (critical/high/medium/low); {@code score} is optional and takes precedence when present.
 */
@Value
@Builder
@Jacksonized
public class AdvisoryRecommendation {

    String recommendation;
    Double score;
    /** 0.0–1.0. */
    double confidence;
    String reasoning;
}
