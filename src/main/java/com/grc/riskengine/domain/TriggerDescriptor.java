package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Normalized, confidence-scored reason to consider a new risk candidate.
 */
@Value
@Builder
public class TriggerDescriptor {

    RiskCategory category;
    /** Category-specific trigger type, e.g. KEV_CVE or FAILED_CHANGE. */
    String sourceType;
    String sourceSystem;
    /** 0.0–1.0. */
    double confidence;
    Urgency urgency;
    boolean autoApproveEligible;
    /** True when the signal matched a known-exploited vulnerability. */
    boolean knownExploited;
}
