package com.grc.riskengine.domain.trigger;

import com.grc.riskengine.domain.RiskCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Compliance signal: control coverage gaps, audit findings, disabled controls and stale evidence.
 */
@Value
@Builder
@Jacksonized
public class ComplianceTrigger implements TriggerSignal {

    Type type;
    String sourceSystem;
    String title;
    String description;
    List<Long> affectedServiceIds;
    String framework;
    /** Percentage of the control population not covered, 0..100. */
    double coverageGapPercent;
    boolean regulatoryRisk;

    @Override
    public RiskCategory getCategory() {
        return RiskCategory.COMPLIANCE;
    }

    public enum Type {
        COVERAGE_GAP, AUDIT_FINDING, CONTROL_DISABLED, STALE_EVIDENCE
    }
}
