package com.grc.riskengine.domain.trigger;

import com.grc.riskengine.domain.RiskCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Security signal: Defender incidents, KEV matches, threat-intel corroboration,
 * multi-stage attacks and data exfiltration.
 */
@Value
@Builder
@Jacksonized
public class SecurityTrigger implements TriggerSignal {

    Type type;
    String sourceSystem;
    String title;
    String description;
    List<Long> affectedServiceIds;
    /** Confidence reported by the source, 0..1. */
    double reportedConfidence;
    /** Incident severity 0..100. */
    int severityScore;
    /** Fraction of the kill chain observed, 0..1. */
    Double killChainCoverage;
    List<String> cveIds;
    List<String> threatActors;
    List<String> techniques;
    List<String> indicators;

    @Override
    public RiskCategory getCategory() {
        return RiskCategory.SECURITY;
    }

    public enum Type {
        DEFENDER_INCIDENT, KEV_CVE, TI_CORROBORATION, MULTI_STAGE_ATTACK, DATA_EXFILTRATION
    }
}
