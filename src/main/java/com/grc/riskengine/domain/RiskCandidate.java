package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A risk that a trigger proposes but that has not been deduplicated or decided yet.
 */
@Value
@Builder
public class RiskCandidate {

    String title;
    String description;
    RiskCategory category;
    Long primaryServiceId;
    List<Long> serviceIds;
    /** 1–5. */
    int severity;
    /** 1–5. */
    int likelihood;
    /** CIA impacts 1–10. */
    int confidentialityImpact;
    int integrityImpact;
    int availabilityImpact;
    TriggerDescriptor trigger;
    List<String> threatActors;
    List<String> techniques;
    List<String> indicators;
    String sourceEventId;

    public double getConfidence() {
        return trigger.getConfidence();
    }

    /**
     * Union of technique, actor and indicator identifiers, lower-cased. Used both
     * as evidence for similarity and as the stored threat-intel source list.
     */
    public Set<String> evidenceIdentifiers() {
        Set<String> out = new LinkedHashSet<>();
        addNormalized(out, techniques);
        addNormalized(out, threatActors);
        addNormalized(out, indicators);
        return out;
    }

    public List<Long> allServiceIds() {
        List<Long> out = new ArrayList<>();
        if (primaryServiceId != null) out.add(primaryServiceId);
        if (serviceIds != null) {
            for (Long id : serviceIds) {
                if (id != null && !out.contains(id)) out.add(id);
            }
        }
        return out;
    }

    private static void addNormalized(Set<String> out, List<String> values) {
        if (values == null) return;
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim().toLowerCase());
        }
    }
}
