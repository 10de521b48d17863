package com.grc.riskengine.domain.trigger;

import com.grc.riskengine.domain.RiskCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Operational signal: repeated incidents, failed changes, capacity exhaustion and SLA breaches.
 */
@Value
@Builder
@Jacksonized
public class OperationalTrigger implements TriggerSignal {

    Type type;
    String sourceSystem;
    String title;
    String description;
    List<Long> affectedServiceIds;
    Integer recurrenceCount;
    Double businessImpactHours;

    @Override
    public RiskCategory getCategory() {
        return RiskCategory.OPERATIONAL;
    }

    public enum Type {
        REPEATED_INCIDENTS, FAILED_CHANGE, CAPACITY_EXHAUSTION, SLA_BREACH
    }
}
