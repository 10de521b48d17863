package com.grc.riskengine.domain.trigger;

import com.grc.riskengine.domain.RiskCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Strategic signal: vendor breaches, geopolitical escalation, regulatory mandates and supply chain risk.
 */
@Value
@Builder
@Jacksonized
public class StrategicTrigger implements TriggerSignal {

    Type type;
    String sourceSystem;
    String title;
    String description;
    List<Long> affectedServiceIds;
    /** Estimated financial impact in USD. */
    double estimatedImpact;
    /** Days until a mandate takes effect, when known. */
    Integer timelineDays;

    @Override
    public RiskCategory getCategory() {
        return RiskCategory.STRATEGIC;
    }

    public enum Type {
        VENDOR_BREACH, GEO_ESCALATION, REGULATORY_MANDATE, SUPPLY_CHAIN_RISK
    }
}
