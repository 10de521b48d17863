package com.grc.riskengine.domain.trigger;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.grc.riskengine.domain.RiskCategory;

import java.util.List;

/**
 * Raw risk signal carried in the payload of a {@code RISK_SIGNAL} event. The JSON
 * {@code category} property selects the concrete payload type.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "category")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SecurityTrigger.class, name = "SECURITY"),
        @JsonSubTypes.Type(value = OperationalTrigger.class, name = "OPERATIONAL"),
        @JsonSubTypes.Type(value = ComplianceTrigger.class, name = "COMPLIANCE"),
        @JsonSubTypes.Type(value = StrategicTrigger.class, name = "STRATEGIC")
})
public interface TriggerSignal {

    RiskCategory getCategory();

    /** Identifier of the system that raised the signal (e.g. defender, servicenow). */
    String getSourceSystem();

    String getTitle();

    String getDescription();

    /** Services the signal names as affected. The first one is the primary service. */
    List<Long> getAffectedServiceIds();
}
