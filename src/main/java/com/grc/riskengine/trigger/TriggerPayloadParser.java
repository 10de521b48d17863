package com.grc.riskengine.trigger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.grc.riskengine.core.EventValidationException;
import com.grc.riskengine.domain.trigger.ComplianceTrigger;
import com.grc.riskengine.domain.trigger.OperationalTrigger;
import com.grc.riskengine.domain.trigger.SecurityTrigger;
import com.grc.riskengine.domain.trigger.StrategicTrigger;
import com.grc.riskengine.domain.trigger.TriggerSignal;
import org.springframework.stereotype.Component;

/**
 * Reads the JSON payload of a risk signal event into its typed trigger.
 */
@Component
public class TriggerPayloadParser {

    private final ObjectMapper mapper;

    public TriggerPayloadParser() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public TriggerSignal parse(String eventId, String payload) {
        if (payload == null || payload.isBlank()) {
            throw new EventValidationException("Event " + eventId + " has no trigger payload");
        }
        TriggerSignal signal;
        try {
            signal = mapper.readValue(payload, TriggerSignal.class);
        } catch (JsonProcessingException e) {
            throw new EventValidationException("Event " + eventId + " has a malformed trigger payload: "
                    + e.getOriginalMessage(), e);
        }
        if (signal == null) {
            throw new EventValidationException("Event " + eventId + " has an empty trigger payload");
        }
        if (subtypeOf(signal) == null) {
            throw new EventValidationException("Event " + eventId + " trigger is missing its type");
        }
        return signal;
    }

    public String write(TriggerSignal signal) {
        try {
            return mapper.writeValueAsString(signal);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize trigger", e);
        }
    }

    static Enum<?> subtypeOf(TriggerSignal signal) {
        switch (signal.getCategory()) {
            case SECURITY:
                return ((SecurityTrigger) signal).getType();
            case OPERATIONAL:
                return ((OperationalTrigger) signal).getType();
            case COMPLIANCE:
                return ((ComplianceTrigger) signal).getType();
            case STRATEGIC:
                return ((StrategicTrigger) signal).getType();
            default:
                return null;
        }
    }
}
