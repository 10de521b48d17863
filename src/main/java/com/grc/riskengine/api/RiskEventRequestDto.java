package com.grc.riskengine.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.grc.riskengine.domain.EventPriority;
import com.grc.riskengine.domain.EventSource;
import com.grc.riskengine.domain.EventType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * REST request body for queueing a risk update event.
 */
@Data
public class RiskEventRequestDto {

    /** Optional producer-assigned id; a repeated id is ignored. */
    @Size(max = 128)
    private String eventId;

    @NotNull(message = "eventType is required")
    private EventType eventType;

    private EventSource source;
    private String entityType;
    /** Service id for service/dependency changes, risk id for status changes, fallback service for signals. */
    private Long entityId;
    private EventPriority priority;
    /** Trigger JSON for RISK_SIGNAL events. */
    private JsonNode payload;
}
