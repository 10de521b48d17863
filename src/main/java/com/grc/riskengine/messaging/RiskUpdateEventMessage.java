package com.grc.riskengine.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.grc.riskengine.domain.EventPriority;
import com.grc.riskengine.domain.EventSource;
import com.grc.riskengine.domain.EventType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Raw change event as it arrives from producers (Kafka or the operations API).
 * {@code payload} is the trigger JSON for {@code RISK_SIGNAL} events.
 */
@Value
@Builder
@Jacksonized
public class RiskUpdateEventMessage {

    /** Optional; generated when absent. */
    String eventId;
    EventType eventType;
    EventSource source;
    String entityType;
    Long entityId;
    EventPriority priority;
    JsonNode payload;
    Instant timestamp;
}
