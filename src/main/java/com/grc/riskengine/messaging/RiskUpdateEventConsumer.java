package com.grc.riskengine.messaging;

import com.grc.riskengine.core.EventValidationException;
import com.grc.riskengine.processing.RiskEventQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Moves risk update events from Kafka into the processing queue. Scoring happens
 * later, in the batch cycle.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "dynamic-risk.kafka.ingest-enabled", havingValue = "true", matchIfMissing = true)
public class RiskUpdateEventConsumer {

    private final RiskEventQueueService queueService;

    @KafkaListener(
            topics = "${dynamic-risk.kafka.topic.events:risk-update-events}",
            groupId = "${dynamic-risk.kafka.consumer-group:dynamic-risk-engine}",
            containerFactory = "riskUpdateEventListenerContainerFactory"
    )
    public void onEvent(
            @Payload(required = false) RiskUpdateEventMessage message,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.RECEIVED_PARTITION, required = false) Integer partition,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        if (message == null) {
            log.warn("Received unreadable risk update event. Key={}, partition={}, offset={}", key, partition, offset);
            return;
        }
        try {
            String eventId = queueService.enqueue(message);
            log.debug("Ingested event {} from partition={} offset={}", eventId, partition, offset);
        } catch (EventValidationException e) {
            log.warn("Rejected risk update event key={} offset={}: {}", key, offset, e.getMessage());
        }
    }
}
