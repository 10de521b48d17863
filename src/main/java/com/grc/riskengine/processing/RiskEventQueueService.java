package com.grc.riskengine.processing;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.core.EventValidationException;
import com.grc.riskengine.domain.EventPriority;
import com.grc.riskengine.domain.EventSource;
import com.grc.riskengine.domain.EventStatus;
import com.grc.riskengine.domain.EventType;
import com.grc.riskengine.messaging.RiskUpdateEventMessage;
import com.grc.riskengine.persistence.entity.RiskUpdateEventEntity;
import com.grc.riskengine.persistence.repository.RiskUpdateEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Store-backed event queue. Ingestion inserts; only the batch processor claims and
 * completes. Completion is a conditional update, so an event is marked processed once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskEventQueueService {

    private final RiskUpdateEventRepository eventRepository;
    private final RiskEngineProperties properties;
    private final Clock clock;

    /**
     * Queues an event. An id that is already queued is ignored.
     *
     * @return the event id
     */
    @Transactional
    public String enqueue(RiskUpdateEventMessage message) {
        if (message.getEventType() == null) {
            throw new EventValidationException("Event type is required");
        }
        if (message.getEventType() != EventType.RISK_SIGNAL && message.getEntityId() == null) {
            throw new EventValidationException(message.getEventType() + " events need an entity id");
        }
        String eventId = message.getEventId() != null && !message.getEventId().isBlank()
                ? message.getEventId()
                : newEventId();
        if (eventRepository.existsById(eventId)) {
            log.info("Event {} already queued, ignoring duplicate", eventId);
            return eventId;
        }
        RiskUpdateEventEntity entity = RiskUpdateEventEntity.builder()
                .eventId(eventId)
                .eventType(message.getEventType())
                .source(message.getSource() != null ? message.getSource() : EventSource.SYSTEM)
                .entityType(message.getEntityType())
                .entityId(message.getEntityId())
                .priority(message.getPriority() != null ? message.getPriority() : EventPriority.MEDIUM)
                .payload(message.getPayload() != null && !message.getPayload().isNull() ? message.getPayload().toString() : null)
                .timestamp(message.getTimestamp() != null ? message.getTimestamp() : Instant.now(clock))
                .status(EventStatus.PENDING)
                .build();
        eventRepository.save(entity);
        log.debug("Queued event {} type={} priority={} entity={}", eventId, entity.getEventType(), entity.getPriority(), entity.getEntityId());
        return eventId;
    }

    public List<RiskUpdateEventEntity> fetchNextBatch(int size) {
        return eventRepository.findNextBatch(EventStatus.PENDING, PageRequest.of(0, size));
    }

    /** @return false if another processor got there first */
    @Transactional
    public boolean claim(String eventId) {
        return eventRepository.claim(eventId, EventStatus.PENDING, EventStatus.PROCESSING, Instant.now(clock)) == 1;
    }

    @Transactional
    public boolean markCompleted(String eventId) {
        int updated = eventRepository.markProcessed(eventId, EventStatus.PROCESSING, EventStatus.COMPLETED, null,
                Instant.now(clock));
        if (updated == 0) {
            log.warn("Event {} is no longer in processing, completion ignored", eventId);
        }
        return updated == 1;
    }

    @Transactional
    public boolean markFailed(String eventId, String error) {
        return eventRepository.markProcessed(eventId, EventStatus.PROCESSING, EventStatus.FAILED, truncate(error),
                Instant.now(clock)) == 1;
    }

    /**
     * Returns the event to the queue, or fails it permanently once its attempts are used up.
     *
     * @return true if the event will be retried
     */
    @Transactional
    public boolean releaseForRetry(RiskUpdateEventEntity event, String error) {
        int attempts = Math.max(event.getAttempts(), 1);
        if (attempts >= properties.getBatch().getMaxAttempts()) {
            log.warn("Event {} failed after {} attempts: {}", event.getEventId(), attempts, error);
            markFailed(event.getEventId(), "Gave up after " + attempts + " attempts: " + error);
            return false;
        }
        return eventRepository.releaseForRetry(event.getEventId(), EventStatus.PENDING, truncate(error)) == 1;
    }

    /**
     * Events stuck in PROCESSING since before the cutoff are timed out.
     *
     * @return number of events recovered
     */
    @Transactional
    public int recoverStale(Instant cutoff) {
        List<RiskUpdateEventEntity> stale = eventRepository.findByStatusAndProcessingStartedAtBefore(EventStatus.PROCESSING, cutoff);
        for (RiskUpdateEventEntity event : stale) {
            releaseForRetry(event, "Processing timed out");
        }
        if (!stale.isEmpty()) {
            log.warn("Recovered {} events stuck in processing", stale.size());
        }
        return stale.size();
    }

    String newEventId() {
        return "evt_" + Instant.now(clock).toEpochMilli() + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 9);
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() > 2000 ? error.substring(0, 2000) : error;
    }
}
