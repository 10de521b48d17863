package com.grc.riskengine.persistence.entity;

import com.grc.riskengine.domain.EventPriority;
import com.grc.riskengine.domain.EventSource;
import com.grc.riskengine.domain.EventStatus;
import com.grc.riskengine.domain.EventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Queued change event. Processing columns are written only by the batch processor.
 */
@Entity
@Table(name = "risk_update_events", indexes = {
    @Index(name = "idx_event_queue", columnList = "status, priority_rank, event_timestamp"),
    @Index(name = "idx_event_timestamp", columnList = "event_timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskUpdateEventEntity {

    @Id
    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private EventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false)
    private EventSource source;

    @Column(name = "entity_type")
    private String entityType;

    @Column(name = "entity_id")
    private Long entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false)
    private EventPriority priority;

    @Column(name = "priority_rank", nullable = false)
    private int priorityRank;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "event_timestamp", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Builder.Default
    private EventStatus status = EventStatus.PENDING;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "processing_started_at")
    private Instant processingStartedAt;

    @Column(name = "processing_completed_at")
    private Instant processingCompletedAt;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (priority == null) {
            priority = EventPriority.MEDIUM;
        }
        priorityRank = priority.getRank();
    }
}
