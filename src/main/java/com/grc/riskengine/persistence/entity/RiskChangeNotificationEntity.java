package com.grc.riskengine.persistence.entity;

import com.grc.riskengine.domain.ChangeDirection;
import com.grc.riskengine.domain.NotificationPriority;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "risk_change_notifications", indexes = {
    @Index(name = "idx_notification_created_at", columnList = "created_at"),
    @Index(name = "idx_notification_service", columnList = "service_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskChangeNotificationEntity {

    @Id
    @Column(name = "notification_id", nullable = false)
    private String notificationId;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "service_name")
    private String serviceName;

    @Column(name = "previous_score", nullable = false)
    private double previousScore;

    @Column(name = "current_score", nullable = false)
    private double currentScore;

    @Column(name = "magnitude", nullable = false)
    private double magnitude;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false)
    private ChangeDirection direction;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false)
    private NotificationPriority priority;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "risk_change_notification_events", joinColumns = @JoinColumn(name = "notification_id"))
    @Column(name = "event_id", nullable = false)
    @Builder.Default
    private List<String> triggeringEventIds = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
