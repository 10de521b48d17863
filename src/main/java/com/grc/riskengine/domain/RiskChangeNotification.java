package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Emitted when a service's composite score moves past its significance threshold
 * within one processing cycle. Published to the notifications topic.
 */
@Value
@Builder
@Jacksonized
public class RiskChangeNotification {

    String notificationId;
    Long serviceId;
    String serviceName;
    double previousScore;
    double currentScore;
    double magnitude;
    ChangeDirection direction;
    List<String> triggeringEventIds;
    NotificationPriority priority;
    Instant createdAt;
}
