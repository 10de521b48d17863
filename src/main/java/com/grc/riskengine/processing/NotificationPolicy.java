package com.grc.riskengine.processing;

import com.grc.riskengine.domain.ChangeDirection;
import com.grc.riskengine.domain.NotificationPriority;
import com.grc.riskengine.domain.RiskChangeNotification;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Significance rule for score changes: notify when |current − previous| reaches
 * max(10, previous × 0.2). A service never scored before counts as previously 0.
 */
public final class NotificationPolicy {

    private static final double MIN_SIGNIFICANCE = 10;
    private static final double RELATIVE_SIGNIFICANCE = 0.2;

    private NotificationPolicy() {
    }

    public static Optional<RiskChangeNotification> evaluate(Long serviceId, String serviceName, Double previousScore,
                                                            double currentScore, List<String> eventIds, Instant now) {
        double previous = previousScore != null ? previousScore : 0;
        double magnitude = Math.round(Math.abs(currentScore - previous) * 100.0) / 100.0;
        if (magnitude == 0 || magnitude < significanceThreshold(previous)) {
            return Optional.empty();
        }
        return Optional.of(RiskChangeNotification.builder()
                .notificationId(UUID.randomUUID().toString())
                .serviceId(serviceId)
                .serviceName(serviceName)
                .previousScore(previous)
                .currentScore(currentScore)
                .magnitude(magnitude)
                .direction(currentScore >= previous ? ChangeDirection.INCREASE : ChangeDirection.DECREASE)
                .triggeringEventIds(eventIds)
                .priority(priority(currentScore, magnitude))
                .createdAt(now)
                .build());
    }

    static double significanceThreshold(double previous) {
        return Math.max(MIN_SIGNIFICANCE, previous * RELATIVE_SIGNIFICANCE);
    }

    static NotificationPriority priority(double currentScore, double magnitude) {
        if (currentScore >= 80 && magnitude >= 20) return NotificationPriority.CRITICAL;
        if (currentScore >= 70 || magnitude >= 15) return NotificationPriority.HIGH;
        if (currentScore >= 50 || magnitude >= 10) return NotificationPriority.MEDIUM;
        return NotificationPriority.LOW;
    }
}
