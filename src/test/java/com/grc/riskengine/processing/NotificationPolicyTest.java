package com.grc.riskengine.processing;

import com.grc.riskengine.domain.ChangeDirection;
import com.grc.riskengine.domain.NotificationPriority;
import com.grc.riskengine.domain.RiskChangeNotification;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationPolicyTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private static Optional<RiskChangeNotification> evaluate(Double previous, double current) {
        return NotificationPolicy.evaluate(5L, "billing", previous, current, List.of("evt_1"), NOW);
    }

    @Test
    void fifteenPointRiseFromFiftyIsHighPriority() {
        Optional<RiskChangeNotification> notification = evaluate(50.0, 65);

        assertThat(notification).isPresent();
        assertThat(notification.get().getMagnitude()).isEqualTo(15.0);
        assertThat(notification.get().getDirection()).isEqualTo(ChangeDirection.INCREASE);
        assertThat(notification.get().getPriority()).isEqualTo(NotificationPriority.HIGH);
        assertThat(notification.get().getTriggeringEventIds()).containsExactly("evt_1");
    }

    @Test
    void changeBelowAbsoluteFloorIsIgnored() {
        assertThat(evaluate(30.0, 39.5)).isEmpty();
    }

    @Test
    void relativeThresholdAppliesToHighScores() {
        // 20% of 90 is 18, so a 12-point drop is not significant
        assertThat(evaluate(90.0, 78)).isEmpty();
        Optional<RiskChangeNotification> drop = evaluate(90.0, 70);
        assertThat(drop).isPresent();
        assertThat(drop.get().getDirection()).isEqualTo(ChangeDirection.DECREASE);
    }

    @Test
    void firstScoreCountsFromZero() {
        Optional<RiskChangeNotification> notification = evaluate(null, 42);

        assertThat(notification).isPresent();
        assertThat(notification.get().getPreviousScore()).isZero();
        assertThat(notification.get().getPriority()).isEqualTo(NotificationPriority.HIGH);
    }

    @Test
    void priorityTable() {
        assertThat(NotificationPolicy.priority(85, 25)).isEqualTo(NotificationPriority.CRITICAL);
        assertThat(NotificationPolicy.priority(85, 12)).isEqualTo(NotificationPriority.HIGH);
        assertThat(NotificationPolicy.priority(55, 11)).isEqualTo(NotificationPriority.MEDIUM);
        assertThat(NotificationPolicy.priority(30, 10)).isEqualTo(NotificationPriority.MEDIUM);
        assertThat(NotificationPolicy.priority(30, 5)).isEqualTo(NotificationPriority.LOW);
    }
}
