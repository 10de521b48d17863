package com.grc.riskengine.messaging;

import com.grc.riskengine.domain.RiskChangeNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes score-change notifications for dashboards and downstream alerting.
 * Fire-and-forget: a failed send is logged, never retried into the processing cycle.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskChangeNotificationProducer {

    private final KafkaTemplate<String, RiskChangeNotification> riskNotificationKafkaTemplate;

    @Value("${dynamic-risk.kafka.topic.notifications:risk-score-changes}")
    private String topic;

    public void send(RiskChangeNotification notification) {
        try {
            CompletableFuture<SendResult<String, RiskChangeNotification>> future =
                    riskNotificationKafkaTemplate.send(topic, String.valueOf(notification.getServiceId()), notification);
            future.whenComplete((result, ex) -> {
                if (ex != null) log.error("Failed to send risk change notification {}", notification.getNotificationId(), ex);
                else log.debug("Sent risk change notification {} partition={}", notification.getNotificationId(),
                        result != null ? result.getRecordMetadata().partition() : null);
            });
        } catch (Exception e) {
            log.error("Could not hand notification {} to Kafka", notification.getNotificationId(), e);
        }
    }
}
