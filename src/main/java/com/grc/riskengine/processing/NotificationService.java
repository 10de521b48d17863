package com.grc.riskengine.processing;

import com.grc.riskengine.domain.RiskChangeNotification;
import com.grc.riskengine.messaging.RiskChangeNotificationProducer;
import com.grc.riskengine.persistence.entity.RiskChangeNotificationEntity;
import com.grc.riskengine.persistence.repository.RiskChangeNotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Persists and publishes score-change notifications. Delivery problems are logged;
 * they never fail the processing cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final RiskChangeNotificationRepository notificationRepository;
    private final RiskChangeNotificationProducer producer;

    public void deliver(RiskChangeNotification notification) {
        try {
            notificationRepository.save(toEntity(notification));
        } catch (Exception e) {
            log.error("Failed to persist notification {} for service {}", notification.getNotificationId(), notification.getServiceId(), e);
        }
        producer.send(notification);
        log.info("Risk score change on service {} ({}): {} -> {} priority={}",
                notification.getServiceId(), notification.getServiceName(),
                notification.getPreviousScore(), notification.getCurrentScore(), notification.getPriority());
    }

    public List<RiskChangeNotification> recent(int limit) {
        return notificationRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit))).stream()
                .map(NotificationService::toDomain)
                .collect(Collectors.toList());
    }

    private static RiskChangeNotificationEntity toEntity(RiskChangeNotification n) {
        return RiskChangeNotificationEntity.builder()
                .notificationId(n.getNotificationId())
                .serviceId(n.getServiceId())
                .serviceName(n.getServiceName())
                .previousScore(n.getPreviousScore())
                .currentScore(n.getCurrentScore())
                .magnitude(n.getMagnitude())
                .direction(n.getDirection())
                .priority(n.getPriority())
                .triggeringEventIds(n.getTriggeringEventIds() != null ? new ArrayList<>(n.getTriggeringEventIds()) : new ArrayList<>())
                .createdAt(n.getCreatedAt())
                .build();
    }

    private static RiskChangeNotification toDomain(RiskChangeNotificationEntity e) {
        return RiskChangeNotification.builder()
                .notificationId(e.getNotificationId())
                .serviceId(e.getServiceId())
                .serviceName(e.getServiceName())
                .previousScore(e.getPreviousScore())
                .currentScore(e.getCurrentScore())
                .magnitude(e.getMagnitude())
                .direction(e.getDirection())
                .priority(e.getPriority())
                .triggeringEventIds(List.copyOf(e.getTriggeringEventIds()))
                .createdAt(e.getCreatedAt())
                .build();
    }
}
