package com.grc.riskengine.processing;

import com.grc.riskengine.domain.ChangeDirection;
import com.grc.riskengine.domain.NotificationPriority;
import com.grc.riskengine.domain.RiskChangeNotification;
import com.grc.riskengine.messaging.RiskChangeNotificationProducer;
import com.grc.riskengine.persistence.entity.RiskChangeNotificationEntity;
import com.grc.riskengine.persistence.repository.RiskChangeNotificationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private RiskChangeNotificationRepository notificationRepository;

    @Mock
    private RiskChangeNotificationProducer producer;

    @InjectMocks
    private NotificationService notificationService;

    private static RiskChangeNotification notification() {
        return RiskChangeNotification.builder()
                .notificationId("n-1")
                .serviceId(5L)
                .serviceName("billing")
                .previousScore(50)
                .currentScore(65)
                .magnitude(15)
                .direction(ChangeDirection.INCREASE)
                .priority(NotificationPriority.HIGH)
                .triggeringEventIds(List.of("evt_1", "evt_2"))
                .createdAt(Instant.parse("2025-06-01T12:00:00Z"))
                .build();
    }

    @Test
    void deliverPersistsAndPublishes() {
        RiskChangeNotification notification = notification();

        notificationService.deliver(notification);

        ArgumentCaptor<RiskChangeNotificationEntity> saved = ArgumentCaptor.forClass(RiskChangeNotificationEntity.class);
        verify(notificationRepository).save(saved.capture());
        assertThat(saved.getValue().getNotificationId()).isEqualTo("n-1");
        assertThat(saved.getValue().getTriggeringEventIds()).containsExactly("evt_1", "evt_2");
        verify(producer).send(notification);
    }

    @Test
    void persistenceFailureStillPublishes() {
        RiskChangeNotification notification = notification();
        when(notificationRepository.save(any())).thenThrow(new RuntimeException("db down"));

        notificationService.deliver(notification);

        verify(producer).send(notification);
    }

    @Test
    void recentMapsStoredRows() {
        RiskChangeNotificationEntity entity = RiskChangeNotificationEntity.builder()
                .notificationId("n-9")
                .serviceId(3L)
                .previousScore(20)
                .currentScore(45)
                .magnitude(25)
                .direction(ChangeDirection.INCREASE)
                .priority(NotificationPriority.HIGH)
                .triggeringEventIds(List.of("evt_9"))
                .createdAt(Instant.parse("2025-06-01T12:00:00Z"))
                .build();
        when(notificationRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, 50))).thenReturn(List.of(entity));

        List<RiskChangeNotification> recent = notificationService.recent(50);

        assertThat(recent).hasSize(1);
        assertThat(recent.get(0).getNotificationId()).isEqualTo("n-9");
        assertThat(recent.get(0).getMagnitude()).isEqualTo(25.0);
    }
}
