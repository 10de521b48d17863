package com.grc.riskengine.processing;

import com.grc.riskengine.compliance.RiskAuditLogger;
import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.core.ServiceLockRegistry;
import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.CascadingType;
import com.grc.riskengine.domain.EventPriority;
import com.grc.riskengine.domain.EventType;
import com.grc.riskengine.domain.LifecycleState;
import com.grc.riskengine.messaging.RiskUpdateEventMessage;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.entity.ServiceRiskAssociationEntity;
import com.grc.riskengine.persistence.repository.ServiceRiskAssociationRepository;
import com.grc.riskengine.persistence.service.RiskPersistenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RiskApprovalServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private RiskPersistenceService persistenceService;

    @Mock
    private ServiceRiskAssociationRepository associationRepository;

    @Mock
    private RiskAuditLogger auditLogger;

    @Mock
    private RiskEventQueueService queueService;

    private RiskApprovalService approvalService;

    @BeforeEach
    void setUp() {
        approvalService = new RiskApprovalService(persistenceService, associationRepository, auditLogger, queueService,
                new ServiceLockRegistry(new RiskEngineProperties()), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void approvalActivatesRiskAndQueuesStatusChange() {
        RiskEntity risk = RiskEntity.builder().id(10L).dedupeKey("k").confidence(0.8)
                .lifecycleState(LifecycleState.ACTIVE).approvalStatus(ApprovalStatus.APPROVED).build();
        when(persistenceService.updateApproval(10L, true, "alice", NOW)).thenReturn(risk);

        RiskEntity result = approvalService.decide(10L, true, "alice", "confirmed with owner");

        assertThat(result).isSameAs(risk);
        verify(auditLogger).logTransition(10L, "k", LifecycleState.DRAFT, LifecycleState.ACTIVE, ApprovalStatus.APPROVED,
                "Approved by alice: confirmed with owner", false, 0.8, "alice");
        ArgumentCaptor<RiskUpdateEventMessage> queued = ArgumentCaptor.forClass(RiskUpdateEventMessage.class);
        verify(queueService).enqueue(queued.capture());
        assertThat(queued.getValue().getEventType()).isEqualTo(EventType.RISK_STATUS_CHANGE);
        assertThat(queued.getValue().getEntityId()).isEqualTo(10L);
        assertThat(queued.getValue().getPriority()).isEqualTo(EventPriority.HIGH);
    }

    @Test
    void rejectionQueuesNothing() {
        RiskEntity risk = RiskEntity.builder().id(11L).dedupeKey("k").confidence(0.6)
                .lifecycleState(LifecycleState.DRAFT).approvalStatus(ApprovalStatus.REJECTED).build();
        when(persistenceService.updateApproval(11L, false, "bob", NOW)).thenReturn(risk);

        approvalService.decide(11L, false, "bob", null);

        verify(auditLogger).logTransition(11L, "k", LifecycleState.DRAFT, LifecycleState.DRAFT, ApprovalStatus.REJECTED,
                "Rejected by bob", false, 0.6, "bob");
        verify(queueService, never()).enqueue(any());
    }

    @Test
    void approvedCascadeAssociationTriggersRecompute() {
        ServiceRiskAssociationEntity pending = ServiceRiskAssociationEntity.builder().id(3L).serviceId(7L).riskId(10L)
                .cascadingType(CascadingType.DEPENDENCY).requiresApproval(true).build();
        ServiceRiskAssociationEntity approved = ServiceRiskAssociationEntity.builder().id(3L).serviceId(7L).riskId(10L)
                .cascadingType(CascadingType.DEPENDENCY).requiresApproval(true).reviewApproved(true).build();
        when(associationRepository.findById(3L)).thenReturn(Optional.of(pending));
        when(persistenceService.approveAssociation(3L)).thenReturn(approved);

        ServiceRiskAssociationEntity result = approvalService.approveAssociation(3L, "alice");

        assertThat(result.isReviewApproved()).isTrue();
        ArgumentCaptor<RiskUpdateEventMessage> queued = ArgumentCaptor.forClass(RiskUpdateEventMessage.class);
        verify(queueService).enqueue(queued.capture());
        assertThat(queued.getValue().getEventType()).isEqualTo(EventType.SERVICE_CHANGE);
        assertThat(queued.getValue().getEntityId()).isEqualTo(7L);
    }

    @Test
    void unknownAssociationIsRejected() {
        when(associationRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> approvalService.approveAssociation(99L, "alice"))
                .isInstanceOf(RiskPersistenceService.AssociationNotFoundException.class);
        verify(persistenceService, never()).approveAssociation(anyLong());
        verify(queueService, never()).enqueue(any());
    }
}
