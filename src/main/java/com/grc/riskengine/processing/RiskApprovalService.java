package com.grc.riskengine.processing;

import com.grc.riskengine.compliance.RiskAuditLogger;
import com.grc.riskengine.core.ServiceLockRegistry;
import com.grc.riskengine.domain.EventPriority;
import com.grc.riskengine.domain.EventSource;
import com.grc.riskengine.domain.EventType;
import com.grc.riskengine.domain.LifecycleState;
import com.grc.riskengine.messaging.RiskUpdateEventMessage;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.entity.ServiceRiskAssociationEntity;
import com.grc.riskengine.persistence.repository.ServiceRiskAssociationRepository;
import com.grc.riskengine.persistence.service.RiskPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Operator decisions on pending risks and on cascaded associations held for review.
 * Score effects are not applied here; a queued event lets the batch processor do it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskApprovalService {

    private final RiskPersistenceService persistenceService;
    private final ServiceRiskAssociationRepository associationRepository;
    private final RiskAuditLogger auditLogger;
    private final RiskEventQueueService queueService;
    private final ServiceLockRegistry lockRegistry;
    private final Clock clock;

    public RiskEntity decide(Long riskId, boolean approved, String actor, String comment) {
        Instant now = Instant.now(clock);
        RiskEntity risk = persistenceService.updateApproval(riskId, approved, actor, now);
        String reason = (approved ? "Approved" : "Rejected") + " by " + actor + (comment != null && !comment.isBlank() ? ": " + comment : "");
        auditLogger.logTransition(risk.getId(), risk.getDedupeKey(), LifecycleState.DRAFT, risk.getLifecycleState(),
                risk.getApprovalStatus(), reason, false, risk.getConfidence(), actor);
        if (approved) {
            String eventId = queueService.enqueue(RiskUpdateEventMessage.builder()
                    .eventType(EventType.RISK_STATUS_CHANGE)
                    .source(EventSource.MANUAL)
                    .entityType("risk")
                    .entityId(risk.getId())
                    .priority(EventPriority.HIGH)
                    .build());
            log.info("Risk {} approved by {}, queued {}", risk.getId(), actor, eventId);
        } else {
            log.info("Risk {} rejected by {}", risk.getId(), actor);
        }
        return risk;
    }

    public ServiceRiskAssociationEntity approveAssociation(Long associationId, String actor) {
        ServiceRiskAssociationEntity existing = associationRepository.findById(associationId)
                .orElseThrow(() -> new RiskPersistenceService.AssociationNotFoundException(associationId));
        ServiceRiskAssociationEntity approved = lockRegistry.withLock(existing.getServiceId(),
                () -> persistenceService.approveAssociation(associationId));
        log.info("[AUDIT] CASCADE_REVIEW_APPROVED association={} service={} risk={} actor={}",
                associationId, approved.getServiceId(), approved.getRiskId(), actor);
        queueService.enqueue(RiskUpdateEventMessage.builder()
                .eventType(EventType.SERVICE_CHANGE)
                .source(EventSource.MANUAL)
                .entityType("service")
                .entityId(approved.getServiceId())
                .priority(EventPriority.HIGH)
                .build());
        return approved;
    }
}
