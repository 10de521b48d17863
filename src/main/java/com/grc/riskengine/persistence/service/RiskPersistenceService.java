package com.grc.riskengine.persistence.service;

import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.CascadeImpact;
import com.grc.riskengine.domain.CascadingType;
import com.grc.riskengine.domain.LifecycleState;
import com.grc.riskengine.domain.RiskCandidate;
import com.grc.riskengine.domain.RiskDecision;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.entity.ServiceRiskAssociationEntity;
import com.grc.riskengine.persistence.repository.RiskRepository;
import com.grc.riskengine.persistence.repository.ServiceRiskAssociationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;

/**
 * Writes risks and service–risk associations. Callers hold the lock of the service whose
 * rows are written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskPersistenceService {

    private final RiskRepository riskRepository;
    private final ServiceRiskAssociationRepository associationRepository;

    /**
     * Creates the risk and its direct association to the primary service.
     */
    @Transactional
    public RiskEntity createRisk(RiskCandidate candidate, RiskDecision decision, String dedupeKey, Instant now) {
        RiskEntity risk = RiskEntity.builder()
                .title(candidate.getTitle())
                .description(candidate.getDescription())
                .category(candidate.getCategory())
                .sourceType(candidate.getTrigger().getSourceType())
                .primaryServiceId(candidate.getPrimaryServiceId())
                .compositeScore(decision.getCompositeScore())
                .confidence(candidate.getConfidence())
                .severity(candidate.getSeverity())
                .likelihood(candidate.getLikelihood())
                .confidentialityImpact(candidate.getConfidentialityImpact())
                .integrityImpact(candidate.getIntegrityImpact())
                .availabilityImpact(candidate.getAvailabilityImpact())
                .approvalStatus(decision.getOutcome().getInitialApproval())
                .lifecycleState(decision.getOutcome().getInitialState())
                .dedupeKey(dedupeKey)
                .sourceEventId(candidate.getSourceEventId())
                .threatIntelSources(new LinkedHashSet<>(candidate.evidenceIdentifiers()))
                .approvedBy(decision.getOutcome().getInitialApproval() == ApprovalStatus.APPROVED ? "system" : null)
                .approvedAt(decision.getOutcome().getInitialApproval() == ApprovalStatus.APPROVED ? now : null)
                .createdAt(now)
                .build();
        RiskEntity saved = riskRepository.save(risk);
        associationRepository.save(directAssociation(candidate.getPrimaryServiceId(), saved));
        log.info("Created risk {} '{}' on service {} state={} approval={}",
                saved.getId(), saved.getTitle(), saved.getPrimaryServiceId(), saved.getLifecycleState(), saved.getApprovalStatus());
        return saved;
    }

    @Transactional
    public void addDirectAssociation(Long serviceId, RiskEntity risk) {
        if (associationRepository.findByServiceIdAndRiskId(serviceId, risk.getId()).isPresent()) return;
        associationRepository.save(directAssociation(serviceId, risk));
    }

    /**
     * Folds a near-duplicate into the surviving risk: evidence union, confidence max,
     * originating event appended to merged-from.
     */
    @Transactional
    public RiskEntity mergeInto(Long existingRiskId, RiskCandidate candidate) {
        RiskEntity existing = riskRepository.findById(existingRiskId)
                .orElseThrow(() -> new IllegalStateException("Merge target risk " + existingRiskId + " disappeared"));
        existing.getThreatIntelSources().addAll(candidate.evidenceIdentifiers());
        existing.setConfidence(Math.max(existing.getConfidence(), candidate.getConfidence()));
        if (candidate.getSourceEventId() != null && !existing.getMergedFrom().contains(candidate.getSourceEventId())) {
            existing.getMergedFrom().add(candidate.getSourceEventId());
        }
        RiskEntity saved = riskRepository.save(existing);
        log.info("Merged event {} into risk {} (confidence now {})",
                candidate.getSourceEventId(), saved.getId(), saved.getConfidence());
        return saved;
    }

    /**
     * Creates or refreshes a dependency association. Direct associations are never downgraded.
     *
     * @return false when a direct association already covers the service
     */
    @Transactional
    public boolean upsertCascadeAssociation(Long riskId, CascadeImpact impact) {
        Optional<ServiceRiskAssociationEntity> existing = associationRepository.findByServiceIdAndRiskId(impact.getServiceId(), riskId);
        if (existing.isPresent() && existing.get().getCascadingType() == CascadingType.DIRECT) {
            return false;
        }
        ServiceRiskAssociationEntity association = existing.orElseGet(() -> ServiceRiskAssociationEntity.builder()
                .serviceId(impact.getServiceId())
                .riskId(riskId)
                .cascadingType(CascadingType.DEPENDENCY)
                .build());
        boolean wasReviewed = association.isReviewApproved();
        association.setWeight(impact.getWeight());
        association.setConfidence(impact.getCascadedConfidence());
        association.setViaServiceId(impact.getViaServiceId());
        association.setCascadeDepth(impact.getDepth());
        association.setRequiresApproval(impact.isRequiresApproval());
        association.setReviewApproved(impact.isRequiresApproval() && wasReviewed);
        associationRepository.save(association);
        return true;
    }

    @Transactional
    public ServiceRiskAssociationEntity approveAssociation(Long associationId) {
        ServiceRiskAssociationEntity association = associationRepository.findById(associationId)
                .orElseThrow(() -> new AssociationNotFoundException(associationId));
        association.setReviewApproved(true);
        return associationRepository.save(association);
    }

    @Transactional
    public RiskEntity updateApproval(Long riskId, boolean approved, String actor, Instant now) {
        RiskEntity risk = riskRepository.findById(riskId).orElseThrow(() -> new RiskNotFoundException(riskId));
        if (risk.getApprovalStatus() != ApprovalStatus.PENDING) {
            throw new IllegalArgumentException("Risk " + riskId + " is not pending approval (status " + risk.getApprovalStatus() + ")");
        }
        if (approved) {
            risk.setApprovalStatus(ApprovalStatus.APPROVED);
            risk.setLifecycleState(LifecycleState.ACTIVE);
            risk.setApprovedBy(actor);
            risk.setApprovedAt(now);
        } else {
            risk.setApprovalStatus(ApprovalStatus.REJECTED);
        }
        return riskRepository.save(risk);
    }

    private static ServiceRiskAssociationEntity directAssociation(Long serviceId, RiskEntity risk) {
        return ServiceRiskAssociationEntity.builder()
                .serviceId(serviceId)
                .riskId(risk.getId())
                .weight(1.0)
                .cascadingType(CascadingType.DIRECT)
                .confidence(risk.getConfidence())
                .cascadeDepth(0)
                .build();
    }

    public static class RiskNotFoundException extends RuntimeException {
        public RiskNotFoundException(Long riskId) {
            super("Risk not found: " + riskId);
        }
    }

    public static class AssociationNotFoundException extends RuntimeException {
        public AssociationNotFoundException(Long associationId) {
            super("Association not found: " + associationId);
        }
    }
}
