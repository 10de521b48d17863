package com.grc.riskengine.processing;

import com.grc.riskengine.cascade.RiskCascadePropagator;
import com.grc.riskengine.compliance.RiskAuditLogger;
import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.core.EventValidationException;
import com.grc.riskengine.core.ServiceLockRegistry;
import com.grc.riskengine.decision.RiskDecisionEngine;
import com.grc.riskengine.dedup.DedupeKeyCache;
import com.grc.riskengine.dedup.DedupeRecord;
import com.grc.riskengine.dedup.RiskDeduplicationService;
import com.grc.riskengine.domain.CascadeImpact;
import com.grc.riskengine.domain.CascadeResult;
import com.grc.riskengine.domain.CascadingType;
import com.grc.riskengine.domain.DecisionOutcome;
import com.grc.riskengine.domain.DedupeAction;
import com.grc.riskengine.domain.DedupeResult;
import com.grc.riskengine.domain.RiskCandidate;
import com.grc.riskengine.domain.RiskDecision;
import com.grc.riskengine.domain.ScoreBreakdown;
import com.grc.riskengine.domain.TriggerDescriptor;
import com.grc.riskengine.domain.trigger.TriggerSignal;
import com.grc.riskengine.graph.DependencyGraphAccessor;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.entity.RiskUpdateEventEntity;
import com.grc.riskengine.persistence.entity.ServiceDependencyEntity;
import com.grc.riskengine.persistence.entity.ServiceRiskAssociationEntity;
import com.grc.riskengine.persistence.repository.RiskRepository;
import com.grc.riskengine.persistence.repository.ServiceRiskAssociationRepository;
import com.grc.riskengine.persistence.service.RiskPersistenceService;
import com.grc.riskengine.scoring.ServiceRiskScoringEngine;
import com.grc.riskengine.trigger.RiskCandidateFactory;
import com.grc.riskengine.trigger.TriggerClassifier;
import com.grc.riskengine.trigger.TriggerPayloadParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Handles one claimed event and reports the services whose score must be recomputed.
 * <p>
 * A risk signal runs classify, candidate, dedupe, decide and persist. Dedupe and the
 * create or merge that follows happen under the primary service's lock, so two events
 * for the same service cannot both create the same risk. Cascading runs after that lock
 * is released; each dependent is written under its own lock.
 * <p>
 * Malformed events throw {@link EventValidationException}; anything else propagates to
 * the batch processor, which retries it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskEventPipeline {

    private static final String SYSTEM_ACTOR = "system";

    private final TriggerPayloadParser payloadParser;
    private final TriggerClassifier classifier;
    private final RiskCandidateFactory candidateFactory;
    private final ServiceRiskScoringEngine scoringEngine;
    private final RiskDeduplicationService deduplicationService;
    private final DedupeKeyCache dedupeKeyCache;
    private final RiskDecisionEngine decisionEngine;
    private final RiskPersistenceService persistenceService;
    private final RiskCascadePropagator cascadePropagator;
    private final RiskAuditLogger auditLogger;
    private final RiskRepository riskRepository;
    private final ServiceRiskAssociationRepository associationRepository;
    private final DependencyGraphAccessor graph;
    private final ServiceLockRegistry lockRegistry;
    private final RiskEngineProperties properties;
    private final Clock clock;

    public PipelineResult process(RiskUpdateEventEntity event) {
        switch (event.getEventType()) {
            case RISK_SIGNAL:
                return processRiskSignal(event);
            case SERVICE_CHANGE:
                return PipelineResult.of(PipelineResult.Outcome.RECOMPUTE_ONLY, null, Set.of(requireEntityId(event)));
            case DEPENDENCY_CHANGE:
                return processDependencyChange(event);
            case RISK_STATUS_CHANGE:
                return processRiskStatusChange(event);
            default:
                throw new EventValidationException("Unsupported event type " + event.getEventType());
        }
    }

    private PipelineResult processRiskSignal(RiskUpdateEventEntity event) {
        TriggerSignal signal = payloadParser.parse(event.getEventId(), event.getPayload());
        TriggerDescriptor descriptor = classifier.classify(signal);
        RiskCandidate candidate = candidateFactory.build(signal, descriptor, event.getEventId(), event.getEntityId());
        ScoreBreakdown candidateScore;
        try {
            candidateScore = scoringEngine.evaluateCandidate(candidate);
        } catch (ServiceRiskScoringEngine.ServiceNotFoundException e) {
            throw new EventValidationException(e.getMessage(), e);
        }

        PipelineResult result = lockRegistry.withLock(candidate.getPrimaryServiceId(),
                () -> resolveUnderLock(candidate, descriptor, candidateScore));

        if (result.getRiskId() == null) {
            return result;
        }
        RiskEntity risk = riskRepository.findById(result.getRiskId())
                .orElseThrow(() -> new RiskPersistenceService.RiskNotFoundException(result.getRiskId()));
        if (result.getOutcome() == PipelineResult.Outcome.CREATED) {
            for (Long serviceId : candidate.allServiceIds()) {
                if (serviceId.equals(candidate.getPrimaryServiceId())) continue;
                lockRegistry.withLock(serviceId, () -> persistenceService.addDirectAssociation(serviceId, risk));
            }
        }
        if (!risk.isActive()) {
            log.debug("Risk {} is {} / {}, no score impact yet", risk.getId(), risk.getLifecycleState(), risk.getApprovalStatus());
            return PipelineResult.of(result.getOutcome(), risk.getId(), Set.of());
        }
        Set<Long> affected = new LinkedHashSet<>(directServicesOf(risk));
        affected.addAll(cascade(risk));
        return PipelineResult.of(result.getOutcome(), risk.getId(), affected);
    }

    private PipelineResult resolveUnderLock(RiskCandidate candidate, TriggerDescriptor descriptor, ScoreBreakdown candidateScore) {
        DedupeResult dedupe = deduplicationService.resolve(candidate);

        if (dedupe.getAction() == DedupeAction.SUPPRESS) {
            auditLogger.logDecision(candidate, dedupe, null);
            if (dedupe.getExistingRiskId() != null && isOwnRisk(dedupe.getExistingRiskId(), candidate.getSourceEventId())) {
                // A retried event finds the risk it created on its previous attempt.
                return PipelineResult.of(PipelineResult.Outcome.CREATED, dedupe.getExistingRiskId(), Set.of());
            }
            auditLogger.logSuppressed(candidate, dedupe.getDedupeKey(), dedupe.getReason());
            return PipelineResult.of(PipelineResult.Outcome.SUPPRESSED_DUPLICATE, null, Set.of());
        }

        if (dedupe.getAction() == DedupeAction.MERGE) {
            try {
                RiskEntity merged = persistenceService.mergeInto(dedupe.getExistingRiskId(), candidate);
                auditLogger.logDecision(candidate, dedupe, null);
                return PipelineResult.of(PipelineResult.Outcome.MERGED, merged.getId(), Set.of());
            } catch (Exception e) {
                log.error("Merge into risk {} failed for event {}, creating a new risk instead",
                        dedupe.getExistingRiskId(), candidate.getSourceEventId(), e);
                dedupe = DedupeResult.create(dedupe.getDedupeKey(), "Merge failed: " + e.getMessage());
            }
        }

        RiskDecision decision = decisionEngine.decide(descriptor, candidateScore.getCompositeScore(), candidateScore.getBusinessImpact());
        auditLogger.logDecision(candidate, dedupe, decision);
        if (decision.getOutcome() == DecisionOutcome.SUPPRESS) {
            auditLogger.logSuppressed(candidate, dedupe.getDedupeKey(), decision.getReasoning());
            return PipelineResult.of(PipelineResult.Outcome.SUPPRESSED_LOW_SIGNAL, null, Set.of());
        }

        Instant now = Instant.now(clock);
        long createdToday = riskRepository.countByPrimaryServiceIdAndCreatedAtAfter(
                candidate.getPrimaryServiceId(), now.truncatedTo(ChronoUnit.DAYS));
        if (createdToday >= properties.getRateLimit().getMaxRisksPerServicePerDay()) {
            auditLogger.logRateLimited(candidate, dedupe.getDedupeKey(), createdToday);
            return PipelineResult.of(PipelineResult.Outcome.RATE_LIMITED, null, Set.of());
        }

        RiskEntity risk = persistenceService.createRisk(candidate, decision, dedupe.getDedupeKey(), now);
        auditLogger.logTransition(risk.getId(), risk.getDedupeKey(), null, risk.getLifecycleState(),
                risk.getApprovalStatus(), decision.getReasoning(), true, risk.getConfidence(), SYSTEM_ACTOR);
        dedupeKeyCache.store(DedupeRecord.builder()
                .dedupeKey(risk.getDedupeKey())
                .riskId(risk.getId())
                .createdAt(risk.getCreatedAt())
                .build());
        return PipelineResult.of(PipelineResult.Outcome.CREATED, risk.getId(), Set.of());
    }

    private PipelineResult processDependencyChange(RiskUpdateEventEntity event) {
        Long serviceId = requireEntityId(event);
        Set<Long> affected = new LinkedHashSet<>();
        affected.add(serviceId);
        for (ServiceDependencyEntity dependency : graph.dependentsOf(serviceId)) {
            affected.add(dependency.getServiceId());
        }
        return PipelineResult.of(PipelineResult.Outcome.RECOMPUTE_ONLY, null, affected);
    }

    private PipelineResult processRiskStatusChange(RiskUpdateEventEntity event) {
        Long riskId = requireEntityId(event);
        RiskEntity risk = riskRepository.findById(riskId)
                .orElseThrow(() -> new EventValidationException("Risk " + riskId + " referenced by event " + event.getEventId() + " does not exist"));
        Set<Long> affected = new LinkedHashSet<>(directServicesOf(risk));
        if (risk.isActive()) {
            affected.addAll(cascade(risk));
        } else {
            for (ServiceRiskAssociationEntity association : associationRepository.findByRiskId(riskId)) {
                affected.add(association.getServiceId());
            }
        }
        return PipelineResult.of(PipelineResult.Outcome.RECOMPUTE_ONLY, riskId, affected);
    }

    private Set<Long> cascade(RiskEntity risk) {
        Set<Long> impacted = new LinkedHashSet<>();
        if (!cascadePropagator.isEligible(risk)) {
            return impacted;
        }
        CascadeResult result = cascadePropagator.propagate(risk);
        for (CascadeImpact impact : result.getImpacts()) {
            impacted.add(impact.getServiceId());
        }
        return impacted;
    }

    private Set<Long> directServicesOf(RiskEntity risk) {
        Set<Long> services = new LinkedHashSet<>();
        services.add(risk.getPrimaryServiceId());
        for (ServiceRiskAssociationEntity association : associationRepository.findByRiskId(risk.getId())) {
            if (association.getCascadingType() == CascadingType.DIRECT) {
                services.add(association.getServiceId());
            }
        }
        return services;
    }

    private boolean isOwnRisk(Long riskId, String eventId) {
        return eventId != null && riskRepository.findById(riskId)
                .map(r -> eventId.equals(r.getSourceEventId()))
                .orElse(false);
    }

    private static Long requireEntityId(RiskUpdateEventEntity event) {
        if (event.getEntityId() == null) {
            throw new EventValidationException(event.getEventType() + " event " + event.getEventId() + " has no entity id");
        }
        return event.getEntityId();
    }
}
