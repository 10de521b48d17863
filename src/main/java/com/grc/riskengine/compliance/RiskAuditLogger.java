package com.grc.riskengine.compliance;

import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.DedupeResult;
import com.grc.riskengine.domain.LifecycleState;
import com.grc.riskengine.domain.RiskCandidate;
import com.grc.riskengine.domain.RiskDecision;
import com.grc.riskengine.persistence.entity.RiskStateTransitionEntity;
import com.grc.riskengine.persistence.repository.RiskStateTransitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Audit trail for risk decisions and state transitions: an {@code [AUDIT]} log line plus a
 * transition row. A failed row write is logged and does not fail the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskAuditLogger {

    private final RiskStateTransitionRepository transitionRepository;

    public void logDecision(RiskCandidate candidate, DedupeResult dedupe, RiskDecision decision) {
        log.info("[AUDIT] RISK_DECISION event={} service={} category={} dedupeKey={} dedupe={} outcome={} confidence={} composite={} reason={}",
                candidate.getSourceEventId(),
                candidate.getPrimaryServiceId(),
                candidate.getCategory(),
                dedupe.getDedupeKey(),
                dedupe.getAction(),
                decision != null ? decision.getOutcome() : null,
                candidate.getConfidence(),
                decision != null ? decision.getCompositeScore() : null,
                decision != null ? decision.getReasoning() : dedupe.getReason());
    }

    /** Suppressed candidates leave only this entry behind. */
    public void logSuppressed(RiskCandidate candidate, String dedupeKey, String reason) {
        log.info("[AUDIT] RISK_SUPPRESSED event={} service={} dedupeKey={} reason={}",
                candidate.getSourceEventId(), candidate.getPrimaryServiceId(), dedupeKey, reason);
        save(RiskStateTransitionEntity.builder()
                .dedupeKey(dedupeKey)
                .currentState(LifecycleState.SUPPRESSED)
                .reason(reason)
                .automated(true)
                .confidence(candidate.getConfidence())
                .actor("system")
                .build());
    }

    public void logRateLimited(RiskCandidate candidate, String dedupeKey, long createdToday) {
        log.warn("[AUDIT] RISK_RATE_LIMITED event={} service={} dedupeKey={} createdToday={}",
                candidate.getSourceEventId(), candidate.getPrimaryServiceId(), dedupeKey, createdToday);
    }

    public void logTransition(Long riskId, String dedupeKey, LifecycleState previous, LifecycleState current,
                              ApprovalStatus approval, String reason, boolean automated, Double confidence, String actor) {
        log.info("[AUDIT] RISK_TRANSITION riskId={} {} -> {} approval={} automated={} actor={} reason={}",
                riskId, previous, current, approval, automated, actor, reason);
        save(RiskStateTransitionEntity.builder()
                .riskId(riskId)
                .dedupeKey(dedupeKey)
                .previousState(previous)
                .currentState(current)
                .approvalStatus(approval)
                .reason(reason)
                .automated(automated)
                .confidence(confidence)
                .actor(actor)
                .build());
    }

    private void save(RiskStateTransitionEntity entity) {
        try {
            transitionRepository.save(entity);
        } catch (Exception e) {
            log.error("Failed to persist audit transition for riskId={} dedupeKey={}", entity.getRiskId(), entity.getDedupeKey(), e);
        }
    }
}
