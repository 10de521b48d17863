package com.grc.riskengine.cascade;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.core.ServiceLockRegistry;
import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.CascadeImpact;
import com.grc.riskengine.domain.CascadeResult;
import com.grc.riskengine.domain.CascadingType;
import com.grc.riskengine.graph.DependencyGraphAccessor;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.entity.ServiceDependencyEntity;
import com.grc.riskengine.persistence.entity.ServiceRiskAssociationEntity;
import com.grc.riskengine.persistence.repository.ServiceRiskAssociationRepository;
import com.grc.riskengine.persistence.service.RiskPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pushes an approved risk's impact from its directly associated services out to their
 * dependents. Breadth-first, bounded by depth, never revisits a service within one
 * traversal. Each hop multiplies the score by the edge's propagation factor and the
 * carried confidence, and decays the confidence by a fixed factor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskCascadePropagator {

    private final DependencyGraphAccessor graph;
    private final ServiceRiskAssociationRepository associationRepository;
    private final RiskPersistenceService persistenceService;
    private final ServiceLockRegistry lockRegistry;
    private final RiskEngineProperties properties;

    public boolean isEligible(RiskEntity risk) {
        return risk.getApprovalStatus() == ApprovalStatus.APPROVED
                && risk.getConfidence() >= properties.getCascade().getConfidenceThreshold();
    }

    public CascadeResult propagate(RiskEntity risk) {
        if (risk.getApprovalStatus() != ApprovalStatus.APPROVED) {
            return CascadeResult.skipped(risk.getId(), "Risk is not approved");
        }
        RiskEngineProperties.Cascade config = properties.getCascade();
        if (risk.getConfidence() < config.getConfidenceThreshold()) {
            return CascadeResult.skipped(risk.getId(), "Confidence " + risk.getConfidence() + " below cascade threshold");
        }
        if (risk.getCompositeScore() <= 0) {
            return CascadeResult.skipped(risk.getId(), "Risk has no score to propagate");
        }

        Set<Long> directServices = directServices(risk);
        Set<Long> visited = new HashSet<>(directServices);
        Deque<Hop> queue = new ArrayDeque<>();
        for (Long serviceId : directServices) {
            queue.add(new Hop(serviceId, 0, risk.getCompositeScore(), risk.getConfidence()));
        }

        List<CascadeImpact> impacts = new ArrayList<>();
        while (!queue.isEmpty()) {
            Hop hop = queue.poll();
            if (hop.depth() >= config.getMaxDepth()) continue;
            for (ServiceDependencyEntity edge : graph.dependentsOf(hop.serviceId())) {
                Long dependent = edge.getServiceId();
                if (!visited.add(dependent)) continue;
                double cascadedScore = round2(hop.score() * edge.effectivePropagationFactor() * hop.confidence());
                if (cascadedScore <= 0) continue;
                double cascadedConfidence = hop.confidence() * config.getHopDecay();
                CascadeImpact impact = CascadeImpact.builder()
                        .serviceId(dependent)
                        .viaServiceId(hop.serviceId())
                        .depth(hop.depth() + 1)
                        .cascadedScore(cascadedScore)
                        .cascadedConfidence(cascadedConfidence)
                        .weight(Math.min(1.0, cascadedScore / risk.getCompositeScore()))
                        .requiresApproval(cascadedScore > config.getApprovalScoreThreshold())
                        .build();
                boolean applied = lockRegistry.withLock(dependent,
                        () -> persistenceService.upsertCascadeAssociation(risk.getId(), impact));
                if (applied) {
                    impacts.add(impact);
                    log.debug("Cascaded risk {} to service {} (depth {}) score={} confidence={} requiresApproval={}",
                            risk.getId(), dependent, impact.getDepth(), cascadedScore, cascadedConfidence, impact.isRequiresApproval());
                }
                if (cascadedScore >= config.getMinCascadedScore()) {
                    queue.add(new Hop(dependent, hop.depth() + 1, cascadedScore, cascadedConfidence));
                }
            }
        }
        long flagged = impacts.stream().filter(CascadeImpact::isRequiresApproval).count();
        log.info("Cascade for risk {} reached {} services ({} flagged for review)", risk.getId(), impacts.size(), flagged);
        return CascadeResult.builder()
                .riskId(risk.getId())
                .triggered(true)
                .impacts(impacts)
                .reason(impacts.isEmpty() ? "No dependents reached" : "Cascade applied")
                .build();
    }

    private Set<Long> directServices(RiskEntity risk) {
        Set<Long> out = new LinkedHashSet<>();
        out.add(risk.getPrimaryServiceId());
        for (ServiceRiskAssociationEntity a : associationRepository.findByRiskId(risk.getId())) {
            if (a.getCascadingType() == CascadingType.DIRECT) out.add(a.getServiceId());
        }
        return out;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private record Hop(Long serviceId, int depth, double score, double confidence) {
    }
}
