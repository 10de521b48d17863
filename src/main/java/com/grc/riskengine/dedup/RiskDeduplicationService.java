package com.grc.riskengine.dedup;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.domain.ApprovalStatus;
import com.grc.riskengine.domain.DedupeAction;
import com.grc.riskengine.domain.DedupeResult;
import com.grc.riskengine.domain.LifecycleState;
import com.grc.riskengine.domain.RiskCandidate;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.repository.RiskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a candidate is an exact duplicate (suppress), a near-duplicate of an
 * active or pending risk (merge) or new (create). Lookup errors fail open to create.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskDeduplicationService {

    private final DedupeKeyGenerator keyGenerator;
    private final DedupeKeyCache dedupeKeyCache;
    private final RiskRepository riskRepository;
    private final RiskEngineProperties properties;
    private final Clock clock;

    public DedupeResult resolve(RiskCandidate candidate) {
        String dedupeKey = keyGenerator.generate(candidate);
        try {
            Optional<DedupeRecord> exact = dedupeKeyCache.find(dedupeKey);
            if (exact.isPresent()) {
                return DedupeResult.builder()
                        .action(DedupeAction.SUPPRESS)
                        .dedupeKey(dedupeKey)
                        .similarityScore(1.0)
                        .existingRiskId(exact.get().getRiskId())
                        .reason("Exact duplicate of risk " + exact.get().getRiskId())
                        .build();
            }
            return findNearDuplicate(candidate, dedupeKey)
                    .orElseGet(() -> DedupeResult.create(dedupeKey, "No similar risk found"));
        } catch (Exception e) {
            log.error("Dedupe lookup failed for key={}, creating a new risk", dedupeKey, e);
            return DedupeResult.create(dedupeKey, "Dedupe lookup failed: " + e.getMessage());
        }
    }

    private Optional<DedupeResult> findNearDuplicate(RiskCandidate candidate, String dedupeKey) {
        RiskEngineProperties.Dedupe config = properties.getDedupe();
        Instant since = Instant.now(clock).minus(config.getMergeWindow());
        List<RiskEntity> candidates = riskRepository.findMergeCandidates(
                candidate.getPrimaryServiceId(), candidate.getCategory(),
                LifecycleState.ACTIVE, ApprovalStatus.PENDING, since,
                PageRequest.of(0, config.getCandidateLimit()));

        Set<String> evidence = candidate.evidenceIdentifiers();
        RiskEntity best = null;
        double bestScore = -1;
        for (RiskEntity existing : candidates) {
            double title = SimilarityCalculator.titleSimilarity(candidate.getTitle(), existing.getTitle());
            double overlap = SimilarityCalculator.jaccard(evidence, existing.getThreatIntelSources());
            if (title < config.getTitleSimilarityThreshold() || overlap < config.getEvidenceOverlapThreshold()) {
                continue;
            }
            double combined = (title + overlap) / 2;
            if (combined > bestScore) {
                bestScore = combined;
                best = existing;
            }
        }
        if (best == null) return Optional.empty();
        return Optional.of(DedupeResult.builder()
                .action(DedupeAction.MERGE)
                .dedupeKey(dedupeKey)
                .similarityScore(bestScore)
                .existingRiskId(best.getId())
                .reason(String.format("Similar to risk %d (similarity %.3f)", best.getId(), bestScore))
                .build());
    }
}
