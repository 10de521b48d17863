package com.grc.riskengine.persistence.service;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.domain.ServiceRiskScore;
import com.grc.riskengine.persistence.entity.RiskScoreHistoryEntity;
import com.grc.riskengine.persistence.entity.ServiceEntity;
import com.grc.riskengine.persistence.repository.RiskScoreHistoryRepository;
import com.grc.riskengine.persistence.repository.ServiceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores a recomputed service score, its history row and applies history retention in
 * one transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServiceScorePersistenceService {

    private final ServiceRepository serviceRepository;
    private final RiskScoreHistoryRepository historyRepository;
    private final RiskEngineProperties properties;

    @Transactional
    public void persist(ServiceEntity service, ServiceRiskScore score) {
        service.setConfidentialityScore(score.getConfidentialityScore());
        service.setIntegrityScore(score.getIntegrityScore());
        service.setAvailabilityScore(score.getAvailabilityScore());
        service.setAggregateRiskScore(score.getCompositeScore());
        service.setRiskTrend(score.getTrend());
        service.setLastRiskUpdate(score.getComputedAt());
        serviceRepository.save(service);

        historyRepository.save(RiskScoreHistoryEntity.builder()
                .serviceId(service.getId())
                .previousScore(score.getPreviousScore())
                .compositeScore(score.getCompositeScore())
                .trend(score.getTrend())
                .algorithmicScore(score.getBreakdown().getAlgorithmicScore())
                .predictionScore(score.getBreakdown().getPredictionScore())
                .predictionConfidence(score.getBreakdown().getPredictionConfidence())
                .predictionSource(score.getBreakdown().getPredictionSource())
                .cascadingBoost(score.getBreakdown().getCascadingBoost())
                .recordedAt(score.getComputedAt())
                .build());

        int purged = historyRepository.purgeOlderThan(service.getId(),
                score.getComputedAt().minus(properties.getScoring().getHistoryRetention()));
        if (purged > 0) {
            log.debug("Purged {} score history rows for service {}", purged, service.getId());
        }
    }
}
