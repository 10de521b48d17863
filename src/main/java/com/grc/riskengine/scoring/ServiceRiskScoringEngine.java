package com.grc.riskengine.scoring;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.core.ServiceLockRegistry;
import com.grc.riskengine.domain.CascadingType;
import com.grc.riskengine.domain.DependencyCriticality;
import com.grc.riskengine.domain.Prediction;
import com.grc.riskengine.domain.RiskCandidate;
import com.grc.riskengine.domain.RiskCategory;
import com.grc.riskengine.domain.RiskTrend;
import com.grc.riskengine.domain.ScoreBreakdown;
import com.grc.riskengine.domain.ServiceRiskScore;
import com.grc.riskengine.graph.DependencyGraphAccessor;
import com.grc.riskengine.persistence.entity.RiskEntity;
import com.grc.riskengine.persistence.entity.ServiceDependencyEntity;
import com.grc.riskengine.persistence.entity.ServiceEntity;
import com.grc.riskengine.persistence.entity.ServiceRiskAssociationEntity;
import com.grc.riskengine.persistence.repository.RiskRepository;
import com.grc.riskengine.persistence.repository.ServiceRiskAssociationRepository;
import com.grc.riskengine.persistence.service.ServiceScorePersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes a service's composite 0–100 risk score from CIA impact, dependency impact,
 * correlated risks, business and technical factors and incident history, blended with
 * a predictor's score by the predictor's confidence.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServiceRiskScoringEngine {

    private static final double HIGH_SEVERITY_SCORE = 60;

    private final DependencyGraphAccessor graph;
    private final ServiceRiskAssociationRepository associationRepository;
    private final RiskRepository riskRepository;
    private final ResilientRiskPredictor predictor;
    private final ServiceScorePersistenceService persistenceService;
    private final ServiceLockRegistry lockRegistry;
    private final RiskEngineProperties properties;
    private final Clock clock;

    /**
     * Full recompute under the service lock. Either the new score, trend and history row
     * are all stored, or the exception propagates and the prior state is kept.
     */
    public ServiceRiskScore recompute(Long serviceId) {
        return lockRegistry.withLock(serviceId, () -> {
            ServiceEntity service = graph.findService(serviceId)
                    .orElseThrow(() -> new ServiceNotFoundException(serviceId));
            ServiceRiskScore score = score(service, gatherContributions(serviceId), gatherPropagated(serviceId));
            persistenceService.persist(service, score);
            log.info("Recomputed service {} ({}): {} -> {} trend={} via {}",
                    serviceId, service.getName(), score.getPreviousScore(), score.getCompositeScore(),
                    score.getTrend(), score.getBreakdown().getPredictionSource());
            return score;
        });
    }

    /**
     * Scores the candidate's primary service as if the candidate were an active direct risk.
     * Nothing is stored.
     */
    public ScoreBreakdown evaluateCandidate(RiskCandidate candidate) {
        Long serviceId = candidate.getPrimaryServiceId();
        ServiceEntity service = graph.findService(serviceId)
                .orElseThrow(() -> new ServiceNotFoundException(serviceId));
        List<ScoreContribution> direct = new ArrayList<>(gatherContributions(serviceId));
        direct.add(ScoreContribution.builder()
                .riskId(null)
                .score(candidate.getSeverity() * candidate.getLikelihood() * 4.0)
                .confidence(candidate.getConfidence())
                .weight(1.0)
                .severity(candidate.getSeverity())
                .likelihood(candidate.getLikelihood())
                .confidentialityImpact(candidate.getConfidentialityImpact())
                .integrityImpact(candidate.getIntegrityImpact())
                .availabilityImpact(candidate.getAvailabilityImpact())
                .type(CascadingType.DIRECT)
                .build());
        return score(service, direct, gatherPropagated(serviceId)).getBreakdown();
    }

    ServiceRiskScore score(ServiceEntity service, List<ScoreContribution> direct, List<ScoreContribution> propagated) {
        Map<Long, ScoreContribution> merged = mergeContributions(direct, propagated);
        List<ScoreContribution> all = new ArrayList<>(merged.values());
        direct.stream().filter(c -> c.getRiskId() == null).forEach(all::add);

        int[] cia = weightedCia(all);
        double ciaWeighted = (cia[0] * 0.3 + cia[1] * 0.4 + cia[2] * 0.3) * 10;

        List<ServiceDependencyEntity> dependencies = graph.dependenciesOf(service.getId());
        long highDependencies = dependencies.stream()
                .filter(d -> d.getCriticality() == DependencyCriticality.HIGH)
                .count();
        double propagatedLoad = propagated.stream().mapToDouble(c -> c.getScore() * c.getWeight()).sum();
        double dependencyImpact = Math.min(100, dependencies.size() * 3 + highDependencies * 12 + propagatedLoad / 10);

        int highSeverity = (int) all.stream().filter(c -> c.getScore() >= HIGH_SEVERITY_SCORE).count();
        double riskCorrelation = Math.min(100, all.size() * 5 + highSeverity * 15 + weightedAggregate(all) * 0.5);

        CriticalityProfile profile = CriticalityProfile.of(service.getCriticalityLevel());
        double businessImpact = profile.businessImpactScore();
        double technical = profile.technicalScore();
        double historical = historicalScore(service.getId(), all.size(), highSeverity);

        RiskEngineProperties.Scoring weights = properties.getScoring();
        double algorithmic = clamp(ciaWeighted * weights.getCiaWeight()
                + dependencyImpact * weights.getDependencyWeight()
                + riskCorrelation * weights.getRiskCorrelationWeight()
                + businessImpact * weights.getBusinessWeight()
                + technical * weights.getTechnicalWeight()
                + historical * weights.getHistoricalWeight(), 0, 100);

        ScoringFeatures features = ScoringFeatures.builder()
                .serviceId(service.getId())
                .serviceName(service.getName())
                .criticalityLevel(service.getCriticalityLevel())
                .ciaWeighted(ciaWeighted)
                .dependencyImpact(dependencyImpact)
                .riskCorrelation(riskCorrelation)
                .businessImpact(businessImpact)
                .technical(technical)
                .historical(historical)
                .contributingRiskCount(all.size())
                .highSeverityRiskCount(highSeverity)
                .build();
        Prediction prediction = predictor.predict(features);
        double predictionConfidence = clamp(prediction.getConfidence(), 0, 1);
        double blended = algorithmic * (1 - predictionConfidence) + prediction.getScore() * predictionConfidence;

        // Only risks mapped to this service count; propagated load is already in dependencyImpact.
        long highConfidence = direct.stream()
                .filter(c -> c.getConfidence() > weights.getHighConfidenceRiskThreshold())
                .count();
        double boost = Math.min(weights.getMaxBoost(), highConfidence * weights.getBoostPerRisk());
        double composite = round2(clamp(blended + boost, 0, 100));

        Double previous = service.getAggregateRiskScore();
        ScoreBreakdown breakdown = ScoreBreakdown.builder()
                .ciaWeighted(round2(ciaWeighted))
                .dependencyImpact(round2(dependencyImpact))
                .riskCorrelation(round2(riskCorrelation))
                .businessImpact(round2(businessImpact))
                .technical(round2(technical))
                .historical(round2(historical))
                .algorithmicScore(round2(algorithmic))
                .predictionScore(round2(prediction.getScore()))
                .predictionConfidence(predictionConfidence)
                .predictionSource(prediction.getSource())
                .cascadingBoost(boost)
                .compositeScore(composite)
                .build();
        return ServiceRiskScore.builder()
                .serviceId(service.getId())
                .serviceName(service.getName())
                .previousScore(previous)
                .compositeScore(composite)
                .trend(trend(previous, composite))
                .confidentialityScore(cia[0])
                .integrityScore(cia[1])
                .availabilityScore(cia[2])
                .contributingRiskCount(all.size())
                .breakdown(breakdown)
                .computedAt(Instant.now(clock))
                .build();
    }

    RiskTrend trend(Double previous, double current) {
        if (previous == null) return RiskTrend.STABLE;
        double delta = current - previous;
        double threshold = properties.getScoring().getTrendThreshold();
        if (delta > threshold) return RiskTrend.INCREASING;
        if (delta < -threshold) return RiskTrend.DECREASING;
        return RiskTrend.STABLE;
    }

    /** Active risks associated with the service through effective associations. */
    private List<ScoreContribution> gatherContributions(Long serviceId) {
        List<ServiceRiskAssociationEntity> associations = associationRepository.findByServiceId(serviceId).stream()
                .filter(ServiceRiskAssociationEntity::isEffective)
                .collect(Collectors.toList());
        if (associations.isEmpty()) return List.of();
        Map<Long, RiskEntity> risks = activeRisks(associations);
        List<ScoreContribution> out = new ArrayList<>();
        for (ServiceRiskAssociationEntity a : associations) {
            RiskEntity risk = risks.get(a.getRiskId());
            if (risk == null) continue;
            double confidence = a.getCascadingType() == CascadingType.DIRECT
                    ? risk.getConfidence()
                    : Math.min(risk.getConfidence(), a.getConfidence());
            out.add(toContribution(risk, a.getWeight(), confidence, a.getCascadingType()));
        }
        return out;
    }

    /**
     * Direct risks on services this one depends on, weighted by the edge's propagation factor
     * and decayed one hop. A risk this service already has its own association for, effective or
     * still awaiting review, is not propagated again.
     */
    private List<ScoreContribution> gatherPropagated(Long serviceId) {
        Set<Long> ownRisks = associationRepository.findByServiceId(serviceId).stream()
                .map(ServiceRiskAssociationEntity::getRiskId)
                .collect(Collectors.toSet());
        double hopDecay = properties.getCascade().getHopDecay();
        List<ScoreContribution> out = new ArrayList<>();
        for (ServiceDependencyEntity edge : graph.dependenciesOf(serviceId)) {
            if (serviceId.equals(edge.getDependsOnServiceId())) continue;
            double factor = edge.effectivePropagationFactor();
            for (ScoreContribution upstream : gatherContributions(edge.getDependsOnServiceId())) {
                if (upstream.getType() != CascadingType.DIRECT) continue;
                if (ownRisks.contains(upstream.getRiskId())) continue;
                out.add(upstream.toBuilder()
                        .weight(upstream.getWeight() * factor)
                        .confidence(upstream.getConfidence() * hopDecay)
                        .type(CascadingType.DEPENDENCY)
                        .build());
            }
        }
        return out;
    }

    private Map<Long, RiskEntity> activeRisks(List<ServiceRiskAssociationEntity> associations) {
        List<Long> ids = associations.stream().map(ServiceRiskAssociationEntity::getRiskId).distinct().collect(Collectors.toList());
        return riskRepository.findAllById(ids).stream()
                .filter(RiskEntity::isActive)
                .collect(Collectors.toMap(RiskEntity::getId, Function.identity()));
    }

    private static ScoreContribution toContribution(RiskEntity risk, double weight, double confidence, CascadingType type) {
        return ScoreContribution.builder()
                .riskId(risk.getId())
                .score(risk.getCompositeScore())
                .confidence(confidence)
                .weight(weight)
                .severity(risk.getSeverity())
                .likelihood(risk.getLikelihood())
                .confidentialityImpact(risk.getConfidentialityImpact())
                .integrityImpact(risk.getIntegrityImpact())
                .availabilityImpact(risk.getAvailabilityImpact())
                .type(type)
                .build();
    }

    /** A risk reached several ways counts once, at its heaviest weight. */
    private static Map<Long, ScoreContribution> mergeContributions(List<ScoreContribution> direct,
                                                                   List<ScoreContribution> propagated) {
        Map<Long, ScoreContribution> byRisk = new LinkedHashMap<>();
        for (List<ScoreContribution> source : List.of(direct, propagated)) {
            for (ScoreContribution c : source) {
                if (c.getRiskId() == null) continue;
                byRisk.merge(c.getRiskId(), c, (a, b) -> a.getWeight() >= b.getWeight() ? a : b);
            }
        }
        return byRisk;
    }

    /** CIA sub-scores 1–10 as a (severity × likelihood / 25)-weighted mean; 1 when nothing contributes. */
    static int[] weightedCia(List<ScoreContribution> contributions) {
        double totalWeight = 0;
        double c = 0, i = 0, a = 0;
        for (ScoreContribution contribution : contributions) {
            double riskWeight = clamp(contribution.getSeverity() * contribution.getLikelihood() / 25.0, 0, 1)
                    * contribution.getWeight();
            if (riskWeight <= 0) continue;
            c += contribution.getConfidentialityImpact() * riskWeight;
            i += contribution.getIntegrityImpact() * riskWeight;
            a += contribution.getAvailabilityImpact() * riskWeight;
            totalWeight += riskWeight;
        }
        if (totalWeight == 0) return new int[]{1, 1, 1};
        return new int[]{
                (int) Math.round(clamp(c / totalWeight, 1, 10)),
                (int) Math.round(clamp(i / totalWeight, 1, 10)),
                (int) Math.round(clamp(a / totalWeight, 1, 10))
        };
    }

    /** Σ(score × weight × confidence) / Σweight. */
    static double weightedAggregate(List<ScoreContribution> contributions) {
        double weighted = 0;
        double totalWeight = 0;
        for (ScoreContribution c : contributions) {
            weighted += c.getScore() * c.getWeight() * c.getConfidence();
            totalWeight += c.getWeight();
        }
        return totalWeight > 0 ? weighted / totalWeight : 0;
    }

    private double historicalScore(Long serviceId, int riskCount, int highSeverity) {
        Instant since = Instant.now(clock).minus(properties.getScoring().getIncidentLookback());
        long incidents = riskRepository.countByPrimaryServiceIdAndCreatedAtAfter(serviceId, since);
        long securityEvents = riskRepository.countByPrimaryServiceIdAndCategoryAndCreatedAtAfter(
                serviceId, RiskCategory.SECURITY, since);
        double highSeverityRatio = riskCount > 0 ? (double) highSeverity / riskCount : 0;
        return Math.min(100, incidents * 10 + highSeverityRatio * 15 + securityEvents * 8);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    /** Seen by callers as a permanent failure for the event that referenced the service. */
    public static class ServiceNotFoundException extends RuntimeException {
        public ServiceNotFoundException(Long serviceId) {
            super("Service not found: " + serviceId);
        }
    }
}
