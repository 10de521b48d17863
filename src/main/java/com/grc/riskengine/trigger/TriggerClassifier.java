package com.grc.riskengine.trigger;

import com.grc.riskengine.domain.RiskCategory;
import com.grc.riskengine.domain.TriggerDescriptor;
import com.grc.riskengine.domain.Urgency;
import com.grc.riskengine.domain.trigger.ComplianceTrigger;
import com.grc.riskengine.domain.trigger.OperationalTrigger;
import com.grc.riskengine.domain.trigger.SecurityTrigger;
import com.grc.riskengine.domain.trigger.StrategicTrigger;
import com.grc.riskengine.domain.trigger.TriggerSignal;
import com.grc.riskengine.intel.ThreatCorrelation;
import com.grc.riskengine.intel.ThreatIntelCorrelationClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a raw trigger to {category, confidence, urgency, auto-approve eligibility}.
 * Security triggers are corroborated against threat intel when the service answers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TriggerClassifier {

    private static final double DEFAULT_SECURITY_CONFIDENCE = 0.6;
    private static final double MAX_CORROBORATED_CONFIDENCE = 0.95;

    private final ThreatIntelCorrelationClient correlationClient;

    public TriggerDescriptor classify(TriggerSignal signal) {
        switch (signal.getCategory()) {
            case SECURITY:
                return classifySecurity((SecurityTrigger) signal);
            case OPERATIONAL:
                return classifyOperational((OperationalTrigger) signal);
            case COMPLIANCE:
                return classifyCompliance((ComplianceTrigger) signal);
            case STRATEGIC:
                return classifyStrategic((StrategicTrigger) signal);
            default:
                throw new IllegalArgumentException("Unknown trigger category " + signal.getCategory());
        }
    }

    TriggerDescriptor classifySecurity(SecurityTrigger t) {
        double confidence = t.getReportedConfidence() > 0 ? clamp(t.getReportedConfidence()) : DEFAULT_SECURITY_CONFIDENCE;
        boolean eligible = false;
        boolean knownExploited = false;
        switch (t.getType()) {
            case DEFENDER_INCIDENT:
                if (t.getSeverityScore() >= 75) {
                    confidence = Math.max(confidence, 0.85);
                    eligible = true;
                }
                break;
            case KEV_CVE:
                confidence = 0.95;
                eligible = true;
                knownExploited = true;
                break;
            case TI_CORROBORATION:
                if (t.getIndicators() != null && t.getIndicators().size() >= 3) {
                    confidence = Math.max(confidence, 0.80);
                }
                break;
            case MULTI_STAGE_ATTACK:
                if (t.getKillChainCoverage() != null && t.getKillChainCoverage() >= 0.6) {
                    confidence = Math.max(confidence, 0.85);
                    eligible = true;
                }
                break;
            case DATA_EXFILTRATION:
                confidence = 0.95;
                eligible = true;
                break;
        }
        Urgency urgency = t.getSeverityScore() >= 80 ? Urgency.CRITICAL
                : t.getSeverityScore() >= 60 ? Urgency.HIGH : Urgency.MEDIUM;

        List<ThreatCorrelation> correlations = correlate(t);
        if (!correlations.isEmpty()) {
            double corroborated = correlations.stream().mapToDouble(ThreatCorrelation::getConfidence).max().orElse(0);
            confidence = Math.max(confidence, Math.min(MAX_CORROBORATED_CONFIDENCE, clamp(corroborated)));
            if (correlations.stream().anyMatch(ThreatCorrelation::isActiveExploitation)) {
                urgency = Urgency.CRITICAL;
                eligible = eligible || confidence >= 0.85;
            } else if (urgency == Urgency.MEDIUM && correlations.stream().anyMatch(ThreatCorrelation::isTrendingUp)) {
                urgency = Urgency.HIGH;
            }
        }
        return descriptor(RiskCategory.SECURITY, t.getType().name(), t.getSourceSystem(), confidence, urgency, eligible, knownExploited);
    }

    TriggerDescriptor classifyOperational(OperationalTrigger t) {
        double confidence = 0.7;
        boolean eligible = false;
        int recurrence = t.getRecurrenceCount() != null ? t.getRecurrenceCount() : 0;
        double impactHours = t.getBusinessImpactHours() != null ? t.getBusinessImpactHours() : 0;
        switch (t.getType()) {
            case REPEATED_INCIDENTS:
                if (recurrence >= 2) {
                    confidence = 0.8;
                    eligible = recurrence >= 3;
                }
                break;
            case FAILED_CHANGE:
                if (impactHours > 1) {
                    confidence = 0.85;
                    eligible = true;
                }
                break;
            case CAPACITY_EXHAUSTION:
                confidence = 0.75;
                break;
            case SLA_BREACH:
                confidence = 0.6;
                break;
        }
        Urgency urgency = impactHours > 4 ? Urgency.CRITICAL
                : recurrence >= 3 ? Urgency.HIGH : Urgency.MEDIUM;
        return descriptor(RiskCategory.OPERATIONAL, t.getType().name(), t.getSourceSystem(), confidence, urgency, eligible, false);
    }

    TriggerDescriptor classifyCompliance(ComplianceTrigger t) {
        double confidence = 0.8;
        boolean eligible = false;
        Urgency urgency = t.isRegulatoryRisk() ? Urgency.HIGH : Urgency.MEDIUM;
        switch (t.getType()) {
            case COVERAGE_GAP:
                if (t.getCoverageGapPercent() > 20) {
                    confidence = 0.85;
                    eligible = t.isRegulatoryRisk();
                }
                break;
            case AUDIT_FINDING:
            case CONTROL_DISABLED:
                confidence = 0.9;
                eligible = true;
                urgency = Urgency.HIGH;
                break;
            case STALE_EVIDENCE:
                confidence = 0.7;
                break;
        }
        return descriptor(RiskCategory.COMPLIANCE, t.getType().name(), t.getSourceSystem(), confidence, urgency, eligible, false);
    }

    TriggerDescriptor classifyStrategic(StrategicTrigger t) {
        double confidence = 0.6;
        boolean eligible = false;
        switch (t.getType()) {
            case VENDOR_BREACH:
                confidence = 0.8;
                eligible = t.getEstimatedImpact() > 1_000_000;
                break;
            case GEO_ESCALATION:
                confidence = 0.7;
                break;
            case REGULATORY_MANDATE:
                confidence = 0.85;
                eligible = t.getTimelineDays() != null && t.getTimelineDays() < 90;
                break;
            case SUPPLY_CHAIN_RISK:
                confidence = 0.75;
                break;
        }
        Urgency urgency = t.getEstimatedImpact() > 500_000 ? Urgency.HIGH : Urgency.MEDIUM;
        return descriptor(RiskCategory.STRATEGIC, t.getType().name(), t.getSourceSystem(), confidence, urgency, eligible, false);
    }

    private List<ThreatCorrelation> correlate(SecurityTrigger t) {
        List<String> threats = new ArrayList<>();
        if (t.getThreatActors() != null) threats.addAll(t.getThreatActors());
        if (t.getTechniques() != null) threats.addAll(t.getTechniques());
        List<String> vulnerabilities = t.getCveIds() != null ? t.getCveIds() : List.of();
        if (threats.isEmpty() && vulnerabilities.isEmpty()) return List.of();
        try {
            List<ThreatCorrelation> result = correlationClient.correlate(threats, vulnerabilities);
            return result != null ? result : List.of();
        } catch (Exception e) {
            log.warn("Threat-intel correlation failed, classifying without it: {}", e.getMessage());
            return List.of();
        }
    }

    private static TriggerDescriptor descriptor(RiskCategory category, String sourceType, String sourceSystem,
                                                double confidence, Urgency urgency, boolean eligible, boolean kev) {
        return TriggerDescriptor.builder()
                .category(category)
                .sourceType(sourceType)
                .sourceSystem(sourceSystem)
                .confidence(clamp(confidence))
                .urgency(urgency)
                .autoApproveEligible(eligible)
                .knownExploited(kev)
                .build();
    }

    private static double clamp(double v) {
        return Math.max(0, Math.min(1, v));
    }
}
