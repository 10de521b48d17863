package com.grc.riskengine.decision;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.domain.DecisionOutcome;
import com.grc.riskengine.domain.RiskDecision;
import com.grc.riskengine.domain.TriggerDescriptor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Applies the decision thresholds, in order: auto-approve, pending, suppress, then
 * pending as the default for anything that matched none of them cleanly.
 */
@Component
@RequiredArgsConstructor
public class RiskDecisionEngine {

    private final RiskEngineProperties properties;

    public RiskDecision decide(TriggerDescriptor trigger, double compositeScore, double businessCriticalityIndex) {
        RiskEngineProperties.Decision thresholds = properties.getDecision();
        boolean shortcut = thresholds.isKevShortcutEnabled()
                && trigger.isKnownExploited()
                && businessCriticalityIndex >= thresholds.getKevBusinessCriticalityBar();
        return decide(trigger.getConfidence(), compositeScore, shortcut, thresholds);
    }

    public static RiskDecision decide(double confidence, double compositeScore, boolean shortcutMet,
                                      RiskEngineProperties.Decision t) {
        if ((confidence >= t.getAutoApproveConfidence() && compositeScore >= t.getAutoApproveComposite()) || shortcutMet) {
            return decision(DecisionOutcome.AUTO_APPROVE, confidence, compositeScore,
                    shortcutMet ? "Auto-approved: known exploited vulnerability on a business-critical service"
                            : String.format("Auto-approved: confidence=%.2f, composite=%.2f", confidence, compositeScore));
        }
        if (confidence >= t.getPendingConfidenceMin() && compositeScore >= t.getPendingComposite()) {
            return decision(DecisionOutcome.PENDING, confidence, compositeScore,
                    String.format("Pending review: confidence=%.2f, composite=%.2f", confidence, compositeScore));
        }
        if (confidence < t.getSuppressConfidenceMax() || compositeScore < t.getSuppressCompositeMax()) {
            return decision(DecisionOutcome.SUPPRESS, confidence, compositeScore,
                    String.format("Suppressed: confidence=%.2f, composite=%.2f below thresholds", confidence, compositeScore));
        }
        return decision(DecisionOutcome.PENDING, confidence, compositeScore, "Default to pending for manual review");
    }

    private static RiskDecision decision(DecisionOutcome outcome, double confidence, double composite, String reasoning) {
        return RiskDecision.builder()
                .outcome(outcome)
                .confidence(confidence)
                .compositeScore(composite)
                .reasoning(reasoning)
                .build();
    }
}
