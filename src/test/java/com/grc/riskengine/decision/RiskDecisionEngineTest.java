package com.grc.riskengine.decision;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.domain.DecisionOutcome;
import com.grc.riskengine.domain.RiskCategory;
import com.grc.riskengine.domain.RiskDecision;
import com.grc.riskengine.domain.TriggerDescriptor;
import com.grc.riskengine.domain.Urgency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskDecisionEngineTest {

    private RiskEngineProperties properties;
    private RiskDecisionEngine engine;

    @BeforeEach
    void setUp() {
        properties = new RiskEngineProperties();
        engine = new RiskDecisionEngine(properties);
    }

    private static TriggerDescriptor trigger(double confidence, boolean kev) {
        return TriggerDescriptor.builder()
                .category(RiskCategory.SECURITY)
                .sourceType(kev ? "KEV_CVE" : "DEFENDER_INCIDENT")
                .confidence(confidence)
                .urgency(Urgency.HIGH)
                .knownExploited(kev)
                .build();
    }

    @Test
    void autoApprovesAtBothThresholds() {
        RiskDecision decision = engine.decide(trigger(0.85, false), 80, 50);

        assertThat(decision.getOutcome()).isEqualTo(DecisionOutcome.AUTO_APPROVE);
        assertThat(decision.getOutcome().getInitialState().name()).isEqualTo("ACTIVE");
    }

    @Test
    void justBelowAutoApproveConfidenceIsPending() {
        RiskDecision decision = engine.decide(trigger(0.84, false), 80, 50);

        assertThat(decision.getOutcome()).isEqualTo(DecisionOutcome.PENDING);
        assertThat(decision.getOutcome().getInitialApproval().name()).isEqualTo("PENDING");
    }

    @Test
    void weakSignalIsSuppressed() {
        RiskDecision decision = engine.decide(trigger(0.3, false), 35, 50);

        assertThat(decision.getOutcome()).isEqualTo(DecisionOutcome.SUPPRESS);
    }

    @Test
    void ambiguousMiddleFallsBackToPending() {
        // confidence fine, composite between suppress and pending bars
        RiskDecision decision = engine.decide(trigger(0.6, false), 45, 50);

        assertThat(decision.getOutcome()).isEqualTo(DecisionOutcome.PENDING);
        assertThat(decision.getReasoning()).contains("Default");
    }

    @Test
    void knownExploitedOnCriticalServiceAutoApprovesRegardlessOfComposite() {
        RiskDecision decision = engine.decide(trigger(0.95, true), 30, 80);

        assertThat(decision.getOutcome()).isEqualTo(DecisionOutcome.AUTO_APPROVE);
        assertThat(decision.getReasoning()).contains("known exploited");
    }

    @Test
    void knownExploitedShortcutNeedsBusinessCriticality() {
        RiskDecision decision = engine.decide(trigger(0.95, true), 30, 54);

        assertThat(decision.getOutcome()).isEqualTo(DecisionOutcome.SUPPRESS);
    }

    @Test
    void knownExploitedShortcutCanBeDisabled() {
        properties.getDecision().setKevShortcutEnabled(false);

        RiskDecision decision = engine.decide(trigger(0.95, true), 30, 80);

        assertThat(decision.getOutcome()).isEqualTo(DecisionOutcome.SUPPRESS);
    }
}
