package com.grc.riskengine.scoring;

import com.grc.riskengine.advisory.AdvisoryRecommendation;
import com.grc.riskengine.advisory.RiskAdvisoryService;
import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.domain.Prediction;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResilientRiskPredictorTest {

    @Mock
    private RiskAdvisoryService advisoryService;

    private CircuitBreakerRegistry registry;
    private ResilientRiskPredictor predictor;

    private final ScoringFeatures features = ScoringFeatures.builder()
            .serviceId(3L)
            .ciaWeighted(40)
            .dependencyImpact(40)
            .riskCorrelation(40)
            .businessImpact(40)
            .technical(40)
            .historical(40)
            .build();

    @BeforeEach
    void setUp() {
        RiskEngineProperties properties = new RiskEngineProperties();
        properties.getScoring().getFallback().setNoiseAmplitude(0);
        registry = CircuitBreakerRegistry.ofDefaults();
        predictor = new ResilientRiskPredictor(new AdvisoryRiskPredictor(advisoryService),
                new RuleBasedRiskPredictor(properties), registry);
    }

    @Test
    void usesAdvisoryLabelWhenAvailable() {
        when(advisoryService.isEnabled()).thenReturn(true);
        when(advisoryService.classify(any())).thenReturn(Optional.of(AdvisoryRecommendation.builder()
                .recommendation("High")
                .confidence(0.7)
                .reasoning("exposed and actively targeted")
                .build()));

        Prediction prediction = predictor.predict(features);

        assertThat(prediction.getSource()).isEqualTo("advisory");
        assertThat(prediction.getScore()).isEqualTo(75);
        assertThat(prediction.getConfidence()).isEqualTo(0.7);
    }

    @Test
    void explicitAdvisoryScoreWinsOverLabel() {
        when(advisoryService.isEnabled()).thenReturn(true);
        when(advisoryService.classify(any())).thenReturn(Optional.of(AdvisoryRecommendation.builder()
                .recommendation("low").score(64.0).confidence(0.5).build()));

        assertThat(predictor.predict(features).getScore()).isEqualTo(64.0);
    }

    @Test
    void disabledAdvisoryGoesStraightToFallback() {
        when(advisoryService.isEnabled()).thenReturn(false);

        Prediction prediction = predictor.predict(features);

        assertThat(prediction.getSource()).isEqualTo("rule-based");
        verify(advisoryService, never()).classify(any());
    }

    @Test
    void emptyAdvisoryAnswerFallsBack() {
        when(advisoryService.isEnabled()).thenReturn(true);
        when(advisoryService.classify(any())).thenReturn(Optional.empty());

        Prediction prediction = predictor.predict(features);

        assertThat(prediction.getSource()).isEqualTo("rule-based");
        assertThat(prediction.getScore()).isCloseTo(40.0, within(1e-9));
    }

    @Test
    void unknownLabelFallsBack() {
        when(advisoryService.isEnabled()).thenReturn(true);
        when(advisoryService.classify(any())).thenReturn(Optional.of(AdvisoryRecommendation.builder()
                .recommendation("catastrophic").confidence(0.9).build()));

        assertThat(predictor.predict(features).getSource()).isEqualTo("rule-based");
    }

    @Test
    void openCircuitFallsBackWithoutCallingAdvisory() {
        when(advisoryService.isEnabled()).thenReturn(true);
        registry.circuitBreaker(ResilientRiskPredictor.CIRCUIT_BREAKER).transitionToOpenState();

        Prediction prediction = predictor.predict(features);

        assertThat(prediction.getSource()).isEqualTo("rule-based");
        verify(advisoryService, never()).classify(any());
    }
}
