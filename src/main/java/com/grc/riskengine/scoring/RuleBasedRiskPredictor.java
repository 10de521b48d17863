package com.grc.riskengine.scoring;

import com.grc.riskengine.config.RiskEngineProperties;
import com.grc.riskengine.domain.Prediction;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Fallback predictor: feature-importance weighted sum of the sub-scores with a small
 * bounded noise term. Always answers.
 */
@Component
public class RuleBasedRiskPredictor implements RiskPredictor {

    static final String SOURCE = "rule-based";

    /** cia, dependency, correlation, business, technical, historical. */
    private static final double[] FEATURE_IMPORTANCE = {0.28, 0.22, 0.18, 0.15, 0.12, 0.05};

    private final double confidence;
    private final double noiseAmplitude;
    private final Random random;

    public RuleBasedRiskPredictor(RiskEngineProperties properties) {
        RiskEngineProperties.Fallback fallback = properties.getScoring().getFallback();
        this.confidence = fallback.getConfidence();
        this.noiseAmplitude = Math.max(0, fallback.getNoiseAmplitude());
        this.random = fallback.getSeed() != null ? new Random(fallback.getSeed()) : new Random();
    }

    @Override
    public Prediction predict(ScoringFeatures features) {
        double[] vector = features.asVector();
        double score = 0;
        for (int i = 0; i < vector.length; i++) {
            score += vector[i] * FEATURE_IMPORTANCE[i];
        }
        if (noiseAmplitude > 0) {
            score += (random.nextDouble() * 2 - 1) * noiseAmplitude;
        }
        return Prediction.builder()
                .score(Math.max(0, Math.min(100, score)))
                .confidence(confidence)
                .source(SOURCE)
                .reasoning("Rule-based estimate from weighted sub-scores")
                .build();
    }
}
