package com.grc.riskengine.scoring;

import com.grc.riskengine.advisory.AdvisoryRecommendation;
import com.grc.riskengine.advisory.RiskAdvisoryService;
import com.grc.riskengine.domain.Prediction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Primary predictor: turns the advisory service's recommendation into a score.
 */
@Component
@RequiredArgsConstructor
public class AdvisoryRiskPredictor implements RiskPredictor {

    static final String SOURCE = "advisory";

    private final RiskAdvisoryService advisoryService;

    public boolean isAvailable() {
        return advisoryService.isEnabled();
    }

    @Override
    public Prediction predict(ScoringFeatures features) {
        AdvisoryRecommendation recommendation = advisoryService.classify(features.toAdvisoryContext())
                .orElseThrow(() -> new PredictionUnavailableException(
                        "No advisory answer for service " + features.getServiceId()));
        double score = recommendation.getScore() != null
                ? recommendation.getScore()
                : scoreForLabel(recommendation.getRecommendation());
        return Prediction.builder()
                .score(clamp(score, 0, 100))
                .confidence(clamp(recommendation.getConfidence(), 0, 1))
                .source(SOURCE)
                .reasoning(recommendation.getReasoning())
                .build();
    }

    static double scoreForLabel(String label) {
        if (label == null) {
            throw new PredictionUnavailableException("Advisory recommendation missing");
        }
        switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "critical":
                return 90;
            case "high":
                return 75;
            case "medium":
                return 50;
            case "low":
                return 25;
            default:
                throw new PredictionUnavailableException("Unrecognized advisory recommendation: " + label);
        }
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
