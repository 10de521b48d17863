package com.grc.riskengine.scoring;

import com.grc.riskengine.domain.Prediction;

/**
 * Produces a (score, confidence) prediction from a feature vector.
 */
public interface RiskPredictor {

    /**
     * @throws PredictionUnavailableException when this predictor cannot answer
     */
    Prediction predict(ScoringFeatures features);
}
