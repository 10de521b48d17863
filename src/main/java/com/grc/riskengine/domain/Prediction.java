package com.grc.riskengine.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Output of a risk predictor: a 0–100 score and the predictor's confidence in it.
 */
@Value
@Builder
public class Prediction {

    double score;
    double confidence;
    /** Which predictor produced this (advisory, rule-based). */
    String source;
    String reasoning;
}
