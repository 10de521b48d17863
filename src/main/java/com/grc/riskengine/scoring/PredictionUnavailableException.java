package com.grc.riskengine.scoring;

public class PredictionUnavailableException extends RuntimeException {

    public PredictionUnavailableException(String message) {
        super(message);
    }
}
