package com.grc.riskengine.core;

/**
 * Transient processing failure. The event stays queued and is retried next cycle.
 */
public class RiskProcessingException extends RuntimeException {

    public RiskProcessingException(String message) {
        super(message);
    }

    public RiskProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
