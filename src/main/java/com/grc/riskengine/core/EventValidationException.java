package com.grc.riskengine.core;

/**
 * Malformed event. The event is failed permanently with this message.
 */
public class EventValidationException extends RuntimeException {

    public EventValidationException(String message) {
        super(message);
    }

    public EventValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
