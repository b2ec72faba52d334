package com.warden.core.audit;

/**
 * Thrown when a decision record cannot be written to or read from JSON.
 */
public class DecisionSerializationException extends RuntimeException {

    public DecisionSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
