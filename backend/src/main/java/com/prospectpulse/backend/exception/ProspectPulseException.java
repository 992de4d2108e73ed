package com.prospectpulse.backend.exception;

/**
 * Base type for failures raised by the coordination layer.
 */
public abstract class ProspectPulseException extends RuntimeException {

    protected ProspectPulseException(String message) {
        super(message);
    }

    protected ProspectPulseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable code used in API error bodies.
     */
    public abstract String getErrorCode();
}
