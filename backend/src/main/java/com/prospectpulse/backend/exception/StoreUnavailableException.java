package com.prospectpulse.backend.exception;

/**
 * The shared store could not be reached and no fallback is permitted.
 */
public class StoreUnavailableException extends ProspectPulseException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "STORE_UNAVAILABLE";
    }
}
