package com.prospectpulse.backend.exception;

/**
 * A stored record exists but cannot be read as the expected type, e.g. a
 * workspace hash written by another tool with an unknown provider.
 */
public class InvalidRecordException extends ProspectPulseException {

    public InvalidRecordException(String key, String message, Throwable cause) {
        super("Unreadable record " + key + ": " + message, cause);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_RECORD";
    }
}
