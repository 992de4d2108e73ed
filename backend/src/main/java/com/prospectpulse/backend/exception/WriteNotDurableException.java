package com.prospectpulse.backend.exception;

/**
 * A write was accepted by the store but the verifying re-read came back empty.
 */
public class WriteNotDurableException extends ProspectPulseException {

    public WriteNotDurableException(String key) {
        super("Record not found after write: " + key);
    }

    @Override
    public String getErrorCode() {
        return "WRITE_NOT_DURABLE";
    }
}
