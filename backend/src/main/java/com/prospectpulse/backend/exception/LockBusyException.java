package com.prospectpulse.backend.exception;

import lombok.Getter;

/**
 * A distributed lock stayed held by another party after the single retry.
 */
@Getter
public class LockBusyException extends ProspectPulseException {

    private final String resource;

    public LockBusyException(String resource) {
        super("Could not acquire lock for " + resource);
        this.resource = resource;
    }

    @Override
    public String getErrorCode() {
        return "LOCK_BUSY";
    }
}
