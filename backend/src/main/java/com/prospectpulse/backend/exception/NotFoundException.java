package com.prospectpulse.backend.exception;

public class NotFoundException extends ProspectPulseException {

    public NotFoundException(String type, String id) {
        super(type + " not found: " + id);
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
