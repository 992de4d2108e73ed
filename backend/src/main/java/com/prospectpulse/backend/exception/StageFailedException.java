package com.prospectpulse.backend.exception;

import lombok.Getter;

/**
 * A pipeline stage (mine, validate or synthesize) could not transform its input.
 */
@Getter
public class StageFailedException extends ProspectPulseException {

    private final String stage;

    public StageFailedException(String stage, String message) {
        super(stage + " failed: " + message);
        this.stage = stage;
    }

    public StageFailedException(String stage, String message, Throwable cause) {
        super(stage + " failed: " + message, cause);
        this.stage = stage;
    }

    @Override
    public String getErrorCode() {
        return "STAGE_FAILED";
    }
}
