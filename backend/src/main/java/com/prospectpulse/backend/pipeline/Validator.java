package com.prospectpulse.backend.pipeline;

import com.prospectpulse.backend.exception.StageFailedException;

import java.util.Map;

/**
 * Second stage: competitive checks and tech-stack inference.
 */
@FunctionalInterface
public interface Validator {

    /**
     * @throws StageFailedException if the lead cannot be validated
     */
    Map<String, Object> validate(Map<String, Object> lead);
}
