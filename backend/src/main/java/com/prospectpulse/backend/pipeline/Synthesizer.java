package com.prospectpulse.backend.pipeline;

import com.prospectpulse.backend.exception.StageFailedException;

import java.util.Map;

/**
 * Final stage: combines mined signals and validation into the lead record
 * that gets persisted ({@code company, fit_score, wedge, tech_stack, signals}).
 */
@FunctionalInterface
public interface Synthesizer {

    /**
     * @throws StageFailedException if no record can be produced
     */
    Map<String, Object> synthesize(Map<String, Object> lead, Map<String, Object> mined, Map<String, Object> validated);
}
