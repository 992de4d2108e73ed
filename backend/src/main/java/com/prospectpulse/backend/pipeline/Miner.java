package com.prospectpulse.backend.pipeline;

import com.prospectpulse.backend.exception.StageFailedException;

import java.util.Map;

/**
 * First stage: gathers external signals about a lead.
 */
@FunctionalInterface
public interface Miner {

    /**
     * @throws StageFailedException if signals cannot be gathered
     */
    Map<String, Object> mine(Map<String, Object> lead);
}
