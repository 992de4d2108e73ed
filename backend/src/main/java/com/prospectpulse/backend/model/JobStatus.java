package com.prospectpulse.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a lead-processing job. Transitions only move forward:
 * queued &lt; mining &lt; validating &lt; synthesizing &lt; {complete, failed}.
 */
public enum JobStatus {
    QUEUED(0),
    MINING(1),
    VALIDATING(2),
    SYNTHESIZING(3),
    COMPLETE(4),
    FAILED(4);

    private final int rank;

    JobStatus(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
