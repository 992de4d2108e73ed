package com.prospectpulse.backend.store;

import java.util.Locale;

/**
 * How the process reacts when the shared store cannot be reached.
 */
public enum StorePosture {
    /** Fall back to a process-local in-memory store. */
    DEVELOPMENT,
    /** Fail the call with {@link com.prospectpulse.backend.exception.StoreUnavailableException}. */
    PRODUCTION;

    public static StorePosture parse(String value) {
        if (value == null || value.isBlank()) {
            return DEVELOPMENT;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
